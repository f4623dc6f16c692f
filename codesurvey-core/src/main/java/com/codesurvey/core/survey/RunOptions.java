package com.codesurvey.core.survey;

import com.codesurvey.core.exception.SurveyConfigurationException;

/**
 * Per-run limits of a survey.
 *
 * @param maxRepos stop once this many repositories are completed, or {@code null} for no limit
 * @param maxCodes stop once this many units are analyzed, or {@code null} for no limit
 * @param cancellationToken token that stops the run when cancelled
 */
public record RunOptions(Integer maxRepos, Integer maxCodes, CancellationToken cancellationToken) {

    public RunOptions {
        if (maxRepos != null && maxRepos < 0) {
            throw new SurveyConfigurationException("maxRepos must not be negative: " + maxRepos);
        }
        if (maxCodes != null && maxCodes < 0) {
            throw new SurveyConfigurationException("maxCodes must not be negative: " + maxCodes);
        }
        if (cancellationToken == null) {
            cancellationToken = new CancellationToken();
        }
    }

    public static RunOptions unlimited() {
        return new RunOptions(null, null, null);
    }

    public RunOptions withMaxRepos(Integer maxRepos) {
        return new RunOptions(maxRepos, maxCodes, cancellationToken);
    }

    public RunOptions withMaxCodes(Integer maxCodes) {
        return new RunOptions(maxRepos, maxCodes, cancellationToken);
    }

    public RunOptions withCancellationToken(CancellationToken cancellationToken) {
        return new RunOptions(maxRepos, maxCodes, cancellationToken);
    }
}
