package com.codesurvey.core.survey;

import java.util.Map;

/**
 * Counters reported at the end of a survey run.
 *
 * @param completedRepoCount repositories whose analysis completed in this run
 * @param completedCodeCount units analyzed in this run
 * @param failureCount failures that were logged and skipped
 * @param featureRepoCounts completed repositories with at least one occurrence, keyed by
 *                          {@code analyzer:feature}
 */
public record SurveyRunSummary(
    int completedRepoCount,
    int completedCodeCount,
    int failureCount,
    Map<String, Integer> featureRepoCounts
) {
    public SurveyRunSummary {
        featureRepoCounts = featureRepoCounts == null ? Map.of() : Map.copyOf(featureRepoCounts);
    }
}
