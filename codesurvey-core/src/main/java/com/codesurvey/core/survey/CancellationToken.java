package com.codesurvey.core.survey;

import com.codesurvey.core.exception.SurveyInterruptedException;

/**
 * Cooperative stop signal for a running survey.
 *
 * <p>May be cancelled from any thread (e.g. a shutdown hook). The survey checks it
 * before each admission cycle and while waiting for jobs, then unwinds.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws SurveyInterruptedException if the token has been cancelled
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new SurveyInterruptedException("Survey was cancelled");
        }
    }
}
