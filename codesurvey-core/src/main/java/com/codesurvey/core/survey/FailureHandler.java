package com.codesurvey.core.survey;

import com.codesurvey.core.exception.SurveyException;
import org.slf4j.Logger;

/**
 * Applies the survey's failure policy to source, analyzer and unit failures.
 *
 * <p>With {@code continueOnFailure} the failure is logged and counted; otherwise it is
 * logged and rethrown to halt the run. Unchecked failures are rethrown as they are,
 * checked ones are wrapped in a {@link SurveyException}.
 */
final class FailureHandler {

    private final boolean continueOnFailure;
    private final Logger log;
    private int failureCount;

    FailureHandler(boolean continueOnFailure, Logger log) {
        this.continueOnFailure = continueOnFailure;
        this.log = log;
    }

    /**
     * @param message description naming the repository and the responsible source or analyzer
     * @param failure the failure
     */
    void handle(String message, Throwable failure) {
        failureCount++;
        if (continueOnFailure) {
            log.error("{}, skipping: {}", message, failure.toString(), failure);
            return;
        }
        log.error("{}, halting survey", message, failure);
        if (failure instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        throw new SurveyException(message, failure);
    }

    int getFailureCount() {
        return failureCount;
    }
}
