package com.codesurvey.core.exception;

/**
 * Raised when a running survey is cancelled, after in-flight work has been unwound.
 */
public class SurveyInterruptedException extends SurveyException {

    public SurveyInterruptedException(String message) {
        super(message);
    }

    public SurveyInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
