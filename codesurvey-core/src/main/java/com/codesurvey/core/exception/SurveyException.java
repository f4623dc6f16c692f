package com.codesurvey.core.exception;

/**
 * Base class of all failures raised by a code survey.
 */
public class SurveyException extends RuntimeException {

    public SurveyException(String message) {
        super(message);
    }

    public SurveyException(String message, Throwable cause) {
        super(message, cause);
    }
}
