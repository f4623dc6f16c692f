package com.codesurvey.core.source;

import com.codesurvey.core.exception.SurveyException;

/**
 * Raised when a source cannot prepare a repository (missing directory, failed clone,
 * failed remote search).
 */
public class SourceException extends SurveyException {

    public SourceException(String message) {
        super(message);
    }

    public SourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
