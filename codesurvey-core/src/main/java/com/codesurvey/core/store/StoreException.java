package com.codesurvey.core.store;

import com.codesurvey.core.exception.SurveyException;

/**
 * Raised when the completion store cannot read or write its records.
 */
public class StoreException extends SurveyException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
