package com.codesurvey.core.exception;

/**
 * Raised when a survey, source or analyzer is constructed with invalid settings,
 * such as duplicate names. Always raised before any work starts.
 */
public class SurveyConfigurationException extends SurveyException {

    public SurveyConfigurationException(String message) {
        super(message);
    }
}
