package com.compliance.guardian.exception;

/**
 * Training data failed validation; the active model is left in place.
 */
public class ModelTrainingException extends GuardianException {

    public ModelTrainingException(String message) {
        super(message);
    }
}
