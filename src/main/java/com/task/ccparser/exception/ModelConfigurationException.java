package com.task.ccparser.exception;

/**
 * The model service cannot be called because its credential is missing.
 */
public class ModelConfigurationException extends StatementParsingException {

    public ModelConfigurationException(String message) {
        super(message);
    }
}
