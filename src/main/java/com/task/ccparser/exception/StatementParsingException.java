package com.task.ccparser.exception;

/**
 * Signals a fatal failure while parsing a statement. Recoverable problems with the model output
 * are reported through a failed {@link com.task.ccparser.model.ParseResult} instead.
 */
public class StatementParsingException extends RuntimeException {

    public StatementParsingException(String message) {
        super(message);
    }

    public StatementParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
