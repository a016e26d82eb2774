package com.task.ccparser.exception;

/**
 * The uploaded document could not be opened or decoded as a PDF.
 */
public class DocumentReadException extends StatementParsingException {

    public DocumentReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
