package com.task.ccparser.exception;

public class UpstreamServiceException extends StatementParsingException {

    public UpstreamServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
