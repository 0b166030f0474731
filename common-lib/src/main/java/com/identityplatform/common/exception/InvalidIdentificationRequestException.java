package com.identityplatform.common.exception;

/**
 * Inbound identification input rejected before any service is called.
 */
public class InvalidIdentificationRequestException extends RuntimeException {

    private final String field;

    public InvalidIdentificationRequestException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public InvalidIdentificationRequestException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
