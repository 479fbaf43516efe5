package com.voltquery.exception;

/**
 * Base class for all VoltQuery failures.
 */
public class VoltQueryException extends RuntimeException {

    public VoltQueryException(String message) {
        super(message);
    }

    public VoltQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
