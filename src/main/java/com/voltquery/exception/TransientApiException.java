package com.voltquery.exception;

/**
 * A network failure, timeout or 5xx/429 response from an external API.
 * Retried by the retry executor and counted by circuit breakers.
 */
public class TransientApiException extends VoltQueryException {

    private final Integer statusCode;

    public TransientApiException(String message) {
        super(message);
        this.statusCode = null;
    }

    public TransientApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public TransientApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed response, or null for network-level failures.
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
