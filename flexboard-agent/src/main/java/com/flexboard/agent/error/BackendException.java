package com.flexboard.agent.error;

/**
 * Failure reported by (or while talking to) a backend.
 *
 * <p>HTTP backends attach the response status; other backends leave it null.
 */
public abstract class BackendException extends QueryDispatchException {
    private final Integer statusCode;

    protected BackendException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
