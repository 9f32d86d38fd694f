package com.flexboard.agent.error;

/**
 * Retry-safe backend failure: connection reset, backend temporarily unavailable.
 */
public class TransientBackendException extends BackendException {

    public TransientBackendException(String message) {
        super(message, null, null);
    }

    public TransientBackendException(String message, Throwable cause) {
        super(message, null, cause);
    }

    public TransientBackendException(String message, Integer statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSIENT_BACKEND;
    }
}
