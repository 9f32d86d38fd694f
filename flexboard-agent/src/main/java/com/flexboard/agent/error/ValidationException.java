package com.flexboard.agent.error;

/**
 * Request rejected before any backend I/O: unknown kind, empty query, malformed params.
 */
public class ValidationException extends QueryDispatchException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }

    @Override
    public boolean isHandleReusable() {
        return true;
    }
}
