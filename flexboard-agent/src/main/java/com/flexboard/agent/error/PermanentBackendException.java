package com.flexboard.agent.error;

/**
 * Caller-fixable backend failure (syntax error, auth failure, policy violation); never retried.
 */
public class PermanentBackendException extends BackendException {
    private final boolean handleReusable;

    public PermanentBackendException(String message) {
        this(message, null, null, false);
    }

    public PermanentBackendException(String message, Throwable cause) {
        this(message, null, cause, false);
    }

    /**
     * @param message human-readable description
     * @param statusCode HTTP status, when the backend is an HTTP API
     * @param cause native failure
     * @param handleReusable true when the backend answered cleanly and the handle is unharmed
     */
    public PermanentBackendException(String message, Integer statusCode, Throwable cause, boolean handleReusable) {
        super(message, statusCode, cause);
        this.handleReusable = handleReusable;
    }

    /**
     * Failure raised by a local policy check before the handle was used.
     *
     * @param message description
     * @return exception that keeps the handle
     */
    public static PermanentBackendException policyViolation(String message) {
        return new PermanentBackendException(message, null, null, true);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PERMANENT_BACKEND;
    }

    @Override
    public boolean isHandleReusable() {
        return handleReusable;
    }
}
