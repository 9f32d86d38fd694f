package com.flexboard.agent.error;

/**
 * Base class for every failure the dispatch engine knows how to report.
 *
 * <p>Each failure states whether the backend handle that was in use is still safe to hand to
 * the next request. Anything thrown after an I/O error or with an uncertain connection state
 * must answer {@code false} so the pool destroys the handle instead of reusing it.
 */
public abstract class QueryDispatchException extends RuntimeException {

    protected QueryDispatchException(String message) {
        super(message);
    }

    protected QueryDispatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();

    public boolean isHandleReusable() {
        return false;
    }
}
