package com.flexboard.agent.error;

/**
 * The request deadline passed while the backend call was in flight.
 */
public class QueryTimeoutException extends QueryDispatchException {

    public QueryTimeoutException(String message) {
        super(message);
    }

    public QueryTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TIMEOUT;
    }
}
