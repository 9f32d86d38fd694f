package com.flexboard.agent.error;

/**
 * No backend handle became available within the request deadline.
 */
public class CapacityException extends QueryDispatchException {

    public CapacityException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CAPACITY;
    }
}
