package com.flexboard.agent.service;

import com.flexboard.agent.error.PermanentBackendException;
import com.flexboard.agent.error.QueryDispatchException;
import com.flexboard.agent.error.QueryTimeoutException;
import com.flexboard.agent.pool.ConnectionPool;

import java.time.Duration;
import java.util.function.Function;

/**
 * One handle checkout shared between a worker (which uses the handle) and the waiting caller
 * (which may give up at the deadline).
 *
 * <p>Whichever side finishes first decides the handle's fate, exactly once: the worker
 * releases or discards it on completion, the caller discards it on abandonment. A handle that
 * arrives after abandonment is discarded without being used.
 *
 * @param <H> handle type
 */
final class Checkout<H> {
    private final ConnectionPool<H> pool;
    private H handle;
    private boolean abandoned;
    private boolean settled;

    Checkout(ConnectionPool<H> pool) {
        this.pool = pool;
    }

    /**
     * Acquire a handle, apply the operation to it, and give the handle back.
     *
     * @param acquireTimeout longest wait for a handle
     * @param operation work to do with the handle
     * @param <T> result type
     * @return operation result
     * @throws InterruptedException when interrupted while waiting for a handle
     */
    <T> T run(Duration acquireTimeout, Function<H, T> operation) throws InterruptedException {
        H acquired = pool.acquire(acquireTimeout);
        if (!attach(acquired)) {
            pool.discard(acquired);
            throw new QueryTimeoutException("Request was abandoned before the query started");
        }
        boolean reusable = false;
        try {
            T result = operation.apply(acquired);
            reusable = true;
            return result;
        } catch (QueryDispatchException e) {
            reusable = e.isHandleReusable();
            throw e;
        } catch (RuntimeException e) {
            throw new PermanentBackendException("Unexpected connector failure: " + e.getMessage(), e);
        } finally {
            complete(reusable);
        }
    }

    /**
     * Give up on this checkout. Discards the handle if one is held.
     *
     * @return true when a handle had been acquired by the time the caller gave up
     */
    boolean abandon() {
        H toDiscard;
        boolean hadHandle;
        synchronized (this) {
            abandoned = true;
            hadHandle = handle != null || settled;
            toDiscard = settled ? null : handle;
            if (toDiscard != null) {
                settled = true;
                handle = null;
            }
        }
        if (toDiscard != null) {
            pool.discard(toDiscard);
        }
        return hadHandle;
    }

    private synchronized boolean attach(H acquired) {
        if (abandoned) {
            return false;
        }
        handle = acquired;
        return true;
    }

    private void complete(boolean reusable) {
        H toReturn;
        boolean release;
        synchronized (this) {
            if (settled || handle == null) {
                return;
            }
            settled = true;
            toReturn = handle;
            handle = null;
            release = reusable && !abandoned;
        }
        if (release) {
            pool.release(toReturn);
        } else {
            pool.discard(toReturn);
        }
    }
}
