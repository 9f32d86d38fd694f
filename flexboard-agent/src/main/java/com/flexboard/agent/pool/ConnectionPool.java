package com.flexboard.agent.pool;

import com.flexboard.agent.model.PoolKey;

import java.time.Duration;

/**
 * Bounded pool of backend handles for one {@link PoolKey}.
 *
 * <p>A handle obtained from {@link #acquire(Duration)} is owned by the caller until it is given
 * back exactly once, through {@link #release(Object)} when it is known to be healthy or through
 * {@link #discard(Object)} after any I/O error or when its state is uncertain.
 *
 * @param <H> handle type
 */
public interface ConnectionPool<H> extends AutoCloseable {

    PoolKey key();

    /**
     * Check out a handle, waiting in arrival order while the pool is at capacity.
     *
     * @param timeout longest time to wait for a free slot
     * @return an exclusively owned handle
     * @throws com.flexboard.agent.error.CapacityException when no handle became available in time
     * @throws com.flexboard.agent.error.QueryDispatchException when a new handle cannot be opened
     * @throws InterruptedException when the waiting thread is interrupted
     */
    H acquire(Duration timeout) throws InterruptedException;

    void release(H handle);

    void discard(H handle);

    /**
     * Destroy idle handles that outlived the idle period, keeping the minimum idle watermark.
     */
    void evictIdle();

    PoolStats stats();

    @Override
    void close();
}
