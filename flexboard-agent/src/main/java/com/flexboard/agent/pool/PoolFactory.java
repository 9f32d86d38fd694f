package com.flexboard.agent.pool;

import com.flexboard.agent.model.PoolKey;

/**
 * Creates the pool for a key the first time a request needs it.
 *
 * @param <H> handle type
 */
@FunctionalInterface
public interface PoolFactory<H> {
    ConnectionPool<H> create(PoolKey key);
}
