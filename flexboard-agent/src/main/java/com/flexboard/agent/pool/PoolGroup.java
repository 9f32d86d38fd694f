package com.flexboard.agent.pool;

import com.flexboard.agent.model.PoolKey;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The pools of one backend: one per {@link PoolKey}, all built by the same {@link PoolFactory}.
 *
 * @param <H> handle type
 */
@Slf4j
public final class PoolGroup<H> {
    private final PoolRegistry registry;
    private final PoolFactory<H> factory;
    private final Map<PoolKey, ConnectionPool<H>> pools = new ConcurrentHashMap<>();

    PoolGroup(PoolRegistry registry, PoolFactory<H> factory) {
        this.registry = registry;
        this.factory = factory;
    }

    /**
     * Get the pool for a key, creating it on first use.
     *
     * @param key pool key
     * @return pool for the key
     * @throws IllegalStateException when the registry is closed
     */
    public ConnectionPool<H> poolFor(PoolKey key) {
        registry.ensureOpen();
        return pools.computeIfAbsent(key, k -> {
            log.info("Creating connection pool for {}", k);
            return factory.create(k);
        });
    }

    Collection<ConnectionPool<H>> pools() {
        return pools.values();
    }

    void clear() {
        pools.clear();
    }
}
