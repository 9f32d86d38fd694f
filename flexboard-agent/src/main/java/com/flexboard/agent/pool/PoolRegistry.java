package com.flexboard.agent.pool;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Owns every live pool, grouped per backend, and sweeps idle handles periodically.
 */
@Slf4j
public class PoolRegistry implements AutoCloseable {
    private final List<PoolGroup<?>> groups = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService evictor;
    private volatile boolean closed;

    /**
     * Create a registry and start the idle sweep.
     *
     * @param evictionPeriod interval between idle sweeps
     */
    public PoolRegistry(Duration evictionPeriod) {
        this.evictor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "flexboard-pool-evictor");
            t.setDaemon(true);
            return t;
        });
        long periodMs = evictionPeriod.toMillis();
        evictor.scheduleAtFixedRate(this::evictIdle, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Start a group for one backend. Its pools are created lazily and owned by this registry.
     *
     * @param factory builds each pool of the group
     * @param <H> handle type
     * @return new group
     * @throws IllegalStateException when the registry is closed
     */
    public <H> PoolGroup<H> group(PoolFactory<H> factory) {
        ensureOpen();
        PoolGroup<H> group = new PoolGroup<>(this, factory);
        groups.add(group);
        return group;
    }

    void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Pool registry is closed");
        }
    }

    public int size() {
        return allPools().size();
    }

    public List<PoolStats> stats() {
        List<PoolStats> out = new ArrayList<>();
        for (ConnectionPool<?> pool : allPools()) {
            out.add(pool.stats());
        }
        out.sort(Comparator.comparing(PoolStats::poolName));
        return out;
    }

    void evictIdle() {
        for (ConnectionPool<?> pool : allPools()) {
            try {
                pool.evictIdle();
            } catch (RuntimeException e) {
                // keep the sweep alive for the other pools
                log.warn("Idle eviction failed for pool {}: {}", pool.key(), e.getMessage(), e);
            }
        }
    }

    private List<ConnectionPool<?>> allPools() {
        List<ConnectionPool<?>> all = new ArrayList<>();
        for (PoolGroup<?> group : groups) {
            all.addAll(group.pools());
        }
        return all;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        evictor.shutdownNow();
        for (ConnectionPool<?> pool : allPools()) {
            try {
                pool.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close pool {}: {}", pool.key(), e.getMessage(), e);
            }
        }
        for (PoolGroup<?> group : groups) {
            group.clear();
        }
    }
}
