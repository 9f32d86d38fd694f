package com.flexboard.agent.pool;

/**
 * Snapshot of one connection pool, for logging and REST exposure.
 */
public record PoolStats(
        String poolName,
        String tenantId,
        String dataSource,
        int maxPoolSize,
        int minIdle,
        int activeConnections,
        int idleConnections,
        int totalConnections,
        int threadsAwaitingConnection
) {
}
