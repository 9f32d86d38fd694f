package com.flexboard.agent.model;

import java.util.Objects;

/**
 * Partition key for connection reuse: one pool per tenant and data source kind.
 *
 * @param tenantId tenant identifier, {@link #DEFAULT_TENANT} when the request carries none
 * @param kind data source kind
 */
public record PoolKey(String tenantId, DataSourceKind kind) {

    public static final String DEFAULT_TENANT = "default";

    public PoolKey {
        Objects.requireNonNull(kind, "kind");
        tenantId = tenantId == null || tenantId.isBlank() ? DEFAULT_TENANT : tenantId.trim();
    }

    public static PoolKey of(String tenantId, DataSourceKind kind) {
        return new PoolKey(tenantId, kind);
    }

    /**
     * Name used for pool threads and log lines.
     *
     * @return pool name
     */
    public String poolName() {
        return "flexboard-" + tenantId + "-" + kind.getValue();
    }

    @Override
    public String toString() {
        return tenantId + "/" + kind.getValue();
    }
}
