package com.flexboard.agent.api;

import com.flexboard.agent.pool.PoolStats;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response for {@code GET /api/connections}: registered data sources and live pools.
 */
@Data
@Builder
public class ConnectionsResponse {
    private List<String> dataSources;
    private List<PoolStats> pools;
}
