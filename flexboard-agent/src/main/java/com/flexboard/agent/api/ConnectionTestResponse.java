package com.flexboard.agent.api;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Response for {@code GET /api/connections/test}.
 */
@Data
@Builder
public class ConnectionTestResponse {
    private boolean success;
    private String tenantId;
    private Map<String, Boolean> connections;
    private OffsetDateTime timestamp;
}
