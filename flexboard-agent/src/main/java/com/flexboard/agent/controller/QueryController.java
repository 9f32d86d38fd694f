package com.flexboard.agent.controller;

import com.flexboard.agent.api.ConnectionTestResponse;
import com.flexboard.agent.api.ConnectionsResponse;
import com.flexboard.agent.api.QueryRequest;
import com.flexboard.agent.api.QueryResult;
import com.flexboard.agent.error.ErrorKind;
import com.flexboard.agent.model.PoolKey;
import com.flexboard.agent.service.QueryDispatcher;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Thin HTTP front for the dispatch engine, called by the control-plane proxy.
 */
@RestController
@RequestMapping("/api")
public class QueryController {

    private final QueryDispatcher queryDispatcher;

    public QueryController(QueryDispatcher queryDispatcher) {
        this.queryDispatcher = queryDispatcher;
    }

    /**
     * Execute a widget query. The body is always a {@link QueryResult}; the status reflects its
     * error kind.
     */
    @PostMapping("/widgets/execute")
    public ResponseEntity<QueryResult> execute(@Valid @RequestBody QueryRequest request) {
        QueryResult result = queryDispatcher.execute(request);
        HttpStatus status = result.isSuccess()
                ? HttpStatus.OK
                : HttpStatus.valueOf(ErrorKind.fromCode(result.getErrorCode()).getHttpStatus());
        return ResponseEntity.status(status).body(result);
    }

    @GetMapping("/connections/test")
    public ResponseEntity<ConnectionTestResponse> testConnections(@RequestParam(value = "tenantId", required = false) String tenantId) {
        Map<String, Boolean> connections = queryDispatcher.testConnections(tenantId);
        ConnectionTestResponse response = ConnectionTestResponse.builder()
                .success(!connections.containsValue(Boolean.FALSE))
                .tenantId(tenantId != null && !tenantId.isBlank() ? tenantId : PoolKey.DEFAULT_TENANT)
                .connections(connections)
                .timestamp(OffsetDateTime.now())
                .build();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/connections")
    public ResponseEntity<ConnectionsResponse> connections() {
        ConnectionsResponse response = ConnectionsResponse.builder()
                .dataSources(queryDispatcher.availableDataSources())
                .pools(queryDispatcher.poolStatistics())
                .build();
        return ResponseEntity.ok(response);
    }
}
