package com.flexboard.agent.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flexboard.agent.error.QueryDispatchException;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Normalized tabular answer to a {@link QueryRequest}.
 *
 * <p>Exactly one of {@code data} and {@code error} is set. Use the factories rather than the
 * builder so that invariant holds.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResult {
    boolean success;
    List<Map<String, Object>> data;
    List<String> columns;
    Integer rowCount;
    Long executionTime;
    String error;
    String errorCode;
    Metadata metadata;

    public static QueryResult success(List<String> columns, List<Map<String, Object>> data, long executionTimeMs, Metadata metadata) {
        return QueryResult.builder()
                .success(true)
                .columns(List.copyOf(columns))
                .data(List.copyOf(data))
                .rowCount(data.size())
                .executionTime(executionTimeMs)
                .metadata(metadata)
                .build();
    }

    public static QueryResult failure(QueryDispatchException e, Metadata metadata) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return QueryResult.builder()
                .success(false)
                .error(message)
                .errorCode(e.kind().getCode())
                .metadata(metadata)
                .build();
    }

    /**
     * Echo of the originating request, for audit and debugging.
     */
    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Metadata {
        String dataSource;
        String query;
        Map<String, Object> params;
        String widgetId;
        String tenantId;

        public static Metadata of(QueryRequest request, String dataSource) {
            if (request == null) {
                return Metadata.builder().dataSource(dataSource).build();
            }
            return Metadata.builder()
                    .dataSource(dataSource)
                    .query(request.getQuery())
                    .params(request.getParams())
                    .widgetId(request.getWidgetId())
                    .tenantId(request.getTenantId())
                    .build();
        }
    }
}
