package com.flexboard.agent.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A query submitted by a caller (typically a dashboard widget).
 *
 * <p>{@code params} keeps insertion order: positional placeholders bind in that order.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class QueryRequest {
    private final String dataSourceKind;
    private final String query;
    @ToString.Exclude
    private final Map<String, Object> params;
    @Size(max = 128)
    private final String widgetId;
    @Size(max = 128)
    private final String tenantId;

    @JsonCreator
    @Builder(toBuilder = true)
    public QueryRequest(
            @JsonProperty("dataSourceKind") @JsonAlias("dataSourceType") String dataSourceKind,
            @JsonProperty("query") String query,
            @JsonProperty("params") Map<String, Object> params,
            @JsonProperty("widgetId") String widgetId,
            @JsonProperty("tenantId") String tenantId
    ) {
        this.dataSourceKind = dataSourceKind;
        this.query = query;
        this.params = params == null || params.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.widgetId = widgetId;
        this.tenantId = tenantId;
    }
}
