package com.flexboard.agent.connector.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flexboard.agent.config.BackendProperties;
import com.flexboard.agent.connector.Connector;
import com.flexboard.agent.error.PermanentBackendException;
import com.flexboard.agent.error.QueryTimeoutException;
import com.flexboard.agent.error.TransientBackendException;
import com.flexboard.agent.model.NativeResult;
import com.flexboard.agent.util.RowFlattener;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Connector for JSON HTTP APIs: the query is a URL template, the response a JSON document.
 */
@Slf4j
public class HttpApiConnector implements Connector<HttpApiHandle> {
    static final String VALUE_COLUMN = "value";
    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(429, 502, 503, 504);
    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE = new TypeReference<>() {
    };

    private final BackendProperties props;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;

    public HttpApiConnector(BackendProperties props, Duration requestTimeout, ObjectMapper objectMapper) {
        this.props = props;
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
    }

    @Override
    public NativeResult run(HttpApiHandle handle, String query, Map<String, Object> params) {
        URI uri = UrlTemplate.expand(props.getBaseUrl(), query, params);
        HttpResponse<String> response = send(handle, uri);

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String message = "HTTP " + status + " from " + uri.getHost() + ": " + abbreviate(response.body());
            if (TRANSIENT_STATUSES.contains(status)) {
                throw new TransientBackendException(message, status, null);
            }
            throw new PermanentBackendException(message, status, null, true);
        }
        return toRows(response.body(), uri);
    }

    @Override
    public boolean ping(HttpApiHandle handle) {
        if (props.getBaseUrl() == null || props.getBaseUrl().isBlank()) {
            return false;
        }
        try {
            URI uri = URI.create(UrlTemplate.resolve(props.getBaseUrl(), props.getHealthPath() != null ? props.getHealthPath() : ""));
            HttpResponse<String> response = handle.client().send(newRequest(uri), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return response.statusCode() >= 200 && response.statusCode() < 300;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("HTTP-API health check failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpResponse<String> send(HttpApiHandle handle, URI uri) {
        try {
            return handle.client().send(newRequest(uri), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpConnectTimeoutException e) {
            throw new TransientBackendException("Connect to " + uri.getHost() + " timed out", e);
        } catch (HttpTimeoutException e) {
            throw new QueryTimeoutException("HTTP request to " + uri.getHost() + " timed out after " + requestTimeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new TransientBackendException("HTTP request to " + uri.getHost() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryTimeoutException("HTTP request to " + uri.getHost() + " was interrupted", e);
        }
    }

    private HttpRequest newRequest(URI uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET();
        if (!onBaseOrigin(uri)) {
            return builder.build();
        }
        props.getHeaders().forEach(builder::header);
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + props.getApiKey());
        }
        return builder.build();
    }

    /** Configured headers and the API key only ever go to the baseUrl host. */
    private boolean onBaseOrigin(URI uri) {
        String baseUrl = props.getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            return false;
        }
        return UrlTemplate.sameOrigin(URI.create(baseUrl), uri);
    }

    NativeResult toRows(String body, URI uri) {
        if (body == null || body.isBlank()) {
            return NativeResult.rowOriented(List.of());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PermanentBackendException("Invalid JSON from " + uri.getHost() + ": " + e.getOriginalMessage(), null, e, true);
        }

        JsonNode items = root;
        if (root.isObject() && root.path("data").isArray()) {
            items = root.get("data");
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        if (items.isArray()) {
            for (JsonNode item : items) {
                rows.add(toRow(item));
            }
        } else {
            rows.add(toRow(items));
        }
        return NativeResult.rowOriented(rows);
    }

    private Map<String, Object> toRow(JsonNode node) {
        if (node.isObject()) {
            return RowFlattener.flatten(objectMapper.convertValue(node, OBJECT_TYPE), UnaryOperator.identity());
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(VALUE_COLUMN, objectMapper.convertValue(node, Object.class));
        return row;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        String trimmed = body.strip();
        return trimmed.length() <= 200 ? trimmed : trimmed.substring(0, 200) + "...";
    }
}
