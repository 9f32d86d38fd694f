package com.flexboard.agent.service;

import com.flexboard.agent.api.QueryRequest;
import com.flexboard.agent.api.QueryResult;
import com.flexboard.agent.config.EngineProperties;
import com.flexboard.agent.connector.BackendRegistration;
import com.flexboard.agent.connector.Connector;
import com.flexboard.agent.connector.ConnectorRegistry;
import com.flexboard.agent.error.CapacityException;
import com.flexboard.agent.error.PermanentBackendException;
import com.flexboard.agent.error.QueryDispatchException;
import com.flexboard.agent.error.QueryTimeoutException;
import com.flexboard.agent.error.TransientBackendException;
import com.flexboard.agent.error.ValidationException;
import com.flexboard.agent.model.DataSourceKind;
import com.flexboard.agent.model.NativeResult;
import com.flexboard.agent.model.PoolKey;
import com.flexboard.agent.pool.ConnectionPool;
import com.flexboard.agent.pool.PoolGroup;
import com.flexboard.agent.pool.PoolRegistry;
import com.flexboard.agent.pool.PoolStats;
import com.flexboard.agent.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Entry point of the engine: resolves a {@link QueryRequest} to its connector and pool, runs
 * it under the request deadline and retry policy, and returns a {@link QueryResult}.
 *
 * <p>Each attempt runs on a worker thread while the caller waits for at most the time left
 * until the deadline. At the deadline the caller stops waiting, interrupts the worker and
 * discards the handle; the handle never goes back to the idle set.
 */
@Slf4j
public class QueryDispatcher implements AutoCloseable {
    public static final String MDC_TENANT = "tenant_id";
    public static final String MDC_DATA_SOURCE = "data_source";
    private static final int LOGGED_QUERY_CHARS = 100;

    private final Map<DataSourceKind, Route<?>> routes = new EnumMap<>(DataSourceKind.class);
    private final PoolRegistry pools;
    private final EngineProperties properties;
    private final ExecutorService workers;

    /**
     * Create a dispatcher. The dispatcher takes ownership of the pool registry and closes it.
     *
     * @param connectors registered backends
     * @param pools pool registry
     * @param properties engine settings
     */
    public QueryDispatcher(ConnectorRegistry connectors, PoolRegistry pools, EngineProperties properties) {
        this.pools = pools;
        for (DataSourceKind kind : connectors.kinds()) {
            routes.put(kind, route(connectors.find(kind).orElseThrow()));
        }
        this.properties = properties;
        AtomicInteger threadIds = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "flexboard-query-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Execute one query. Never throws: every failure becomes a failed {@link QueryResult}.
     *
     * @param request query request
     * @return result with either data or error
     */
    public QueryResult execute(QueryRequest request) {
        Route<?> route;
        try {
            route = resolve(request);
        } catch (ValidationException e) {
            String dataSource = request != null ? request.getDataSourceKind() : null;
            log.warn("Rejected query request: {}", e.getMessage());
            return QueryResult.failure(e, QueryResult.Metadata.of(request, dataSource));
        }

        DataSourceKind kind = route.registration().kind();
        PoolKey key = PoolKey.of(request.getTenantId(), kind);
        QueryResult.Metadata metadata = QueryResult.Metadata.of(request, kind.getValue());
        MDC.put(MDC_TENANT, key.tenantId());
        MDC.put(MDC_DATA_SOURCE, key.kind().getValue());
        try {
            log.info("Executing {} query (widget {}): {}", key.kind(), request.getWidgetId(), abbreviate(request.getQuery()));
            return executeWith(route, key, request, metadata);
        } finally {
            MDC.remove(MDC_TENANT);
            MDC.remove(MDC_DATA_SOURCE);
        }
    }

    private <H> QueryResult executeWith(Route<H> route, PoolKey key, QueryRequest request,
                                        QueryResult.Metadata metadata) {
        long startNanos = System.nanoTime();
        long deadline = startNanos + properties.getRequestTimeout().toNanos();
        Connector<H> connector = route.registration().connector();

        int attempt = 0;
        while (true) {
            try {
                ConnectionPool<H> pool = poolFor(key, route);
                NativeResult nativeResult = runOnHandle(pool, deadline,
                        handle -> connector.run(handle, request.getQuery(), request.getParams()));
                ResultNormalizer.NormalizedResult normalized = ResultNormalizer.normalize(nativeResult);
                long executionMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
                log.info("Query on {} returned {} row(s) in {}ms", key, normalized.rowCount(), executionMs);
                return QueryResult.success(normalized.columns(), normalized.rows(), executionMs, metadata);
            } catch (TransientBackendException e) {
                attempt++;
                long backoffNanos = properties.getRetryBackoff().toNanos() * attempt;
                if (attempt > properties.getRetryCount() || System.nanoTime() + backoffNanos >= deadline) {
                    log.warn("Query on {} failed after {} attempt(s): {}", key, attempt, e.getMessage());
                    return QueryResult.failure(e, metadata);
                }
                log.warn("Transient failure on {} (attempt {}/{}): {}; retrying in {}ms", key, attempt,
                        properties.getRetryCount() + 1, e.getMessage(), TimeUnit.NANOSECONDS.toMillis(backoffNanos));
                try {
                    TimeUnit.NANOSECONDS.sleep(backoffNanos);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    return QueryResult.failure(new QueryTimeoutException("Interrupted while waiting to retry", interrupted), metadata);
                }
            } catch (QueryDispatchException e) {
                log.warn("Query on {} failed: {} ({})", key, e.getMessage(), e.kind().getCode());
                return QueryResult.failure(e, metadata);
            } catch (RuntimeException e) {
                log.error("Unexpected failure executing query on {}", key, e);
                return QueryResult.failure(new PermanentBackendException("Unexpected failure: " + e.getMessage(), e), metadata);
            }
        }
    }

    /**
     * Check every registered backend for one tenant. Never throws.
     *
     * @param tenantId tenant whose pools are used
     * @return reachability per data source, in registration order
     */
    public Map<String, Boolean> testConnections(String tenantId) {
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (Map.Entry<DataSourceKind, Route<?>> entry : routes.entrySet()) {
            DataSourceKind kind = entry.getKey();
            PoolKey key = PoolKey.of(tenantId, kind);
            boolean ok = ping(entry.getValue(), key);
            log.info("Connection test for {}: {}", key, ok ? "ok" : "failed");
            results.put(kind.getValue(), ok);
        }
        return results;
    }

    private <H> boolean ping(Route<H> route, PoolKey key) {
        long deadline = System.nanoTime() + properties.getRequestTimeout().toNanos();
        try {
            ConnectionPool<H> pool = poolFor(key, route);
            return runOnHandle(pool, deadline, handle -> {
                if (!route.registration().connector().ping(handle)) {
                    throw new TransientBackendException("Ping failed for " + key);
                }
                return Boolean.TRUE;
            });
        } catch (QueryDispatchException e) {
            log.debug("Ping of {} failed: {}", key, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("Ping of {} failed unexpectedly: {}", key, e.getMessage());
            return false;
        }
    }

    /** Registered data sources, in declaration order. */
    public List<String> availableDataSources() {
        List<String> out = new ArrayList<>();
        for (DataSourceKind kind : routes.keySet()) {
            out.add(kind.getValue());
        }
        return out;
    }

    public List<PoolStats> poolStatistics() {
        return pools.stats();
    }

    private Route<?> resolve(QueryRequest request) {
        if (request == null) {
            throw new ValidationException("Request must not be null");
        }
        if (request.getQuery() == null || request.getQuery().isBlank()) {
            throw new ValidationException("Query must not be empty");
        }
        if (request.getDataSourceKind() == null || request.getDataSourceKind().isBlank()) {
            throw new ValidationException("dataSourceKind is required");
        }
        for (String name : request.getParams().keySet()) {
            if (name == null || name.isBlank()) {
                throw new ValidationException("Parameter names must not be blank");
            }
        }
        DataSourceKind kind = DataSourceKind.fromValue(request.getDataSourceKind())
                .orElseThrow(() -> new ValidationException("Unsupported data source type: " + request.getDataSourceKind()));
        Route<?> route = routes.get(kind);
        if (route == null) {
            throw new ValidationException("Data source " + kind + " is not configured");
        }
        return route;
    }

    private <H> Route<H> route(BackendRegistration<H> registration) {
        return new Route<>(registration, pools.group(registration.poolFactory()));
    }

    private <H> ConnectionPool<H> poolFor(PoolKey key, Route<H> route) {
        try {
            return route.pools().poolFor(key);
        } catch (IllegalStateException e) {
            throw new CapacityException("Engine is shutting down");
        } catch (IllegalArgumentException e) {
            throw new PermanentBackendException("Backend " + key.kind() + " is misconfigured: " + e.getMessage(), e);
        }
    }

    private <H, T> T runOnHandle(ConnectionPool<H> pool, long deadline, Function<H, T> operation) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0L) {
            throw new QueryTimeoutException("Request timed out after " + properties.getRequestTimeout().toMillis() + "ms");
        }
        Checkout<H> checkout = new Checkout<>(pool);
        Future<T> future;
        try {
            future = workers.submit(MdcPropagation.wrapCallable(() -> checkout.run(Duration.ofNanos(remaining), operation)));
        } catch (RejectedExecutionException e) {
            throw new CapacityException("Engine is shutting down");
        }

        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            boolean hadHandle = checkout.abandon();
            future.cancel(true);
            long timeoutMs = properties.getRequestTimeout().toMillis();
            if (!hadHandle) {
                throw new CapacityException("No connection available for " + pool.key() + " within the request timeout of " + timeoutMs + "ms");
            }
            throw new QueryTimeoutException("Query on " + pool.key() + " timed out after " + timeoutMs + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            checkout.abandon();
            future.cancel(true);
            throw new QueryTimeoutException("Interrupted while waiting for the query result", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof QueryDispatchException dispatchFailure) {
                throw dispatchFailure;
            }
            if (cause instanceof InterruptedException) {
                throw new QueryTimeoutException("Interrupted while acquiring a connection for " + pool.key(), cause);
            }
            throw new PermanentBackendException("Unexpected failure: " + cause.getMessage(), cause);
        }
    }

    private static String abbreviate(String query) {
        String flat = query.replaceAll("\\s+", " ").trim();
        return flat.length() <= LOGGED_QUERY_CHARS ? flat : flat.substring(0, LOGGED_QUERY_CHARS) + "...";
    }

    @Override
    public void close() {
        log.info("Shutting down query dispatcher");
        workers.shutdownNow();
        pools.close();
    }

    /** A registered backend with the pools that serve it. */
    private record Route<H>(BackendRegistration<H> registration, PoolGroup<H> pools) {
    }
}
