package com.flexboard.agent.connector.sql;

import com.flexboard.agent.config.BackendProperties;
import com.flexboard.agent.config.EngineProperties;
import com.flexboard.agent.error.CapacityException;
import com.flexboard.agent.model.PoolKey;
import com.flexboard.agent.pool.ConnectionPool;
import com.flexboard.agent.pool.PoolStats;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Relational pool for one key, backed by HikariCP.
 *
 * <p>Hikari enforces the size bound, FIFO hand-off, lazy creation and idle retirement. This
 * class adds ownership tracking so that a connection can only be given back once, and maps
 * Hikari's acquisition failures onto the dispatch error taxonomy.
 */
@Slf4j
public class HikariConnectionPool implements ConnectionPool<Connection> {
    private static final long MIN_CONNECTION_TIMEOUT_MS = 250L;

    private final PoolKey key;
    private final HikariDataSource dataSource;
    private final Set<Connection> checkedOut = Collections.synchronizedSet(Collections.newSetFromMap(new IdentityHashMap<>()));

    HikariConnectionPool(PoolKey key, HikariDataSource dataSource) {
        this.key = key;
        this.dataSource = dataSource;
    }

    /**
     * Create the pool for a key. No connection is opened until the first acquisition.
     *
     * @param key pool key
     * @param props backend connection parameters
     * @param engine engine limits
     * @return pool
     */
    public static HikariConnectionPool create(PoolKey key, BackendProperties props, EngineProperties engine) {
        JdbcConnectionInfo info = JdbcConnectionInfoResolver.resolve(key.kind(), props);
        log.info("Creating {} pool {} for {}", key.kind(), key.poolName(), DsnParser.mask(info.getUrl()));
        return new HikariConnectionPool(key, new HikariDataSource(buildHikariConfig(key, info, engine)));
    }

    static HikariConfig buildHikariConfig(PoolKey key, JdbcConnectionInfo info, EngineProperties engine) {
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setJdbcUrl(info.getUrl());
        config.setUsername(info.getUsername());
        config.setPassword(info.getPassword());
        if (info.getDriverClassName() != null && !info.getDriverClassName().isBlank()) {
            config.setDriverClassName(info.getDriverClassName());
        }
        if (info.getUrl().startsWith("jdbc:postgresql:")) {
            // shows up as pg_stat_activity.application_name
            config.addDataSourceProperty("ApplicationName", "flexboard-agent");
        }

        config.setPoolName(key.poolName());
        config.setMaximumPoolSize(engine.getMaxPoolSizePerKey());
        config.setMinimumIdle(engine.getMinIdlePerKey());
        config.setIdleTimeout(engine.getIdleEvictionPeriod().toMillis());
        config.setConnectionTimeout(Math.max(MIN_CONNECTION_TIMEOUT_MS, engine.getRequestTimeout().toMillis()));
        // start without touching the backend
        config.setInitializationFailTimeout(-1);
        return config;
    }

    @Override
    public PoolKey key() {
        return key;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Hikari's own wait is bounded by the request timeout configured at creation; the
     * dispatcher interrupts the caller at the request deadline.
     */
    @Override
    public Connection acquire(Duration timeout) throws InterruptedException {
        Connection conn;
        try {
            conn = dataSource.getConnection();
        } catch (SQLException e) {
            if (e.getCause() instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
                Thread.interrupted();
                InterruptedException interrupted = new InterruptedException("Interrupted while acquiring connection for " + key);
                interrupted.initCause(e);
                throw interrupted;
            }
            if (e instanceof SQLTransientConnectionException && !(e.getCause() instanceof SQLException)) {
                throw new CapacityException("No connection available for " + key + " within "
                        + dataSource.getConnectionTimeout() + "ms (max pool size " + dataSource.getMaximumPoolSize() + ")");
            }
            SQLException failure = e.getCause() instanceof SQLException cause ? cause : e;
            log.warn("Failed to open connection for {}: {} (SQLState: {})", key, failure.getMessage(), failure.getSQLState());
            throw SqlErrorClassifier.classify(failure);
        }
        checkedOut.add(conn);
        return conn;
    }

    @Override
    public void release(Connection conn) {
        if (!checkedOut.remove(conn)) {
            throw new IllegalStateException("Connection was not checked out from pool " + key);
        }
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Failed to return connection to pool {}: {}", key, e.getMessage());
            dataSource.evictConnection(conn);
        }
    }

    @Override
    public void discard(Connection conn) {
        if (!checkedOut.remove(conn)) {
            throw new IllegalStateException("Connection was not checked out from pool " + key);
        }
        log.debug("Evicting connection from pool {}", key);
        dataSource.evictConnection(conn);
    }

    /**
     * No-op: Hikari's housekeeper retires connections idle longer than {@code idleTimeout}
     * down to {@code minimumIdle}.
     */
    @Override
    public void evictIdle() {
    }

    @Override
    public PoolStats stats() {
        HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
        int active = pool != null ? pool.getActiveConnections() : 0;
        int idle = pool != null ? pool.getIdleConnections() : 0;
        int total = pool != null ? pool.getTotalConnections() : 0;
        int waiting = pool != null ? pool.getThreadsAwaitingConnection() : 0;
        return new PoolStats(
                key.poolName(),
                key.tenantId(),
                key.kind().getValue(),
                dataSource.getMaximumPoolSize(),
                dataSource.getMinimumIdle(),
                active,
                idle,
                total,
                waiting
        );
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            log.info("Closing pool {}", key.poolName());
            dataSource.close();
        }
    }
}
