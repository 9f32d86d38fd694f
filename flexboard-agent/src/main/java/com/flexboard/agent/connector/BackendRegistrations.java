package com.flexboard.agent.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flexboard.agent.config.BackendProperties;
import com.flexboard.agent.config.EngineProperties;
import com.flexboard.agent.connector.document.DocumentStoreConnector;
import com.flexboard.agent.connector.document.DocumentStoreHandle;
import com.flexboard.agent.connector.document.DocumentStoreHandleFactory;
import com.flexboard.agent.connector.http.HttpApiConnector;
import com.flexboard.agent.connector.http.HttpApiHandle;
import com.flexboard.agent.connector.http.HttpApiHandleFactory;
import com.flexboard.agent.connector.sql.DsnParser;
import com.flexboard.agent.connector.sql.HikariConnectionPool;
import com.flexboard.agent.connector.sql.JdbcConnectionInfoResolver;
import com.flexboard.agent.connector.sql.JdbcConnector;
import com.flexboard.agent.model.DataSourceKind;
import com.flexboard.agent.pool.BoundedConnectionPool;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.util.Optional;

/**
 * Builds the connector registry from {@code flexboard.engine.backends}.
 *
 * <p>Only kinds with a configured backend are registered. Connection settings are checked
 * here so that a bad URL fails at startup instead of on the first request.
 */
@Slf4j
public final class BackendRegistrations {

    private BackendRegistrations() {
    }

    /**
     * Register one backend per configured kind.
     *
     * @param engine engine settings, including backends
     * @param objectMapper JSON mapper for HTTP-API responses
     * @return registry
     * @throws IllegalArgumentException when a backend's connection settings are unusable
     */
    public static ConnectorRegistry fromProperties(EngineProperties engine, ObjectMapper objectMapper) {
        ConnectorRegistry registry = new ConnectorRegistry();
        for (DataSourceKind kind : DataSourceKind.values()) {
            Optional<BackendProperties> backend = engine.backendFor(kind);
            if (backend.isEmpty()) {
                continue;
            }
            BackendProperties props = backend.get();
            if (kind.isRelational()) {
                registry.register(relational(kind, props, engine));
            } else if (kind == DataSourceKind.DOCUMENT_STORE) {
                registry.register(documentStore(props, engine));
            } else {
                registry.register(httpApi(props, engine, objectMapper));
            }
        }
        log.info("Registered data sources: {}", registry.kinds());
        return registry;
    }

    static BackendRegistration<Connection> relational(DataSourceKind kind, BackendProperties props, EngineProperties engine) {
        String url = JdbcConnectionInfoResolver.resolve(kind, props).getUrl();
        log.info("Data source {} -> {}", kind, DsnParser.mask(url));
        return new BackendRegistration<>(
                kind,
                new JdbcConnector(kind, props, engine.getRequestTimeout()),
                key -> HikariConnectionPool.create(key, props, engine)
        );
    }

    static BackendRegistration<DocumentStoreHandle> documentStore(BackendProperties props, EngineProperties engine) {
        if (props.getUrl() == null || props.getUrl().isBlank()) {
            throw new IllegalArgumentException("Backend document-store needs a url");
        }
        log.info("Data source {} -> {}", DataSourceKind.DOCUMENT_STORE, DsnParser.mask(props.getUrl()));
        return new BackendRegistration<>(
                DataSourceKind.DOCUMENT_STORE,
                new DocumentStoreConnector(props, engine.getRequestTimeout()),
                key -> new BoundedConnectionPool<>(
                        key,
                        DocumentStoreHandleFactory.create(key, props, engine),
                        engine.getMaxPoolSizePerKey(),
                        engine.getMinIdlePerKey(),
                        engine.getIdleEvictionPeriod())
        );
    }

    static BackendRegistration<HttpApiHandle> httpApi(BackendProperties props, EngineProperties engine, ObjectMapper objectMapper) {
        log.info("Data source {} -> {}", DataSourceKind.HTTP_API, props.getBaseUrl());
        return new BackendRegistration<>(
                DataSourceKind.HTTP_API,
                new HttpApiConnector(props, engine.getRequestTimeout(), objectMapper),
                key -> new BoundedConnectionPool<>(
                        key,
                        new HttpApiHandleFactory(props),
                        engine.getMaxPoolSizePerKey(),
                        engine.getMinIdlePerKey(),
                        engine.getIdleEvictionPeriod())
        );
    }
}
