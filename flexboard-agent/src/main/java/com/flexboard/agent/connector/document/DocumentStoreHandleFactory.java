package com.flexboard.agent.connector.document;

import com.flexboard.agent.config.BackendProperties;
import com.flexboard.agent.config.EngineProperties;
import com.flexboard.agent.model.PoolKey;
import com.flexboard.agent.pool.HandleFactory;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;

/**
 * Opens driver sessions on a client owned by one pool key.
 *
 * <p>The client's own connection pool is capped at the engine's per-key size, so a tenant's
 * sessions can never hold more sockets than the engine allows it handles.
 */
@Slf4j
public class DocumentStoreHandleFactory implements HandleFactory<DocumentStoreHandle> {
    private final MongoClient client;
    private final String database;

    public DocumentStoreHandleFactory(MongoClient client, String database) {
        this.client = client;
        this.database = database;
    }

    /**
     * Build the client for a pool key from the backend connection string.
     *
     * @param key pool key (used as application name suffix)
     * @param props backend properties; {@code url} is a {@code mongodb://} connection string
     * @param engine engine limits
     * @return factory owning a new client
     * @throws IllegalArgumentException when no url or no database is configured
     */
    public static DocumentStoreHandleFactory create(PoolKey key, BackendProperties props, EngineProperties engine) {
        if (props.getUrl() == null || props.getUrl().isBlank()) {
            throw new IllegalArgumentException("Backend " + key.kind() + " needs a url");
        }
        ConnectionString connectionString = new ConnectionString(props.getUrl());
        String database = props.getDatabase() != null ? props.getDatabase() : connectionString.getDatabase();
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("Backend " + key.kind() + " needs a database (property or connection string path)");
        }

        int connectTimeoutMs = (int) props.getConnectTimeout().toMillis();
        long selectionTimeoutMs = engine.getRequestTimeout().toMillis();
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(connectionString)
                .applicationName(key.poolName())
                .applyToConnectionPoolSettings(b -> b
                        .maxSize(engine.getMaxPoolSizePerKey())
                        .minSize(engine.getMinIdlePerKey())
                        .maxConnectionIdleTime(engine.getIdleEvictionPeriod().toMillis(), TimeUnit.MILLISECONDS))
                .applyToSocketSettings(b -> b.connectTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS))
                .applyToClusterSettings(b -> b.serverSelectionTimeout(selectionTimeoutMs, TimeUnit.MILLISECONDS))
                .build();
        log.info("Creating document-store client for {} (database {})", key, database);
        return new DocumentStoreHandleFactory(MongoClients.create(settings), database);
    }

    @Override
    public DocumentStoreHandle create() {
        try {
            ClientSession session = client.startSession();
            return new DocumentStoreHandle(session, client.getDatabase(database));
        } catch (MongoException e) {
            throw DocumentStoreErrors.classify(e);
        }
    }

    @Override
    public void destroy(DocumentStoreHandle handle) {
        handle.session().close();
    }

    @Override
    public void close() {
        client.close();
    }
}
