package com.flexboard.agent.connector;

import com.flexboard.agent.model.DataSourceKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup table from data source kind to its registered backend.
 *
 * Only configured backends are registered, so an unconfigured kind is rejected the same way
 * as an unknown one.
 */
public class ConnectorRegistry {
    private final Map<DataSourceKind, BackendRegistration<?>> registrations = new EnumMap<>(DataSourceKind.class);

    /**
     * Register a backend, replacing any earlier registration for the same kind.
     *
     * @param registration backend
     * @return this registry
     */
    public ConnectorRegistry register(BackendRegistration<?> registration) {
        registrations.put(registration.kind(), registration);
        return this;
    }

    public Optional<BackendRegistration<?>> find(DataSourceKind kind) {
        return Optional.ofNullable(registrations.get(kind));
    }

    /** Registered kinds in declaration order. */
    public List<DataSourceKind> kinds() {
        return List.copyOf(registrations.keySet());
    }
}
