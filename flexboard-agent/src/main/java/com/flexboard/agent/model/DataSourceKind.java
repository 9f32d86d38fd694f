package com.flexboard.agent.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.flexboard.agent.util.DataSourceKindNormalizer;

import java.util.Optional;

/**
 * Backend kinds a query can target.
 */
public enum DataSourceKind {
    /** Microsoft SQL Server. */
    SQL("sql", true),
    POSTGRESQL("postgresql", true),
    MYSQL("mysql", true),
    DOCUMENT_STORE("document-store", false),
    HTTP_API("http-api", false);

    private final String value;
    private final boolean relational;

    DataSourceKind(String value, boolean relational) {
        this.value = value;
        this.relational = relational;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isRelational() {
        return relational;
    }

    /**
     * Resolve a kind from its wire value or one of its aliases.
     *
     * @param raw incoming value
     * @return the kind, or empty when the value names no known kind
     */
    public static Optional<DataSourceKind> fromValue(String raw) {
        String normalized = DataSourceKindNormalizer.normalize(raw);
        for (DataSourceKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}
