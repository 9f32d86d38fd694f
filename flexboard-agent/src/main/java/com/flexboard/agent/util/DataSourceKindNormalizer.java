package com.flexboard.agent.util;

import java.util.Locale;
import java.util.Map;

/**
 * Normalizes incoming data source kinds (and aliases) into canonical kind strings.
 *
 * This must run before the connector lookup so that {@code "Postgres"} and {@code "postgresql"}
 * resolve to the same pool partition.
 */
public final class DataSourceKindNormalizer {

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("sqlserver", "sql"),
            Map.entry("mssql", "sql"),
            Map.entry("postgres", "postgresql"),
            Map.entry("pg", "postgresql"),
            Map.entry("mongodb", "document-store"),
            Map.entry("mongo", "document-store"),
            Map.entry("document", "document-store"),
            Map.entry("document_store", "document-store"),
            // Dashboards built before the document store moved to MongoDB still send "firestore".
            Map.entry("firestore", "document-store"),
            // Older dashboards send "api".
            Map.entry("api", "http-api"),
            Map.entry("http", "http-api"),
            Map.entry("http_api", "http-api")
    );

    private DataSourceKindNormalizer() {
    }

    /**
     * Normalize a data source kind.
     *
     * @param kind incoming kind
     * @return normalized kind (trimmed, lowercased, alias mapped); empty string for null or blank
     */
    public static String normalize(String kind) {
        if (kind == null) {
            return "";
        }
        String v = kind.trim().toLowerCase(Locale.ROOT);
        if (v.isBlank()) {
            return "";
        }
        return ALIASES.getOrDefault(v, v);
    }
}
