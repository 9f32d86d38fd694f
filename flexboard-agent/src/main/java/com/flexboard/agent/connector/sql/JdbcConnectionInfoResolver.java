package com.flexboard.agent.connector.sql;

import com.flexboard.agent.config.BackendProperties;
import com.flexboard.agent.model.DataSourceKind;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Resolves backend properties into JDBC connection settings.
 *
 * A configured {@code jdbc:} URL is used as-is. A DSN ({@code postgres://...}) or discrete
 * host/port/database fields are rendered into the kind's JDBC URL format, and the kind's
 * bundled driver class is selected unless one is configured.
 */
public final class JdbcConnectionInfoResolver {

    private JdbcConnectionInfoResolver() {
    }

    /**
     * Resolve JDBC settings for a relational kind.
     *
     * @param kind relational data source kind
     * @param props backend properties
     * @return jdbc connection info
     * @throws IllegalArgumentException when neither a URL nor a host is configured
     */
    public static JdbcConnectionInfo resolve(DataSourceKind kind, BackendProperties props) {
        if (!kind.isRelational()) {
            throw new IllegalArgumentException("Not a relational data source: " + kind);
        }
        String url = props.getUrl();
        if (url != null && url.regionMatches(true, 0, "jdbc:", 0, 5)) {
            return JdbcConnectionInfo.builder()
                    .url(url)
                    .username(props.getUsername())
                    .password(props.getPassword())
                    .driverClassName(props.getDriverClassName())
                    .build();
        }

        String host = props.getHost();
        int port = props.getPort() != null ? props.getPort() : -1;
        String database = props.getDatabase();
        String username = props.getUsername();
        String password = props.getPassword();
        Map<String, String> extra = new LinkedHashMap<>();

        if (url != null && !url.isBlank()) {
            DsnParser.ParsedDsn dsn = DsnParser.parse(url);
            host = dsn.getHost();
            port = dsn.getPort();
            if (dsn.getDatabase() != null) {
                database = dsn.getDatabase();
            }
            if (dsn.getUsername() != null) {
                username = dsn.getUsername();
            }
            if (dsn.getPassword() != null) {
                password = dsn.getPassword();
            }
            extra.putAll(dsn.getQueryParams());
        }
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Backend " + kind + " needs either url or host");
        }

        String jdbcUrl;
        if (kind == DataSourceKind.POSTGRESQL) {
            jdbcUrl = buildPostgresJdbcUrl(host, port, database, props.isSsl(), extra);
        } else if (kind == DataSourceKind.MYSQL) {
            jdbcUrl = buildMysqlJdbcUrl(host, port, database, props.isSsl(), extra);
        } else {
            jdbcUrl = buildSqlServerJdbcUrl(host, port, database, props.isEncrypt(), props.isTrustServerCertificate(), extra);
        }

        return JdbcConnectionInfo.builder()
                .url(jdbcUrl)
                .username(username)
                .password(password)
                .driverClassName(props.getDriverClassName() != null ? props.getDriverClassName() : defaultDriverClass(kind))
                .build();
    }

    static String defaultDriverClass(DataSourceKind kind) {
        switch (kind) {
            case POSTGRESQL:
                return "org.postgresql.Driver";
            case MYSQL:
                return "com.mysql.cj.jdbc.Driver";
            case SQL:
                return "com.microsoft.sqlserver.jdbc.SQLServerDriver";
            default:
                return null;
        }
    }

    static String buildPostgresJdbcUrl(String host, int port, String database, boolean ssl, Map<String, String> extra) {
        Map<String, String> params = new LinkedHashMap<>(extra);
        if (ssl) {
            params.putIfAbsent("sslmode", "require");
        }
        return "jdbc:postgresql://" + host + ":" + (port > 0 ? port : 5432) + "/" + nullToEmpty(database) + queryString(params);
    }

    static String buildMysqlJdbcUrl(String host, int port, String database, boolean ssl, Map<String, String> extra) {
        Map<String, String> params = new LinkedHashMap<>(extra);
        if (ssl) {
            params.putIfAbsent("sslMode", "REQUIRED");
        }
        return "jdbc:mysql://" + host + ":" + (port > 0 ? port : 3306) + "/" + nullToEmpty(database) + queryString(params);
    }

    static String buildSqlServerJdbcUrl(String host, int port, String database, boolean encrypt, boolean trustServerCertificate,
                                        Map<String, String> extra) {
        StringBuilder url = new StringBuilder("jdbc:sqlserver://").append(host).append(':').append(port > 0 ? port : 1433);
        if (database != null && !database.isBlank()) {
            url.append(";databaseName=").append(database);
        }
        url.append(";encrypt=").append(encrypt);
        url.append(";trustServerCertificate=").append(trustServerCertificate);
        extra.forEach((k, v) -> url.append(';').append(k).append('=').append(v));
        return url.toString();
    }

    private static String queryString(Map<String, String> params) {
        if (params.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&", "?", "");
        params.forEach((k, v) -> joiner.add(URLEncoder.encode(k, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(v, StandardCharsets.UTF_8)));
        return joiner.toString();
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
