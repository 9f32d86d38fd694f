package com.flexboard.agent.config;

import lombok.Data;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection parameters for one backend kind. Fields apply per connector family:
 *
 * <ul>
 *   <li>relational: {@code url} (jdbc URL or DSN) or {@code host}/{@code port}/{@code database},
 *       {@code username}, {@code password}, {@code driverClassName}, {@code readOnly},
 *       {@code allowAdministrative}, {@code maxRows}, {@code fetchSize}, {@code encrypt},
 *       {@code trustServerCertificate}, {@code ssl}</li>
 *   <li>document-store: {@code url} (mongodb connection string), {@code database}, {@code maxRows}</li>
 *   <li>http-api: {@code baseUrl}, {@code apiKey}, {@code headers}, {@code healthPath}</li>
 * </ul>
 */
@Data
public class BackendProperties {
    private String url;
    private String host;
    private Integer port;
    private String database;
    private String username;
    private String password;
    private String driverClassName;

    private boolean readOnly = false;
    private boolean allowAdministrative = false;
    private int maxRows = 10_000;
    private int fetchSize = 500;

    private boolean encrypt = false;
    private boolean trustServerCertificate = true;
    private boolean ssl = false;

    private String baseUrl;
    private String apiKey;
    private Map<String, String> headers = new LinkedHashMap<>();
    private String healthPath = "/health";

    private Duration connectTimeout = Duration.ofSeconds(10);
}
