package com.flexboard.agent.connector.sql;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

/**
 * Resolved JDBC settings for one relational backend.
 */
@Data
@Builder
public class JdbcConnectionInfo {
    private String url;
    private String username;
    @ToString.Exclude
    private String password;
    private String driverClassName;
}
