package com.flexboard.agent.connector.sql;

import com.flexboard.agent.config.BackendProperties;
import com.flexboard.agent.connector.Connector;
import com.flexboard.agent.error.PermanentBackendException;
import com.flexboard.agent.model.DataSourceKind;
import com.flexboard.agent.model.NativeResult;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Relational connector over JDBC, shared by the SQL Server, PostgreSQL and MySQL kinds.
 */
@Slf4j
public class JdbcConnector implements Connector<Connection> {
    static final String ROWS_AFFECTED = "rows_affected";

    private final DataSourceKind kind;
    private final BackendProperties props;
    private final SqlStatementPolicy policy;
    private final int queryTimeoutSeconds;

    /**
     * Create a connector.
     *
     * @param kind relational kind served
     * @param props backend options (read-only, limits, policy)
     * @param requestTimeout engine request timeout, applied as the statement query timeout
     */
    public JdbcConnector(DataSourceKind kind, BackendProperties props, Duration requestTimeout) {
        this.kind = kind;
        this.props = props;
        this.policy = new SqlStatementPolicy(props.isAllowAdministrative(), kind == DataSourceKind.SQL);
        this.queryTimeoutSeconds = (int) Math.max(1L, (requestTimeout.toMillis() + 999L) / 1000L);
    }

    @Override
    public NativeResult run(Connection conn, String query, Map<String, Object> params) {
        policy.check(query);
        NamedParameterSql statement = NamedParameterSql.parse(query, params);

        try {
            if (props.isReadOnly()) {
                conn.setReadOnly(true);
            }
            try (PreparedStatement stmt = conn.prepareStatement(statement.getSql())) {
                stmt.setQueryTimeout(queryTimeoutSeconds);
                if (props.getMaxRows() > 0) {
                    stmt.setMaxRows(props.getMaxRows());
                }
                if (props.getFetchSize() > 0) {
                    stmt.setFetchSize(props.getFetchSize());
                }
                List<Object> values = statement.getValues();
                for (int i = 0; i < values.size(); i++) {
                    stmt.setObject(i + 1, values.get(i));
                }

                boolean isResultSet = stmt.execute();
                if (isResultSet) {
                    try (ResultSet rs = stmt.getResultSet()) {
                        return processResultSet(rs);
                    }
                }
                int updateCount = stmt.getUpdateCount();
                Map<String, Object> row = new LinkedHashMap<>();
                row.put(ROWS_AFFECTED, Math.max(updateCount, 0));
                return NativeResult.columnar(List.of(ROWS_AFFECTED), List.of(row));
            }
        } catch (SQLException e) {
            log.debug("{} statement failed: {} (SQLState: {}, Error Code: {})", kind, e.getMessage(), e.getSQLState(), e.getErrorCode());
            throw SqlErrorClassifier.classify(e);
        } catch (RuntimeException e) {
            // driver bugs surface as unchecked exceptions; the connection state is unknown
            throw new PermanentBackendException("Unexpected " + kind + " driver failure: " + e.getMessage(), e);
        }
    }

    private NativeResult processResultSet(ResultSet rs) throws SQLException {
        ResultSetMetaData rsmd = rs.getMetaData();
        int columnCount = rsmd.getColumnCount();

        List<String> columns = new ArrayList<>(columnCount);
        Set<String> seen = new HashSet<>();
        for (int i = 1; i <= columnCount; i++) {
            String label = rsmd.getColumnLabel(i);
            if (label == null || label.isBlank()) {
                label = "column" + i;
            }
            String unique = label;
            int suffix = 2;
            while (!seen.add(unique)) {
                unique = label + "_" + suffix++;
            }
            columns.add(unique);
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(columns.get(i - 1), JdbcValues.read(rs, i));
            }
            rows.add(row);
        }
        return NativeResult.columnar(columns, rows);
    }

    @Override
    public boolean ping(Connection conn) {
        try {
            return conn.isValid(Math.min(queryTimeoutSeconds, 5));
        } catch (SQLException e) {
            log.warn("{} ping failed: {}", kind, e.getMessage());
            return false;
        }
    }
}
