package com.flexboard.agent.connector.sql;

import com.flexboard.agent.config.BackendProperties;
import com.flexboard.agent.error.PermanentBackendException;
import com.flexboard.agent.model.DataSourceKind;
import com.flexboard.agent.model.NativeResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JdbcConnector Tests")
class JdbcConnectorTest {

    private Connection conn;
    private BackendProperties props;

    @BeforeEach
    void setUp() throws SQLException {
        String url = "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE";
        conn = DriverManager.getConnection(url, "sa", "");
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE costs (tenant VARCHAR(64), branch VARCHAR(64), cost DECIMAL(10,2), booked DATE)");
            stmt.execute("INSERT INTO costs VALUES "
                    + "('vpi-co-ltd', 'north', 100.00, DATE '2024-01-05'), "
                    + "('vpi-co-ltd', 'north', 200.00, DATE '2024-01-06'), "
                    + "('vpi-co-ltd', 'south', 50.00, DATE '2024-01-07'), "
                    + "('other', 'east', 999.00, DATE '2024-01-08')");
        }
        props = new BackendProperties();
    }

    @AfterEach
    void tearDown() throws SQLException {
        conn.close();
    }

    private JdbcConnector connector() {
        return new JdbcConnector(DataSourceKind.POSTGRESQL, props, Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Should aggregate with named parameters and keep declared column order")
    void aggregatesWithNamedParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("tenant", "vpi-co-ltd");

        NativeResult result = connector().run(conn,
                "SELECT branch, AVG(cost) AS avg_cost FROM costs WHERE tenant = :tenant GROUP BY branch ORDER BY branch",
                params);

        assertThat(result.isColumnar()).isTrue();
        assertThat(result.getDeclaredColumns()).containsExactly("branch", "avg_cost");
        assertThat(result.getRows()).hasSize(2);
        assertThat(result.getRows().get(0).get("branch")).isEqualTo("north");
        assertThat(((Number) result.getRows().get(0).get("avg_cost")).doubleValue()).isEqualTo(150.0);
        assertThat(((Number) result.getRows().get(1).get("avg_cost")).doubleValue()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Should render dates as ISO strings")
    void rendersDatesAsIsoStrings() {
        NativeResult result = connector().run(conn,
                "SELECT booked FROM costs WHERE branch = 'south'", Map.of());

        assertThat(result.getRows().get(0).get("booked")).isEqualTo("2024-01-07");
    }

    @Test
    @DisplayName("Should report rows affected for updates")
    void reportsRowsAffected() {
        NativeResult result = connector().run(conn,
                "UPDATE costs SET cost = cost + 1 WHERE branch = ?", Map.of("branch", "north"));

        assertThat(result.getDeclaredColumns()).containsExactly(JdbcConnector.ROWS_AFFECTED);
        assertThat(result.getRows().get(0).get(JdbcConnector.ROWS_AFFECTED)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should suffix duplicate column labels")
    void suffixesDuplicateLabels() {
        NativeResult result = connector().run(conn,
                "SELECT branch AS v, tenant AS v, cost AS v FROM costs WHERE branch = 'south'", Map.of());

        assertThat(result.getDeclaredColumns()).containsExactly("v", "v_2", "v_3");
    }

    @Test
    @DisplayName("Should cap rows at the configured maximum")
    void capsRows() {
        props.setMaxRows(1);

        NativeResult result = connector().run(conn, "SELECT * FROM costs", Map.of());

        assertThat(result.getRows()).hasSize(1);
    }

    @Test
    @DisplayName("Should report syntax errors as permanent with a reusable connection")
    void syntaxErrorIsPermanentAndReusable() {
        assertThatThrownBy(() -> connector().run(conn, "SELEC branch FROM costs", Map.of()))
                .isInstanceOf(PermanentBackendException.class)
                .satisfies(e -> assertThat(((PermanentBackendException) e).isHandleReusable()).isTrue());

        assertThat(connector().ping(conn)).isTrue();
    }

    @Test
    @DisplayName("Should reject DDL before touching the connection")
    void rejectsDdl() {
        assertThatThrownBy(() -> connector().run(conn, "DROP TABLE costs", Map.of()))
                .isInstanceOf(PermanentBackendException.class)
                .hasMessageContaining("DROP");

        NativeResult stillThere = connector().run(conn, "SELECT COUNT(*) AS n FROM costs", Map.of());
        assertThat(((Number) stillThere.getRows().get(0).get("n")).intValue()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should report a closed connection as unhealthy")
    void pingClosedConnection() throws SQLException {
        conn.close();

        assertThat(connector().ping(conn)).isFalse();
    }
}
