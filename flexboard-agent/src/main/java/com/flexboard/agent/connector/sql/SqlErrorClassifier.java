package com.flexboard.agent.connector.sql;

import com.flexboard.agent.error.PermanentBackendException;
import com.flexboard.agent.error.QueryDispatchException;
import com.flexboard.agent.error.QueryTimeoutException;
import com.flexboard.agent.error.TransientBackendException;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Maps JDBC failures onto the dispatch error taxonomy, mostly by SQLSTATE.
 */
public final class SqlErrorClassifier {

    private static final Set<String> TRANSIENT_STATES = Set.of(
            "40001", // serialization failure
            "40P01", // deadlock detected
            "53300", // too many connections
            "57P01", // admin shutdown
            "57P02", // crash shutdown
            "57P03", // cannot connect now
            "HYT00",
            "HYT01"
    );

    /** Classes where the server rejected the statement itself and the session is intact. */
    private static final Set<String> STATEMENT_CLASSES = Set.of("0A", "21", "22", "23", "42", "44");

    private SqlErrorClassifier() {
    }

    /**
     * Classify a JDBC failure.
     *
     * @param e failure raised by the driver
     * @return matching dispatch exception
     */
    public static QueryDispatchException classify(SQLException e) {
        String message = describe(e);
        if (e instanceof SQLTimeoutException) {
            return new QueryTimeoutException("Query timed out: " + message, e);
        }
        if (isTransient(e)) {
            return new TransientBackendException(message, e);
        }
        return new PermanentBackendException(message, null, e, isStatementError(e));
    }

    /**
     * Whether retrying on a fresh connection may succeed.
     *
     * @param e failure
     * @return true for connection-class, contention and recoverable failures
     */
    public static boolean isTransient(SQLException e) {
        if (e instanceof SQLTimeoutException) {
            return false;
        }
        String state = e.getSQLState();
        if (state != null) {
            if (state.startsWith("08") || TRANSIENT_STATES.contains(state)) {
                return true;
            }
            if (state.startsWith("28")) {
                return false;
            }
        }
        return e instanceof SQLTransientException || e instanceof SQLRecoverableException;
    }

    /**
     * Whether the server answered cleanly and the connection can serve the next request.
     *
     * @param e failure
     * @return true for syntax, data, integrity and unsupported-feature errors
     */
    public static boolean isStatementError(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.length() >= 2 && STATEMENT_CLASSES.contains(state.substring(0, 2));
    }

    private static String describe(SQLException e) {
        String base = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return e.getSQLState() != null ? base + " (SQLState " + e.getSQLState() + ")" : base;
    }
}
