package com.flexboard.agent.model;

import java.util.List;
import java.util.Map;

/**
 * Result as produced by a connector, before normalization.
 *
 * <p>Columnar backends (JDBC) declare their fields up front; row-oriented backends (documents,
 * JSON arrays) only carry rows whose keys may differ from one row to the next.
 */
public final class NativeResult {
    private final List<String> declaredColumns;
    private final List<Map<String, Object>> rows;

    private NativeResult(List<String> declaredColumns, List<Map<String, Object>> rows) {
        this.declaredColumns = declaredColumns != null ? List.copyOf(declaredColumns) : null;
        this.rows = rows != null ? rows : List.of();
    }

    public static NativeResult columnar(List<String> columns, List<Map<String, Object>> rows) {
        return new NativeResult(columns, rows);
    }

    public static NativeResult rowOriented(List<Map<String, Object>> rows) {
        return new NativeResult(null, rows);
    }

    public boolean isColumnar() {
        return declaredColumns != null;
    }

    /**
     * Declared column order.
     *
     * @return columns, or null for row-oriented results
     */
    public List<String> getDeclaredColumns() {
        return declaredColumns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }
}
