package com.flexboard.agent.service;

import com.flexboard.agent.model.NativeResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a connector's native result into the common tabular shape.
 *
 * <p>Columnar results keep their declared order. Row-oriented results take the first row's
 * key order, then append keys first seen in later rows. Every output row carries exactly the
 * output columns, in order, with {@code null} for fields a row did not have.
 */
public final class ResultNormalizer {

    private ResultNormalizer() {
    }

    public static NormalizedResult normalize(NativeResult result) {
        List<Map<String, Object>> source = result.getRows();
        List<String> columns;
        if (result.isColumnar()) {
            Set<String> union = new LinkedHashSet<>(result.getDeclaredColumns());
            // a misbehaving connector may add undeclared keys; keep them rather than drop data
            for (Map<String, Object> row : source) {
                union.addAll(row.keySet());
            }
            columns = new ArrayList<>(union);
        } else {
            Set<String> union = new LinkedHashSet<>();
            for (Map<String, Object> row : source) {
                union.addAll(row.keySet());
            }
            columns = new ArrayList<>(union);
        }

        List<Map<String, Object>> rows = new ArrayList<>(source.size());
        for (Map<String, Object> row : source) {
            Map<String, Object> shaped = new LinkedHashMap<>();
            for (String column : columns) {
                shaped.put(column, row.get(column));
            }
            rows.add(Collections.unmodifiableMap(shaped));
        }
        return new NormalizedResult(Collections.unmodifiableList(columns), Collections.unmodifiableList(rows));
    }

    /**
     * Tabular result ready for {@link com.flexboard.agent.api.QueryResult}.
     *
     * @param columns column names in output order
     * @param rows rows keyed by exactly {@code columns}
     */
    public record NormalizedResult(List<String> columns, List<Map<String, Object>> rows) {

        public int rowCount() {
            return rows.size();
        }
    }
}
