package com.flexboard.agent.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Flattens nested documents into one-level rows with dotted column names.
 *
 * <p>{@code {"a": {"b": 1}, "c": [1, 2]}} becomes {@code {"a.b": 1, "c": [1, 2]}}. Lists stay
 * values; maps inside lists are converted but not flattened. An empty nested map becomes a
 * null value under its own name. When a flattened name is already taken (a literal
 * {@code "a.b"} key next to {@code {"a": {"b": ...}}}) the later column gets a {@code _2},
 * {@code _3} suffix.
 */
public final class RowFlattener {

    private RowFlattener() {
    }

    /**
     * Flatten one document.
     *
     * @param source document (field order preserved)
     * @param leaf converter applied to every scalar value
     * @return flattened row in field order
     */
    public static Map<String, Object> flatten(Map<String, ?> source, UnaryOperator<Object> leaf) {
        Map<String, Object> row = new LinkedHashMap<>();
        flattenInto(row, null, source, leaf);
        return row;
    }

    private static void flattenInto(Map<String, Object> row, String prefix, Map<?, ?> source, UnaryOperator<Object> leaf) {
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String name = prefix == null ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                if (nested.isEmpty()) {
                    putUnique(row, name, null);
                } else {
                    flattenInto(row, name, nested, leaf);
                }
            } else {
                putUnique(row, name, convert(value, leaf));
            }
        }
    }

    private static void putUnique(Map<String, Object> row, String name, Object value) {
        String column = name;
        int suffix = 2;
        while (row.containsKey(column)) {
            column = name + "_" + suffix++;
        }
        row.put(column, value);
    }

    private static Object convert(Object value, UnaryOperator<Object> leaf) {
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object element : list) {
                out.add(convert(element, leaf));
            }
            return out;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                out.put(String.valueOf(entry.getKey()), convert(entry.getValue(), leaf));
            }
            return out;
        }
        return leaf.apply(value);
    }
}
