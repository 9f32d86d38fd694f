package com.flexboard.agent.connector.sql;

import com.flexboard.agent.error.ValidationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Rewrites a statement with {@code :name}, {@code ?} or {@code $n} placeholders into JDBC
 * {@code ?} form and lines up the values to bind.
 *
 * <p>{@code ?} binds parameters in map insertion order, {@code $n} binds the n-th parameter in
 * insertion order, {@code :name} binds by name and may repeat. One statement uses one style.
 */
public final class NamedParameterSql {

    private enum Style { NAMED, POSITIONAL, NUMBERED }

    private final String sql;
    private final List<Object> values;

    private NamedParameterSql(String sql, List<Object> values) {
        this.sql = sql;
        this.values = Collections.unmodifiableList(values);
    }

    /** Statement text with every placeholder rewritten to {@code ?}. */
    public String getSql() {
        return sql;
    }

    /** Values in bind order. */
    public List<Object> getValues() {
        return values;
    }

    /**
     * Parse a statement against its parameters.
     *
     * @param query statement text
     * @param params parameters in insertion order
     * @return rewritten statement and bind values
     * @throws ValidationException on mixed styles, missing or non-scalar values, or a
     *         positional count mismatch
     */
    public static NamedParameterSql parse(String query, Map<String, Object> params) {
        String masked = SqlText.mask(query);
        List<Object> orderedValues = new ArrayList<>(params.values());
        List<String> orderedNames = new ArrayList<>(params.keySet());

        StringBuilder out = new StringBuilder(query.length());
        List<Object> values = new ArrayList<>();
        Style style = null;
        int positional = 0;
        int copyFrom = 0;
        int i = 0;
        int n = masked.length();

        while (i < n) {
            char c = masked.charAt(i);
            char prev = i > 0 ? masked.charAt(i - 1) : '\0';
            char next = i + 1 < n ? masked.charAt(i + 1) : '\0';

            if (c == ':' && next == ':') {
                // ::type cast
                i += 2;
                continue;
            }
            if (c == ':' && prev != ':' && SqlText.isIdentifierStart(next)) {
                style = checkStyle(style, Style.NAMED);
                int end = i + 1;
                while (end < n && SqlText.isIdentifierPart(masked.charAt(end))) {
                    end++;
                }
                String name = query.substring(i + 1, end);
                if (!params.containsKey(name)) {
                    throw new ValidationException("Missing value for parameter :" + name);
                }
                values.add(scalar(name, params.get(name)));
                out.append(query, copyFrom, i).append('?');
                copyFrom = end;
                i = end;
                continue;
            }
            if (c == '?') {
                style = checkStyle(style, Style.POSITIONAL);
                if (positional < orderedValues.size()) {
                    values.add(scalar(orderedNames.get(positional), orderedValues.get(positional)));
                }
                positional++;
                i++;
                continue;
            }
            if (c == '$' && Character.isDigit(next) && !SqlText.isIdentifierPart(prev)) {
                style = checkStyle(style, Style.NUMBERED);
                int end = i + 1;
                while (end < n && Character.isDigit(masked.charAt(end))) {
                    end++;
                }
                int index = Integer.parseInt(query.substring(i + 1, end));
                if (index < 1 || index > orderedValues.size()) {
                    throw new ValidationException("Missing value for parameter $" + index
                            + " (" + orderedValues.size() + " parameter(s) supplied)");
                }
                values.add(scalar(orderedNames.get(index - 1), orderedValues.get(index - 1)));
                out.append(query, copyFrom, i).append('?');
                copyFrom = end;
                i = end;
                continue;
            }
            i++;
        }

        if (style == Style.POSITIONAL && positional != orderedValues.size()) {
            throw new ValidationException("Statement has " + positional + " positional placeholder(s) but "
                    + orderedValues.size() + " parameter(s) were supplied");
        }

        out.append(query, copyFrom, n);
        return new NamedParameterSql(stripTrailingSemicolons(out.toString()), values);
    }

    private static Style checkStyle(Style current, Style found) {
        if (current != null && current != found) {
            throw new ValidationException("Cannot mix " + describe(current) + " and " + describe(found) + " placeholders");
        }
        return found;
    }

    private static String describe(Style style) {
        switch (style) {
            case NAMED:
                return ":name";
            case POSITIONAL:
                return "?";
            default:
                return "$n";
        }
    }

    static Object scalar(String name, Object value) {
        if (value == null
                || value instanceof String
                || value instanceof Boolean
                || value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof Double
                || value instanceof Float
                || value instanceof BigDecimal
                || value instanceof BigInteger
                || value instanceof Character
                || value instanceof UUID
                || value instanceof Temporal
                || value instanceof java.util.Date
                || value instanceof byte[]) {
            return value;
        }
        throw new ValidationException("Parameter " + name + " must be a scalar value, got " + value.getClass().getSimpleName());
    }

    private static String stripTrailingSemicolons(String sql) {
        String masked = SqlText.mask(sql);
        int end = sql.length();
        while (end > 0) {
            char c = sql.charAt(end - 1);
            if (!Character.isWhitespace(c) && !(c == ';' && masked.charAt(end - 1) == ';')) {
                break;
            }
            end--;
        }
        return sql.substring(0, end);
    }
}
