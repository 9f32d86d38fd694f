package com.flexboard.agent.connector.sql;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.sql.Struct;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

/**
 * Converts JDBC driver values into JSON-safe values so that no driver-specific object reaches
 * the result serializer.
 */
@Slf4j
final class JdbcValues {
    static final int MAX_LOB_CHARS = 100_000;
    static final int MAX_BLOB_BYTES = 100_000;
    static final int MAX_STRING_CHARS = 100_000;
    private static final int MAX_NESTED_DEPTH = 3;
    private static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";

    private JdbcValues() {
    }

    /**
     * Read one column of the current row.
     *
     * @param rs result set
     * @param columnIndex 1-based column index
     * @return json-safe value
     * @throws SQLException on JDBC errors
     */
    static Object read(ResultSet rs, int columnIndex) throws SQLException {
        return toJsonSafe(rs.getObject(columnIndex), 0);
    }

    static Object toJsonSafe(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }
        if (depth > MAX_NESTED_DEPTH) {
            return UNSUPPORTED_PLACEHOLDER;
        }
        if (v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return truncate(s);
        }
        if (v instanceof Character) {
            return v.toString();
        }
        if (v instanceof java.sql.Timestamp ts) {
            return ts.toLocalDateTime().toString();
        }
        if (v instanceof java.sql.Date date) {
            return date.toLocalDate().toString();
        }
        if (v instanceof java.sql.Time time) {
            return time.toLocalTime().toString();
        }
        if (v instanceof TemporalAccessor || v instanceof UUID) {
            return v.toString();
        }
        if (v instanceof java.util.Date date) {
            return date.toInstant().toString();
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof Blob blob) {
            return readBlobBase64(blob);
        }
        if (v instanceof SQLXML xml) {
            return truncate(xml.getString());
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof Struct struct) {
            Object[] attrs = struct.getAttributes();
            List<Object> out = new ArrayList<>();
            if (attrs != null) {
                for (Object attr : attrs) {
                    out.add(toJsonSafe(attr, depth + 1));
                }
            }
            return out;
        }
        if (v instanceof java.sql.Array arr) {
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] objectArray) {
                List<Object> out = new ArrayList<>(objectArray.length);
                for (Object elem : objectArray) {
                    out.add(toJsonSafe(elem, depth + 1));
                }
                return out;
            }
            return truncate(String.valueOf(arrayValue));
        }

        String unwrapped = unwrapDriverObject(v);
        return truncate(unwrapped != null ? unwrapped : String.valueOf(v));
    }

    /**
     * PostgreSQL returns json, jsonb, interval and custom types as {@code PGobject}; its text
     * form is the value the dashboard wants.
     */
    private static String unwrapDriverObject(Object v) {
        if (!"org.postgresql.util.PGobject".equals(v.getClass().getName())) {
            return null;
        }
        try {
            Method getValue = v.getClass().getMethod("getValue");
            Object value = getValue.invoke(v);
            return value != null ? value.toString() : null;
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException e) {
            log.debug("Could not unwrap {}: {}", v.getClass().getName(), e.getMessage());
            return null;
        }
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_STRING_CHARS) {
            return s;
        }
        return s.substring(0, MAX_STRING_CHARS);
    }

    private static String readClob(Clob clob) throws SQLException {
        long length = clob.length();
        int toRead = (int) Math.min(length, MAX_LOB_CHARS);
        if (toRead <= 0) {
            return "";
        }
        try {
            return clob.getSubString(1, toRead);
        } catch (SQLException e) {
            log.debug("getSubString failed, falling back to character stream: {}", e.getMessage());
            return readClobStream(clob);
        }
    }

    private static String readClobStream(Clob clob) throws SQLException {
        try (Reader reader = clob.getCharacterStream()) {
            if (reader == null) {
                return "";
            }
            char[] buf = new char[8192];
            StringBuilder sb = new StringBuilder();
            int n;
            while (sb.length() < MAX_LOB_CHARS && (n = reader.read(buf, 0, Math.min(buf.length, MAX_LOB_CHARS - sb.length()))) > 0) {
                sb.append(buf, 0, n);
            }
            return sb.toString();
        } catch (IOException e) {
            throw new SQLException("Failed to read CLOB value", e);
        }
    }

    private static String readBlobBase64(Blob blob) throws SQLException {
        int toRead = (int) Math.min(blob.length(), MAX_BLOB_BYTES);
        if (toRead <= 0) {
            return "";
        }
        return Base64.getEncoder().encodeToString(blob.getBytes(1, toRead));
    }
}
