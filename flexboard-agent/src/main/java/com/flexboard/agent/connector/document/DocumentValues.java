package com.flexboard.agent.connector.document;

import org.bson.BsonTimestamp;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.UUID;

/**
 * Converts BSON values into JSON-safe values.
 */
final class DocumentValues {

    private DocumentValues() {
    }

    static Object toJsonSafe(Object v) {
        if (v == null || v instanceof String || v instanceof Boolean) {
            return v;
        }
        if (v instanceof Decimal128 decimal) {
            if (decimal.isNaN() || decimal.isInfinite()) {
                return decimal.toString();
            }
            try {
                return decimal.bigDecimalValue();
            } catch (ArithmeticException negativeZero) {
                return decimal.toString();
            }
        }
        if (v instanceof Number) {
            return v;
        }
        if (v instanceof ObjectId id) {
            return id.toHexString();
        }
        if (v instanceof Date date) {
            return date.toInstant().toString();
        }
        if (v instanceof BsonTimestamp ts) {
            return Instant.ofEpochSecond(ts.getTime()).toString();
        }
        if (v instanceof Binary binary) {
            return Base64.getEncoder().encodeToString(binary.getData());
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof UUID) {
            return v.toString();
        }
        return String.valueOf(v);
    }
}
