package com.helios.transform.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON value categories used for strict typing.
 * Values of different categories are never coerced into each other.
 * <p>
 * {@link #UNSUPPORTED} covers nodes no operator applies to: floating point nodes
 * holding infinity or NaN (a literal such as {@code 1e400} overflows to infinity
 * when parsed as a double), and binary or POJO nodes.
 */
public enum ValueType {
    NULL, BOOLEAN, NUMBER, STRING, ARRAY, OBJECT, MISSING, UNSUPPORTED;

    public static ValueType of(JsonNode node) {
        if (node == null || node.isMissingNode()) return MISSING;
        if (node.isNull()) return NULL;
        if (node.isBoolean()) return BOOLEAN;
        if (node.isNumber()) return isFinite(node) ? NUMBER : UNSUPPORTED;
        if (node.isTextual()) return STRING;
        if (node.isArray()) return ARRAY;
        if (node.isObject()) return OBJECT;
        return UNSUPPORTED;
    }

    /**
     * True when the node is a number with an exact decimal value, so
     * {@link JsonNode#decimalValue()} is safe to call.
     */
    public static boolean isNumeric(JsonNode node) {
        return of(node) == NUMBER;
    }

    private static boolean isFinite(JsonNode number) {
        if (number.isDouble() || number.isFloat()) {
            return Double.isFinite(number.doubleValue());
        }
        return true;
    }

    /**
     * True for categories that ordering operators accept.
     */
    public boolean isOrderable() {
        return this == NUMBER || this == STRING;
    }

    public boolean isScalar() {
        return this == BOOLEAN || this == NUMBER || this == STRING || this == NULL;
    }
}
