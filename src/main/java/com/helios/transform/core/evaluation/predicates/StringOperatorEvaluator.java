package com.helios.transform.core.evaluation.predicates;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.regex.Pattern;

/**
 * String-only predicates. A non-string value never matches.
 */
public final class StringOperatorEvaluator {

    private StringOperatorEvaluator() {
    }

    /**
     * Full-string regex match.
     */
    public static boolean matches(JsonNode value, Pattern pattern) {
        return value.isTextual() && pattern.matcher(value.textValue()).matches();
    }

    public static boolean startsWith(JsonNode value, JsonNode prefix) {
        return value.isTextual() && prefix.isTextual() && value.textValue().startsWith(prefix.textValue());
    }

    public static boolean endsWith(JsonNode value, JsonNode suffix) {
        return value.isTextual() && suffix.isTextual() && value.textValue().endsWith(suffix.textValue());
    }

    /**
     * Substring test for strings; strict element membership for arrays.
     */
    public static boolean contains(JsonNode value, JsonNode needle) {
        if (value.isTextual()) {
            return needle.isTextual() && value.textValue().contains(needle.textValue());
        }
        if (value.isArray()) {
            for (JsonNode element : value) {
                if (ComparisonOperatorEvaluator.strictEquals(element, needle)) {
                    return true;
                }
            }
        }
        return false;
    }
}
