package com.helios.transform.core.evaluation.predicates;

import com.fasterxml.jackson.databind.JsonNode;
import com.helios.transform.model.ConditionOperator;
import com.helios.transform.model.ValueType;

import java.util.Iterator;
import java.util.Map;

/**
 * Strictly typed equality and ordering.
 * <p>
 * Two values are only ever compared when they belong to the same {@link ValueType}.
 * Numbers compare by numeric value regardless of representation ({@code 1 == 1.0}),
 * strings compare lexically by UTF-16 code unit. There is no coercion between
 * categories: {@code "5" > 0} is false, and so is {@code "5" != 5}.
 */
public final class ComparisonOperatorEvaluator {

    private ComparisonOperatorEvaluator() {
    }

    /**
     * Evaluates an equality or ordering operator. Any other operator returns false.
     */
    public static boolean evaluate(ConditionOperator operator, JsonNode value, JsonNode operand) {
        ValueType valueType = ValueType.of(value);
        ValueType operandType = ValueType.of(operand);
        if (valueType != operandType || valueType == ValueType.UNSUPPORTED) {
            return false;
        }

        return switch (operator) {
            case EQUAL_TO -> strictEquals(value, operand);
            case NOT_EQUAL_TO -> !strictEquals(value, operand);
            case LESS_THAN -> valueType.isOrderable() && compare(value, operand) < 0;
            case LESS_THAN_OR_EQUAL -> valueType.isOrderable() && compare(value, operand) <= 0;
            case GREATER_THAN -> valueType.isOrderable() && compare(value, operand) > 0;
            case GREATER_THAN_OR_EQUAL -> valueType.isOrderable() && compare(value, operand) >= 0;
            default -> false;
        };
    }

    /**
     * Deep equality without coercion. Numbers nested in arrays and objects also
     * compare by numeric value.
     */
    public static boolean strictEquals(JsonNode a, JsonNode b) {
        ValueType type = ValueType.of(a);
        if (type != ValueType.of(b)) {
            return false;
        }
        switch (type) {
            case NULL:
            case MISSING:
                return true;
            case BOOLEAN:
                return a.booleanValue() == b.booleanValue();
            case NUMBER:
                return a.decimalValue().compareTo(b.decimalValue()) == 0;
            case STRING:
                return a.textValue().equals(b.textValue());
            case ARRAY:
                if (a.size() != b.size()) return false;
                for (int i = 0; i < a.size(); i++) {
                    if (!strictEquals(a.get(i), b.get(i))) return false;
                }
                return true;
            case OBJECT:
                if (a.size() != b.size()) return false;
                Iterator<Map.Entry<String, JsonNode>> fields = a.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> entry = fields.next();
                    JsonNode other = b.get(entry.getKey());
                    if (other == null || !strictEquals(entry.getValue(), other)) return false;
                }
                return true;
            default:
                return false;
        }
    }

    /**
     * Orders two values of the same orderable category. Callers must check the
     * categories first.
     */
    static int compare(JsonNode a, JsonNode b) {
        if (ValueType.isNumeric(a)) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return a.textValue().compareTo(b.textValue());
    }
}
