package com.helios.transform.core.evaluation;

import com.fasterxml.jackson.databind.JsonNode;
import com.helios.transform.core.evaluation.predicates.ComparisonOperatorEvaluator;
import com.helios.transform.core.evaluation.predicates.StringOperatorEvaluator;
import com.helios.transform.model.Condition;
import com.helios.transform.model.ValueType;

/**
 * Evaluates a compiled {@link Condition} against a slot's current value.
 * <p>
 * Never throws for any value: a type mismatch between the value and the operand
 * is simply {@code false}, and the caller skips the slot. Stateless and thread-safe.
 */
public final class ConditionEvaluator {

    public boolean evaluate(Condition condition, JsonNode value) {
        ValueType valueType = ValueType.of(value);

        return switch (condition.operator()) {
            case EQUAL_TO, NOT_EQUAL_TO,
                 LESS_THAN, LESS_THAN_OR_EQUAL,
                 GREATER_THAN, GREATER_THAN_OR_EQUAL ->
                    ComparisonOperatorEvaluator.evaluate(condition.operator(), value, condition.operand());
            case IS_ANY_OF -> valueType.isScalar() && isMember(value, condition.operand());
            case IS_NONE_OF -> valueType.isScalar()
                    && hasCandidateOfType(condition.operand(), valueType)
                    && !isMember(value, condition.operand());
            case REGEX -> StringOperatorEvaluator.matches(value, condition.pattern());
            case CONTAINS -> StringOperatorEvaluator.contains(value, condition.operand());
            case STARTS_WITH -> StringOperatorEvaluator.startsWith(value, condition.operand());
            case ENDS_WITH -> StringOperatorEvaluator.endsWith(value, condition.operand());
            case IS_NULL -> (valueType == ValueType.NULL || valueType == ValueType.MISSING) == expected(condition);
            case IS_EMPTY -> isEmptiable(valueType) && isEmpty(value) == expected(condition);
        };
    }

    private static boolean isMember(JsonNode value, JsonNode candidates) {
        for (JsonNode candidate : candidates) {
            if (ComparisonOperatorEvaluator.strictEquals(value, candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * {@code nin} only applies when the list holds values of the same category;
     * otherwise the comparison is a type mismatch.
     */
    private static boolean hasCandidateOfType(JsonNode candidates, ValueType type) {
        for (JsonNode candidate : candidates) {
            if (ValueType.of(candidate) == type) {
                return true;
            }
        }
        return false;
    }

    private static boolean isEmptiable(ValueType type) {
        return type == ValueType.STRING || type == ValueType.ARRAY || type == ValueType.OBJECT;
    }

    // TextNode.size() is always 0, so strings are checked by content
    private static boolean isEmpty(JsonNode value) {
        return value.isTextual() ? value.textValue().isEmpty() : value.size() == 0;
    }

    /**
     * Unary checks carry the expected outcome as a boolean operand (default true).
     */
    private static boolean expected(Condition condition) {
        return !condition.operand().isBoolean() || condition.operand().booleanValue();
    }
}
