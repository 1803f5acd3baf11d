package com.helios.transform.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed set of condition operators. Each constant lists the names it is
 * written as in a rule source.
 */
public enum ConditionOperator {
    EQUAL_TO("==", "eq"),
    NOT_EQUAL_TO("!=", "ne"),
    LESS_THAN("<", "lt"),
    LESS_THAN_OR_EQUAL("<=", "lte"),
    GREATER_THAN(">", "gt"),
    GREATER_THAN_OR_EQUAL(">=", "gte"),
    IS_ANY_OF("in"),
    IS_NONE_OF("nin"),
    REGEX("regex", "matches"),
    CONTAINS("contains"),
    STARTS_WITH("startsWith"),
    ENDS_WITH("endsWith"),
    IS_NULL("isNull"),
    IS_EMPTY("isEmpty");

    private static final Map<String, ConditionOperator> BY_NAME = new HashMap<>();

    static {
        for (ConditionOperator op : values()) {
            for (String name : op.names) {
                BY_NAME.put(name, op);
            }
        }
    }

    private final List<String> names;

    ConditionOperator(String... names) {
        this.names = List.of(names);
    }

    /**
     * Resolves a rule-source operator name.
     *
     * @param text the operator name (e.g. {@code ">="} or {@code "startsWith"})
     * @return the operator, or null if the name is unknown
     */
    public static ConditionOperator fromString(String text) {
        if (text == null) return null;
        return BY_NAME.get(text);
    }

    /**
     * Operators that order two values; they accept only numbers or strings.
     */
    /**
     * Unary checks take an optional boolean operand instead of a comparison value.
     */
    public boolean isUnary() {
        return this == IS_NULL || this == IS_EMPTY;
    }

    @JsonValue
    public String getValue() {
        return names.get(0);
    }
}
