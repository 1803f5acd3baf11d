package com.helios.transform.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed set of action operators understood by the executor.
 */
public enum ActionOperator {
    REPLACE("replace"),
    DEFAULT("default", "coalesce"),
    CAST("cast"),
    TRIM("trim"),
    UPPERCASE("uppercase"),
    LOWERCASE("lowercase"),
    ADD("add"),
    SUB("sub"),
    MUL("mul"),
    DIV("div"),
    ROUND("round"),
    FORMAT_DATE("formatDate"),
    OFFSET_DATE("offsetDate"),
    CONVERT_UNIT("convertUnit"),
    MAP("map"),
    SEQUENCE("sequence");

    private static final Map<String, ActionOperator> BY_NAME = new HashMap<>();

    static {
        for (ActionOperator op : values()) {
            for (String name : op.names) {
                BY_NAME.put(name, op);
            }
        }
    }

    private final List<String> names;

    ActionOperator(String... names) {
        this.names = List.of(names);
    }

    /**
     * @return the operator for a rule-source name, or null if unknown
     */
    public static ActionOperator fromString(String text) {
        if (text == null) return null;
        return BY_NAME.get(text);
    }

    public boolean isArithmetic() {
        return this == ADD || this == SUB || this == MUL || this == DIV;
    }

    public boolean isTextual() {
        return this == TRIM || this == UPPERCASE || this == LOWERCASE;
    }

    @JsonValue
    public String getValue() {
        return names.get(0);
    }
}
