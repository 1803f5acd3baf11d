package com.helios.transform.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A compiled, immutable predicate guarding a rule's action.
 *
 * @param operator     the comparison to perform
 * @param operand  the literal the slot value is compared against; for {@code in}/{@code nin}
 *                 the list of candidates
 * @param pattern  pre-compiled regex for {@link ConditionOperator#REGEX}, null otherwise
 */
public record Condition(
        ConditionOperator operator,
        JsonNode operand,
        Pattern pattern
) {

    public Condition {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null (use NullNode)");
        if (operator == ConditionOperator.REGEX) {
            Objects.requireNonNull(pattern, "REGEX condition requires a compiled pattern");
        }
    }

    public Condition(ConditionOperator operator, JsonNode operand) {
        this(operator, operand,
                operator == ConditionOperator.REGEX ? Pattern.compile(operand.asText()) : null);
    }

    /**
     * Overridden so two conditions with the same regex source compare equal.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Condition that = (Condition) o;
        return operator == that.operator
                && operand.equals(that.operand)
                && Objects.equals(patternToString(), that.patternToString());
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand, patternToString());
    }

    private String patternToString() {
        return pattern != null ? pattern.pattern() : null;
    }
}
