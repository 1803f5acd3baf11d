package com.helios.transform.core.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.helios.transform.core.path.Slot;
import com.helios.transform.model.Action;
import com.helios.transform.model.ActionStep;
import com.helios.transform.model.StepParameters;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies an action (one step or a sequence) to a slot.
 * <p>
 * Every step either produces a new value or signals a no-op with
 * {@link Optional#empty()}. In a sequence each step receives the output of the
 * previous step, or the unchanged input when that step was a no-op; a no-op never
 * aborts the sequence. The slot is written once, after the last step, and only if
 * some step produced a value.
 * <p>
 * Dispatch is a closed switch over {@link com.helios.transform.model.ActionOperator};
 * a step whose parameters do not have the expected shape falls through to a no-op.
 * Stateless and thread-safe.
 */
public final class ActionExecutor {
    private static final Logger logger = Logger.getLogger(ActionExecutor.class.getName());

    /**
     * Executes the action against the slot's current value.
     *
     * @return the value written to the slot, or empty when every step was a no-op
     */
    public Optional<JsonNode> execute(Action action, Slot slot) {
        JsonNode current = slot.get();
        boolean changed = false;

        for (ActionStep step : action.steps()) {
            Optional<JsonNode> result = apply(step, current);
            if (result.isPresent()) {
                current = result.get();
                changed = true;
            } else if (logger.isLoggable(Level.FINE)) {
                logger.fine("No-op: " + step.operator().getValue() + " at " + slot.describe());
            }
        }

        if (!changed) {
            return Optional.empty();
        }
        slot.set(current);
        return Optional.of(current);
    }

    /**
     * Applies a single step to a value without touching any slot.
     */
    public Optional<JsonNode> apply(ActionStep step, JsonNode value) {
        StepParameters parameters = step.parameters();

        return switch (step.operator()) {
            case REPLACE -> parameters instanceof StepParameters.Value v
                    ? copyOf(v.value())
                    : Optional.empty();
            case DEFAULT -> parameters instanceof StepParameters.Value v && isValueLess(value)
                    ? copyOf(v.value())
                    : Optional.empty();
            case CAST -> parameters instanceof StepParameters.CastTo c
                    ? CastOperations.cast(value, c.target())
                    : Optional.empty();
            case TRIM, UPPERCASE, LOWERCASE -> TextOperations.apply(step.operator(), value);
            case ADD, SUB, MUL, DIV -> parameters instanceof StepParameters.Operand o
                    ? NumericOperations.arithmetic(step.operator(), value, o.by())
                    : Optional.empty();
            case ROUND -> parameters instanceof StepParameters.Digits d
                    ? NumericOperations.round(value, d.digits())
                    : Optional.empty();
            case FORMAT_DATE -> parameters instanceof StepParameters.DateFormat f
                    ? DateOperations.format(value, f.from(), f.to())
                    : Optional.empty();
            case OFFSET_DATE -> parameters instanceof StepParameters.DateOffset o
                    ? DateOperations.offset(value, o.amount(), o.unit(), o.format())
                    : Optional.empty();
            case CONVERT_UNIT -> parameters instanceof StepParameters.UnitPair u
                    ? UnitConversions.convert(value, u.from(), u.to())
                    : Optional.empty();
            case MAP -> parameters instanceof StepParameters.ValueMapping m
                    ? ValueMappings.map(value, m)
                    : Optional.empty();
            // Never a step; rejected by the ActionStep constructor
            case SEQUENCE -> Optional.empty();
        };
    }

    private static boolean isValueLess(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }

    /**
     * Rule-set literals are shared by every document; each write gets its own copy.
     */
    private static Optional<JsonNode> copyOf(JsonNode literal) {
        JsonNode copy = literal.deepCopy();
        return Optional.of(copy);
    }
}
