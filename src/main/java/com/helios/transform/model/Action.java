package com.helios.transform.model;

import java.util.List;
import java.util.Objects;

/**
 * A single step or an ordered sequence of steps applied to the same slot.
 *
 * @param steps    never empty; a single action holds exactly one step
 * @param sequence true when declared as {@code {"op": "sequence", ...}}
 */
public record Action(List<ActionStep> steps, boolean sequence) {

    public Action {
        Objects.requireNonNull(steps, "Steps cannot be null");
        steps = List.copyOf(steps);
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("Action requires at least one step");
        }
        if (!sequence && steps.size() != 1) {
            throw new IllegalArgumentException("A single action holds exactly one step, got " + steps.size());
        }
    }

    public static Action single(ActionStep step) {
        return new Action(List.of(step), false);
    }

    public static Action sequence(List<ActionStep> steps) {
        return new Action(steps, true);
    }
}
