package com.helios.transform.model;

import java.util.Objects;

/**
 * One operator plus its typed parameters.
 */
public record ActionStep(ActionOperator operator, StepParameters parameters) {

    public ActionStep {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(parameters, "Parameters cannot be null");
        if (operator == ActionOperator.SEQUENCE) {
            throw new IllegalArgumentException("A sequence is an Action, not a step");
        }
    }

    public static ActionStep of(ActionOperator operator) {
        return new ActionStep(operator, StepParameters.None.INSTANCE);
    }
}
