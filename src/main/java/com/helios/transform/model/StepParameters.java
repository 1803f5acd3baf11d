package com.helios.transform.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Typed, pre-validated parameters of a single action step.
 * <p>
 * Each {@link ActionOperator} is paired with exactly one of the records below by the
 * rule compiler. The executor matches on the operator and expects the corresponding
 * record; any other pairing is treated as a no-op rather than an error.
 */
public sealed interface StepParameters {

    /** Operators without parameters (trim, uppercase, lowercase). */
    record None() implements StepParameters {
        public static final None INSTANCE = new None();
    }

    /** replace / default. */
    record Value(JsonNode value) implements StepParameters {
        public Value {
            Objects.requireNonNull(value, "value");
        }
    }

    /** add / sub / mul / div. */
    record Operand(BigDecimal by) implements StepParameters {
        public Operand {
            Objects.requireNonNull(by, "by");
        }
    }

    /** round. */
    record Digits(int digits) implements StepParameters {
    }

    /** cast. */
    record CastTo(CastTarget target) implements StepParameters {
        public CastTo {
            Objects.requireNonNull(target, "target");
        }
    }

    /**
     * formatDate. Patterns are kept next to the compiled formatters for diagnostics.
     */
    record DateFormat(String fromPattern, DateTimeFormatter from,
                      String toPattern, DateTimeFormatter to) implements StepParameters {
        public DateFormat {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
    }

    /**
     * offsetDate. A null {@code format} means the value is recognised as one of the
     * ISO-8601 representations and written back in the same one.
     */
    record DateOffset(long amount, ChronoUnit unit, DateTimeFormatter format) implements StepParameters {
        public DateOffset {
            Objects.requireNonNull(unit, "unit");
        }
    }

    /** convertUnit. Unit names are validated lazily: an unknown pair is a run-time no-op. */
    record UnitPair(String from, String to) implements StepParameters {
        public UnitPair {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
    }

    /**
     * map. Lookup keys are compared against the trimmed string value.
     */
    record ValueMapping(Map<String, JsonNode> mappings, Set<String> nullValues) implements StepParameters {
        public ValueMapping {
            mappings = Map.copyOf(mappings);
            nullValues = Set.copyOf(nullValues);
        }
    }
}
