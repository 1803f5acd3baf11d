package com.helios.transform.core.path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.helios.transform.core.evaluation.predicates.ComparisonOperatorEvaluator;
import com.helios.transform.model.ConditionOperator;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Boolean test applied to a candidate child inside a {@code [?(...)]} filter.
 * Comparisons follow the same strict typing as rule conditions.
 */
public sealed interface FilterPredicate {

    boolean test(JsonNode candidate);

    /**
     * Relative path from the candidate ({@code @}, {@code @.a}, {@code @.a.b}).
     * Missing members yield {@link MissingNode}; nothing is created.
     */
    record FieldRef(List<String> names) {
        public FieldRef {
            names = List.copyOf(names);
        }

        public JsonNode read(JsonNode candidate) {
            JsonNode current = candidate;
            for (String name : names) {
                if (current == null || !current.isObject()) {
                    return MissingNode.getInstance();
                }
                current = current.get(name);
            }
            return current != null ? current : MissingNode.getInstance();
        }

        @Override
        public String toString() {
            return names.isEmpty() ? "@" : "@." + String.join(".", names);
        }
    }

    /** {@code @.field} without a comparison: true when the field exists. */
    record Exists(FieldRef field) implements FilterPredicate {
        @Override
        public boolean test(JsonNode candidate) {
            return !field.read(candidate).isMissingNode();
        }

        @Override
        public String toString() {
            return field.toString();
        }
    }

    /** {@code @.field <op> literal}. */
    record Comparison(FieldRef field, ConditionOperator operator, JsonNode literal) implements FilterPredicate {
        public Comparison {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(literal, "literal");
        }

        @Override
        public boolean test(JsonNode candidate) {
            JsonNode value = field.read(candidate);
            if (value.isMissingNode()) {
                return false;
            }
            return ComparisonOperatorEvaluator.evaluate(operator, value, literal);
        }

        @Override
        public String toString() {
            return field + " " + operator.getValue() + " " + literal;
        }
    }

    record And(List<FilterPredicate> terms) implements FilterPredicate {
        public And {
            terms = List.copyOf(terms);
        }

        @Override
        public boolean test(JsonNode candidate) {
            for (FilterPredicate term : terms) {
                if (!term.test(candidate)) return false;
            }
            return true;
        }

        @Override
        public String toString() {
            return terms.stream().map(Object::toString).collect(Collectors.joining(" && "));
        }
    }

    record Or(List<FilterPredicate> terms) implements FilterPredicate {
        public Or {
            terms = List.copyOf(terms);
        }

        @Override
        public boolean test(JsonNode candidate) {
            for (FilterPredicate term : terms) {
                if (term.test(candidate)) return true;
            }
            return false;
        }

        @Override
        public String toString() {
            return terms.stream().map(Object::toString).collect(Collectors.joining(" || "));
        }
    }
}
