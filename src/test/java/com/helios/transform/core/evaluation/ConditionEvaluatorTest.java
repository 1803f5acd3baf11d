package com.helios.transform.core.evaluation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.helios.transform.model.Condition;
import com.helios.transform.model.ConditionOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.helios.transform.model.ConditionOperator.*;
import static org.assertj.core.api.Assertions.assertThat;

class ConditionEvaluatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private JsonNode json(String text) {
        try {
            return mapper.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(text, e);
        }
    }

    private boolean eval(ConditionOperator operator, String operand, String value) {
        return evaluator.evaluate(new Condition(operator, json(operand)), json(value));
    }

    @Nested
    @DisplayName("Equality and ordering")
    class Comparisons {

        @ParameterizedTest(name = "{1} {0} {2} -> {3}")
        @CsvSource(delimiter = '|', value = {
                "EQUAL_TO              | 1       | 1.0     | true",
                "EQUAL_TO              | '\"a\"' | '\"a\"' | true",
                "EQUAL_TO              | true    | true    | true",
                "EQUAL_TO              | null    | null    | true",
                "EQUAL_TO              | 1       | '\"1\"' | false",
                "EQUAL_TO              | 0       | false   | false",
                "EQUAL_TO              | null    | 0       | false",
                "NOT_EQUAL_TO          | 1       | 2       | true",
                "NOT_EQUAL_TO          | 1       | '\"2\"' | false",
                "LESS_THAN             | 3       | 2.5     | true",
                "LESS_THAN_OR_EQUAL    | 3       | 3       | true",
                "GREATER_THAN          | 0       | 5       | true",
                "GREATER_THAN          | 0       | '\"5\"' | false",
                "GREATER_THAN_OR_EQUAL | '\"b\"' | '\"b\"' | true",
                "GREATER_THAN          | '\"b\"' | '\"a\"' | false",
                "LESS_THAN             | true    | false   | false"
        })
        @DisplayName("Strict typing: no coercion between categories")
        void strictComparisons(ConditionOperator operator, String operand, String value, boolean expected) {
            assertThat(eval(operator, operand, value)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Number greater than zero against the string \"5\" is false")
        void noImplicitCoercion() {
            assertThat(eval(GREATER_THAN, "0", "\"5\"")).isFalse();
        }

        @Test
        @DisplayName("Arrays and objects compare deeply, numbers by value")
        void structuralEquality() {
            assertThat(eval(EQUAL_TO, "[1,{\"a\":2}]", "[1.0,{\"a\":2.00}]")).isTrue();
            assertThat(eval(EQUAL_TO, "{\"a\":1,\"b\":2}", "{\"b\":2,\"a\":1}")).isTrue();
            assertThat(eval(EQUAL_TO, "[1,2]", "[2,1]")).isFalse();
        }

        @Test
        @DisplayName("Large integers compare exactly")
        void largeNumbers() {
            assertThat(eval(LESS_THAN, "12345678901234567891", "12345678901234567890")).isTrue();
            assertThat(eval(EQUAL_TO, "12345678901234567891", "12345678901234567890")).isFalse();
        }
    }

    @Nested
    @DisplayName("Membership")
    class Membership {

        @Test
        @DisplayName("in matches any candidate of the same type")
        void in() {
            assertThat(eval(IS_ANY_OF, "[\"US\",\"CA\"]", "\"CA\"")).isTrue();
            assertThat(eval(IS_ANY_OF, "[1,2]", "2.0")).isTrue();
            assertThat(eval(IS_ANY_OF, "[1,2]", "\"1\"")).isFalse();
            assertThat(eval(IS_ANY_OF, "[1,2]", "[1]")).isFalse();
        }

        @Test
        @DisplayName("nin needs a candidate of the same type to be meaningful")
        void notIn() {
            assertThat(eval(IS_NONE_OF, "[\"US\",\"CA\"]", "\"UK\"")).isTrue();
            assertThat(eval(IS_NONE_OF, "[\"US\",\"CA\"]", "\"US\"")).isFalse();
            assertThat(eval(IS_NONE_OF, "[\"US\",\"CA\"]", "7")).isFalse();
        }

        @Test
        @DisplayName("contains is substring on strings and membership on arrays")
        void contains() {
            assertThat(eval(CONTAINS, "\"ell\"", "\"hello\"")).isTrue();
            assertThat(eval(CONTAINS, "\"xyz\"", "\"hello\"")).isFalse();
            assertThat(eval(CONTAINS, "3", "[1,2,3.0]")).isTrue();
            assertThat(eval(CONTAINS, "\"3\"", "[1,2,3]")).isFalse();
            assertThat(eval(CONTAINS, "\"1\"", "123")).isFalse();
        }
    }

    @Nested
    @DisplayName("String predicates")
    class Strings {

        @Test
        @DisplayName("regex must match the whole string")
        void regexFullMatch() {
            assertThat(eval(REGEX, "\"[A-Z]{2}\\\\d+\"", "\"AB123\"")).isTrue();
            assertThat(eval(REGEX, "\"[A-Z]{2}\"", "\"xAB\"")).isFalse();
            assertThat(eval(REGEX, "\"\\\\d+\"", "123")).isFalse();
        }

        @Test
        @DisplayName("startsWith and endsWith only apply to strings")
        void prefixSuffix() {
            assertThat(eval(STARTS_WITH, "\"ab\"", "\"abc\"")).isTrue();
            assertThat(eval(ENDS_WITH, "\"bc\"", "\"abc\"")).isTrue();
            assertThat(eval(STARTS_WITH, "\"1\"", "123")).isFalse();
        }
    }

    @Nested
    @DisplayName("Unary checks")
    class Unary {

        @Test
        @DisplayName("isNull holds for null and for a missing value")
        void isNull() {
            Condition isNull = new Condition(IS_NULL, BooleanNode.TRUE);
            Condition isNotNull = new Condition(IS_NULL, BooleanNode.FALSE);

            assertThat(evaluator.evaluate(isNull, NullNode.getInstance())).isTrue();
            assertThat(evaluator.evaluate(isNull, MissingNode.getInstance())).isTrue();
            assertThat(evaluator.evaluate(isNull, json("0"))).isFalse();
            assertThat(evaluator.evaluate(isNotNull, json("\"x\""))).isTrue();
        }

        @Test
        @DisplayName("isEmpty applies to strings, arrays and objects only")
        void isEmpty() {
            Condition isEmpty = new Condition(IS_EMPTY, BooleanNode.TRUE);
            Condition isNotEmpty = new Condition(IS_EMPTY, BooleanNode.FALSE);

            assertThat(evaluator.evaluate(isEmpty, json("\"\""))).isTrue();
            assertThat(evaluator.evaluate(isEmpty, json("[]"))).isTrue();
            assertThat(evaluator.evaluate(isEmpty, json("{}"))).isTrue();
            assertThat(evaluator.evaluate(isEmpty, json("\"a\""))).isFalse();
            assertThat(evaluator.evaluate(isEmpty, json("0"))).isFalse();
            assertThat(evaluator.evaluate(isEmpty, NullNode.getInstance())).isFalse();
            assertThat(evaluator.evaluate(isNotEmpty, json("[1]"))).isTrue();
            assertThat(evaluator.evaluate(isNotEmpty, json("0"))).isFalse();
        }
    }

    @Nested
    @DisplayName("Non-finite numbers")
    class NonFiniteNumbers {

        @ParameterizedTest(name = "{0} {1} on 1e400 -> false")
        @CsvSource(delimiter = '|', value = {
                "EQUAL_TO              | 1",
                "NOT_EQUAL_TO          | 1",
                "LESS_THAN             | 1",
                "GREATER_THAN          | 1",
                "GREATER_THAN_OR_EQUAL | 0",
                "EQUAL_TO              | '\"Infinity\"'",
                "IS_ANY_OF             | '[1, 2]'",
                "IS_NONE_OF            | '[1, 2]'"
        })
        @DisplayName("An overflowed number matches no comparison and does not throw")
        void overflowNeverMatches(ConditionOperator operator, String operand) {
            assertThat(eval(operator, operand, "1e400")).isFalse();
            assertThat(eval(operator, operand, "-1e400")).isFalse();
        }

        @Test
        @DisplayName("Infinity is never equal to itself")
        void infinityAgainstInfinity() {
            JsonNode infinity = DoubleNode.valueOf(Double.POSITIVE_INFINITY);

            assertThat(evaluator.evaluate(new Condition(EQUAL_TO, infinity), infinity)).isFalse();
            assertThat(evaluator.evaluate(new Condition(NOT_EQUAL_TO, infinity), infinity)).isFalse();
            assertThat(evaluator.evaluate(new Condition(EQUAL_TO, json("1")), DoubleNode.valueOf(Double.NaN))).isFalse();
        }

        @Test
        @DisplayName("An overflowed number is present, so isNull is false")
        void presentButNotNull() {
            assertThat(evaluator.evaluate(new Condition(IS_NULL, BooleanNode.TRUE), json("1e400"))).isFalse();
            assertThat(evaluator.evaluate(new Condition(IS_NULL, BooleanNode.FALSE), json("1e400"))).isTrue();
            assertThat(evaluator.evaluate(new Condition(IS_EMPTY, BooleanNode.TRUE), json("1e400"))).isFalse();
        }
    }
}
