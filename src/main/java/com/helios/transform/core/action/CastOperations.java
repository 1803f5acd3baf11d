package com.helios.transform.core.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.helios.transform.model.CastTarget;
import com.helios.transform.model.ValueType;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lossless conversions between primitive categories.
 *
 * <ul>
 *   <li>string: numbers (plain notation) and booleans</li>
 *   <li>number: strings written in JSON number syntax</li>
 *   <li>integer: integral numbers and strings denoting them; {@code 2.5} is a no-op</li>
 *   <li>boolean: exactly {@code "true"} or {@code "false"}</li>
 * </ul>
 * Anything else, including a value already of the target type, is a no-op.
 * Strings are not trimmed before parsing.
 */
public final class CastOperations {

    private static final Pattern JSON_NUMBER = Pattern.compile("-?(0|[1-9]\\d*)(\\.\\d+)?([eE][+-]?\\d+)?");

    private CastOperations() {
    }

    public static Optional<JsonNode> cast(JsonNode value, CastTarget target) {
        return switch (target) {
            case STRING -> toText(value);
            case NUMBER -> value.isTextual() ? parseNumber(value.textValue()).map(NumericOperations::toNode) : Optional.empty();
            case INTEGER -> toInteger(value);
            case BOOLEAN -> toBoolean(value);
        };
    }

    private static Optional<JsonNode> toText(JsonNode value) {
        if (value.isBoolean()) {
            return Optional.of(TextNode.valueOf(Boolean.toString(value.booleanValue())));
        }
        if (ValueType.isNumeric(value)) {
            String text = value.isIntegralNumber()
                    ? value.bigIntegerValue().toString()
                    : plain(value.decimalValue());
            return Optional.of(TextNode.valueOf(text));
        }
        return Optional.empty();
    }

    private static Optional<JsonNode> toInteger(JsonNode value) {
        if (value.isIntegralNumber()) {
            return Optional.empty();
        }
        Optional<BigDecimal> number = ValueType.isNumeric(value)
                ? Optional.of(value.decimalValue())
                : value.isTextual() ? parseNumber(value.textValue()) : Optional.empty();
        return number
                .filter(NumericOperations::isIntegral)
                .map(NumericOperations::toNode);
    }

    private static Optional<JsonNode> toBoolean(JsonNode value) {
        if (!value.isTextual()) {
            return Optional.empty();
        }
        return switch (value.textValue()) {
            case "true" -> Optional.of(BooleanNode.TRUE);
            case "false" -> Optional.of(BooleanNode.FALSE);
            default -> Optional.empty();
        };
    }

    private static Optional<BigDecimal> parseNumber(String text) {
        if (!JSON_NUMBER.matcher(text).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException e) {
            // exponent out of int range
            return Optional.empty();
        }
    }

    private static String plain(BigDecimal number) {
        return number.signum() == 0 ? "0" : number.stripTrailingZeros().toPlainString();
    }
}
