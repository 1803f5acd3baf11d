package com.helios.transform.core.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.helios.transform.model.ActionOperator;
import com.helios.transform.model.ValueType;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Arithmetic on JSON numbers using {@link BigDecimal}, so decimal inputs such as
 * {@code 0.1} are not distorted by binary floating point.
 * <p>
 * Rounding is always {@link RoundingMode#HALF_UP}. Division uses
 * {@link MathContext#DECIMAL64} (16 significant digits).
 */
public final class NumericOperations {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    public static final RoundingMode ROUNDING_MODE = RoundingMode.HALF_UP;
    public static final MathContext DIVISION_CONTEXT = MathContext.DECIMAL64;

    private NumericOperations() {
    }

    /**
     * add / sub / mul / div. Non-numeric values and division by zero are no-ops.
     */
    public static Optional<JsonNode> arithmetic(ActionOperator operator, JsonNode value, BigDecimal by) {
        if (!ValueType.isNumeric(value)) {
            return Optional.empty();
        }
        BigDecimal current = value.decimalValue();
        BigDecimal result;
        switch (operator) {
            case ADD:
                result = current.add(by);
                break;
            case SUB:
                result = current.subtract(by);
                break;
            case MUL:
                result = current.multiply(by);
                break;
            case DIV:
                if (by.signum() == 0) {
                    return Optional.empty();
                }
                result = current.divide(by, DIVISION_CONTEXT);
                break;
            default:
                return Optional.empty();
        }
        return Optional.of(toNode(result));
    }

    /**
     * Rounds half-up to {@code digits} decimal places; negative digits round to
     * tens, hundreds and so on.
     */
    public static Optional<JsonNode> round(JsonNode value, int digits) {
        if (!ValueType.isNumeric(value)) {
            return Optional.empty();
        }
        BigDecimal decimal = value.decimalValue();
        if (digits >= decimal.scale()) {
            // Padding zeros that toNode strips again
            return Optional.of(toNode(decimal));
        }
        if ((long) digits < (long) decimal.scale() - decimal.precision()) {
            // Rounding position lies above the leading digit
            return Optional.of(toNode(BigDecimal.ZERO));
        }
        try {
            return Optional.of(toNode(decimal.setScale(digits, ROUNDING_MODE)));
        } catch (ArithmeticException e) {
            // Scale outside what BigDecimal can represent for this value
            return Optional.empty();
        }
    }

    /**
     * Writes integral results as integer nodes and fractional results as decimals
     * without trailing zeros, so {@code 12345 / 100} serializes as {@code 123.45}
     * and {@code 200 / 2} as {@code 100}.
     */
    public static JsonNode toNode(BigDecimal number) {
        BigDecimal normalized = number.signum() == 0 ? BigDecimal.ZERO : number.stripTrailingZeros();
        if (normalized.scale() <= 0) {
            if (normalized.compareTo(LONG_MIN) >= 0 && normalized.compareTo(LONG_MAX) <= 0) {
                return NODES.numberNode(normalized.longValueExact());
            }
            return NODES.numberNode(normalized.toBigIntegerExact());
        }
        return NODES.numberNode(normalized);
    }

    /**
     * True when the number has no fractional part.
     */
    static boolean isIntegral(BigDecimal number) {
        return number.signum() == 0 || number.stripTrailingZeros().scale() <= 0;
    }
}
