package com.helios.transform.core.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.helios.transform.model.ValueType;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed-factor unit conversions. Each unit belongs to one dimension and has an
 * exact factor to that dimension's base unit; converting multiplies by
 * {@code from / to}. Units are case-sensitive ({@code MB} and {@code mB} differ).
 * Temperature scales are absent because they need an offset, not a factor.
 */
public final class UnitConversions {

    private enum Dimension { LENGTH, MASS, TIME, DATA, VOLUME }

    private record Unit(Dimension dimension, BigDecimal toBase) {
    }

    private static final Map<String, Unit> UNITS;

    static {
        Map<String, Unit> units = new HashMap<>();
        // length, base metre
        register(units, Dimension.LENGTH, "mm", "0.001");
        register(units, Dimension.LENGTH, "cm", "0.01");
        register(units, Dimension.LENGTH, "m", "1");
        register(units, Dimension.LENGTH, "km", "1000");
        register(units, Dimension.LENGTH, "in", "0.0254");
        register(units, Dimension.LENGTH, "ft", "0.3048");
        register(units, Dimension.LENGTH, "yd", "0.9144");
        register(units, Dimension.LENGTH, "mi", "1609.344");
        // mass, base gram
        register(units, Dimension.MASS, "mg", "0.001");
        register(units, Dimension.MASS, "g", "1");
        register(units, Dimension.MASS, "kg", "1000");
        register(units, Dimension.MASS, "t", "1000000");
        register(units, Dimension.MASS, "oz", "28.349523125");
        register(units, Dimension.MASS, "lb", "453.59237");
        // time, base second
        register(units, Dimension.TIME, "ms", "0.001");
        register(units, Dimension.TIME, "s", "1");
        register(units, Dimension.TIME, "min", "60");
        register(units, Dimension.TIME, "h", "3600");
        register(units, Dimension.TIME, "d", "86400");
        register(units, Dimension.TIME, "wk", "604800");
        // data, base byte
        register(units, Dimension.DATA, "B", "1");
        register(units, Dimension.DATA, "KB", "1000");
        register(units, Dimension.DATA, "MB", "1000000");
        register(units, Dimension.DATA, "GB", "1000000000");
        register(units, Dimension.DATA, "TB", "1000000000000");
        register(units, Dimension.DATA, "KiB", "1024");
        register(units, Dimension.DATA, "MiB", "1048576");
        register(units, Dimension.DATA, "GiB", "1073741824");
        register(units, Dimension.DATA, "TiB", "1099511627776");
        // volume, base litre
        register(units, Dimension.VOLUME, "mL", "0.001");
        register(units, Dimension.VOLUME, "L", "1");
        register(units, Dimension.VOLUME, "gal", "3.785411784");
        register(units, Dimension.VOLUME, "qt", "0.946352946");
        register(units, Dimension.VOLUME, "floz", "0.0295735295625");
        UNITS = Collections.unmodifiableMap(units);
    }

    private UnitConversions() {
    }

    private static void register(Map<String, Unit> units, Dimension dimension, String name, String factor) {
        units.put(name, new Unit(dimension, new BigDecimal(factor)));
    }

    /**
     * Converts a numeric value. Non-numbers, unknown units and pairs from different
     * dimensions are no-ops.
     */
    public static Optional<JsonNode> convert(JsonNode value, String from, String to) {
        if (!ValueType.isNumeric(value)) {
            return Optional.empty();
        }
        if (!isSupported(from, to)) {
            return Optional.empty();
        }
        // Through the base unit, multiplying first: 12 in -> ft is exactly 1
        BigDecimal inBase = value.decimalValue().multiply(UNITS.get(from).toBase());
        BigDecimal converted = inBase.divide(UNITS.get(to).toBase(), NumericOperations.DIVISION_CONTEXT);
        return Optional.of(NumericOperations.toNode(converted));
    }

    public static boolean isSupported(String from, String to) {
        Unit source = UNITS.get(from);
        Unit target = UNITS.get(to);
        return source != null && target != null && source.dimension() == target.dimension();
    }
}
