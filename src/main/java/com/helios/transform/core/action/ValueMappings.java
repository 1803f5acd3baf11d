package com.helios.transform.core.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.helios.transform.model.StepParameters;

import java.util.Optional;

/**
 * Table-driven value mapping: stored codes to published values.
 * <p>
 * The string value is trimmed for lookup. A value listed in {@code nullValues}
 * becomes JSON null; a value with an entry in {@code mappings} becomes the mapped
 * value; anything else, and every non-string, is left unchanged.
 */
public final class ValueMappings {

    private ValueMappings() {
    }

    public static Optional<JsonNode> map(JsonNode value, StepParameters.ValueMapping mapping) {
        if (!value.isTextual()) {
            return Optional.empty();
        }
        String key = value.textValue().strip();
        if (mapping.nullValues().contains(key)) {
            return Optional.of(NullNode.getInstance());
        }
        JsonNode mapped = mapping.mappings().get(key);
        if (mapped == null) {
            return Optional.empty();
        }
        JsonNode copy = mapped.deepCopy();
        return Optional.of(copy);
    }
}
