package com.helios.transform.core.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.helios.transform.model.ActionOperator;

import java.util.Locale;
import java.util.Optional;

/**
 * trim / uppercase / lowercase. Strings only; case mapping is locale-independent.
 */
public final class TextOperations {

    private TextOperations() {
    }

    public static Optional<JsonNode> apply(ActionOperator operator, JsonNode value) {
        if (!value.isTextual()) {
            return Optional.empty();
        }
        String text = value.textValue();
        String result = switch (operator) {
            case TRIM -> text.strip();
            case UPPERCASE -> text.toUpperCase(Locale.ROOT);
            case LOWERCASE -> text.toLowerCase(Locale.ROOT);
            default -> null;
        };
        return result == null ? Optional.empty() : Optional.of(TextNode.valueOf(result));
    }
}
