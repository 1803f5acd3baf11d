package com.helios.transform.core.path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Mutable holder for a document's root value so that the root itself is addressable.
 * Not thread-safe; one holder belongs to one transformation.
 */
public final class DocumentRoot {

    private JsonNode value;

    public DocumentRoot(JsonNode value) {
        this.value = value != null ? value : NullNode.getInstance();
    }

    public JsonNode get() {
        return value;
    }

    void set(JsonNode newValue) {
        this.value = newValue != null ? newValue : NullNode.getInstance();
    }
}
