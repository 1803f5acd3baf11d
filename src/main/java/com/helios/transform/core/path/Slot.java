package com.helios.transform.core.path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * An addressable location in a document: the owning container plus a key or index.
 * <p>
 * A slot reads and writes through its owner, so writing a new value never changes
 * the slot's address and later reads observe the write. Identity is by owner
 * reference, never by the owner's content.
 */
public sealed interface Slot permits Slot.Member, Slot.Element, Slot.Root {

    /**
     * @return the current value, or {@link MissingNode} if the location no longer exists
     */
    JsonNode get();

    /**
     * Writes a value in place. A null value is stored as JSON null.
     */
    void set(JsonNode value);

    /**
     * @return a short, human-readable address such as {@code ['code']} or {@code [3]}
     */
    String describe();

    static Slot member(ObjectNode owner, String name) {
        return new Member(owner, name);
    }

    static Slot element(ArrayNode owner, int index) {
        return new Element(owner, index);
    }

    static Slot root(DocumentRoot root) {
        return new Root(root);
    }

    private static JsonNode orNull(JsonNode value) {
        return value != null ? value : NullNode.getInstance();
    }

    /**
     * Member of an object.
     */
    final class Member implements Slot {
        private final ObjectNode owner;
        private final String name;

        private Member(ObjectNode owner, String name) {
            this.owner = Objects.requireNonNull(owner, "owner");
            this.name = Objects.requireNonNull(name, "name");
        }

        @Override
        public JsonNode get() {
            JsonNode value = owner.get(name);
            return value != null ? value : MissingNode.getInstance();
        }

        @Override
        public void set(JsonNode value) {
            owner.set(name, orNull(value));
        }

        public String name() {
            return name;
        }

        @Override
        public String describe() {
            return "['" + name + "']";
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Member other)) return false;
            return owner == other.owner && name.equals(other.name);
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(owner) + name.hashCode();
        }

        @Override
        public String toString() {
            return "Slot" + describe();
        }
    }

    /**
     * Element of an array.
     */
    final class Element implements Slot {
        private final ArrayNode owner;
        private final int index;

        private Element(ArrayNode owner, int index) {
            this.owner = Objects.requireNonNull(owner, "owner");
            this.index = index;
        }

        @Override
        public JsonNode get() {
            return index < owner.size() ? owner.get(index) : MissingNode.getInstance();
        }

        @Override
        public void set(JsonNode value) {
            // Never grows the array: a vanished index stays vanished
            if (index < owner.size()) {
                owner.set(index, orNull(value));
            }
        }

        public int index() {
            return index;
        }

        @Override
        public String describe() {
            return "[" + index + "]";
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Element other)) return false;
            return owner == other.owner && index == other.index;
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(owner) + index;
        }

        @Override
        public String toString() {
            return "Slot" + describe();
        }
    }

    /**
     * The document root.
     */
    final class Root implements Slot {
        private final DocumentRoot root;

        private Root(DocumentRoot root) {
            this.root = Objects.requireNonNull(root, "root");
        }

        @Override
        public JsonNode get() {
            return root.get();
        }

        @Override
        public void set(JsonNode value) {
            root.set(value);
        }

        @Override
        public String describe() {
            return "$";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Root other && root == other.root;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(root);
        }

        @Override
        public String toString() {
            return "Slot$";
        }
    }
}
