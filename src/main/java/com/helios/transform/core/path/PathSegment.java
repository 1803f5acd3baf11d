package com.helios.transform.core.path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * One step of a compiled path expression.
 * <p>
 * A segment receives a node and emits the slots it selects beneath it, in canonical
 * order: object members in insertion order, array elements by ascending index.
 * Segments never create containers or fields.
 */
public sealed interface PathSegment {

    void select(JsonNode node, Consumer<Slot> sink);

    /** {@code .name} or {@code ['name']}. */
    record Member(String name) implements PathSegment {
        public Member {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public void select(JsonNode node, Consumer<Slot> sink) {
            if (node instanceof ObjectNode object && object.has(name)) {
                sink.accept(Slot.member(object, name));
            }
        }

        @Override
        public String toString() {
            return "['" + name + "']";
        }
    }

    /** {@code [n]}; a negative index counts from the end. */
    record Index(int index) implements PathSegment {
        @Override
        public void select(JsonNode node, Consumer<Slot> sink) {
            if (node instanceof ArrayNode array) {
                int resolved = index < 0 ? array.size() + index : index;
                if (resolved >= 0 && resolved < array.size()) {
                    sink.accept(Slot.element(array, resolved));
                }
            }
        }

        @Override
        public String toString() {
            return "[" + index + "]";
        }
    }

    /** {@code .*} or {@code [*]}: every member or element. */
    record Wildcard() implements PathSegment {
        @Override
        public void select(JsonNode node, Consumer<Slot> sink) {
            forEachChild(node, sink);
        }

        @Override
        public String toString() {
            return "[*]";
        }
    }

    /**
     * {@code [start:end]}, end exclusive. Null bounds mean the array edges; negative
     * bounds count from the end.
     */
    record Slice(Integer start, Integer end) implements PathSegment {
        @Override
        public void select(JsonNode node, Consumer<Slot> sink) {
            if (!(node instanceof ArrayNode array)) return;
            int size = array.size();
            int from = normalize(start, 0, size);
            int to = normalize(end, size, size);
            for (int i = from; i < to; i++) {
                sink.accept(Slot.element(array, i));
            }
        }

        private static int normalize(Integer bound, int fallback, int size) {
            if (bound == null) return fallback;
            int value = bound < 0 ? size + bound : bound;
            return Math.max(0, Math.min(size, value));
        }

        @Override
        public String toString() {
            return "[" + (start != null ? start : "") + ":" + (end != null ? end : "") + "]";
        }
    }

    /** {@code ['a','b']} or {@code [0,2]}: each part in listed order. */
    record Union(List<PathSegment> parts) implements PathSegment {
        public Union {
            parts = List.copyOf(parts);
        }

        @Override
        public void select(JsonNode node, Consumer<Slot> sink) {
            for (PathSegment part : parts) {
                part.select(node, sink);
            }
        }
    }

    /** {@code [?(...)]}: the children (elements or member values) satisfying the predicate. */
    record Filter(FilterPredicate predicate) implements PathSegment {
        public Filter {
            Objects.requireNonNull(predicate, "predicate");
        }

        @Override
        public void select(JsonNode node, Consumer<Slot> sink) {
            forEachChild(node, slot -> {
                if (predicate.test(slot.get())) {
                    sink.accept(slot);
                }
            });
        }

        @Override
        public String toString() {
            return "[?(" + predicate + ")]";
        }
    }

    /**
     * {@code ..selector}: applies the selector to the node and to every descendant,
     * visiting in pre-order (node first, then each child subtree in canonical order).
     */
    record RecursiveDescent(PathSegment selector) implements PathSegment {
        public RecursiveDescent {
            Objects.requireNonNull(selector, "selector");
        }

        @Override
        public void select(JsonNode node, Consumer<Slot> sink) {
            Deque<JsonNode> stack = new ArrayDeque<>();
            stack.push(node);
            while (!stack.isEmpty()) {
                JsonNode current = stack.pop();
                selector.select(current, sink);
                if (current.isContainerNode() && current.size() > 0) {
                    // Push in reverse so the first child is visited next
                    JsonNode[] children = new JsonNode[current.size()];
                    int i = 0;
                    for (JsonNode child : current) {
                        children[i++] = child;
                    }
                    for (int j = children.length - 1; j >= 0; j--) {
                        stack.push(children[j]);
                    }
                }
            }
        }

        @Override
        public String toString() {
            return ".." + selector;
        }
    }

    /**
     * Emits one slot per child of a container in canonical order; scalars have no children.
     */
    static void forEachChild(JsonNode node, Consumer<Slot> sink) {
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                sink.accept(Slot.member(object, fields.next().getKey()));
            }
        } else if (node instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                sink.accept(Slot.element(array, i));
            }
        }
    }
}
