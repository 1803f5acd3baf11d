package com.helios.transform.core.path;

import com.fasterxml.jackson.databind.JsonNode;
import com.helios.transform.infra.cache.PathExpressionCache;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves path expressions against a document into addressable slots.
 * <p>
 * The result is in canonical order: each segment is applied to the slots produced
 * by the previous one, in their order, and the selections are concatenated. A path
 * that matches nothing yields an empty list; nothing is created along the way.
 * <p>
 * Stateless apart from the expression cache; safe to share between threads.
 */
public final class PathResolver {

    private final PathExpressionCache expressionCache;

    public PathResolver() {
        this(new PathExpressionCache());
    }

    public PathResolver(PathExpressionCache expressionCache) {
        this.expressionCache = Objects.requireNonNull(expressionCache, "expressionCache");
    }

    /**
     * Resolves an expression string against a bare document. Writes through the
     * returned slots mutate {@code document} in place; a write to the root slot is
     * only visible through {@link #resolve(DocumentRoot, PathExpression)}.
     *
     * @throws PathSyntaxException if the expression is malformed
     */
    public List<Slot> resolve(JsonNode document, String expression) {
        return resolve(new DocumentRoot(document), expressionCache.get(expression));
    }

    public List<Slot> resolve(DocumentRoot root, PathExpression expression) {
        List<Slot> current = new ArrayList<>(1);
        current.add(Slot.root(root));

        for (PathSegment segment : expression.segments()) {
            if (current.isEmpty()) {
                break;
            }
            List<Slot> next = new ArrayList<>();
            for (Slot slot : current) {
                segment.select(slot.get(), next::add);
            }
            current = next;
        }
        return current;
    }
}
