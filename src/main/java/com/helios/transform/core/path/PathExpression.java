package com.helios.transform.core.path;

import java.util.List;
import java.util.Objects;

/**
 * A parsed, immutable path expression. Safe to share between threads.
 *
 * @param expression the source text, kept for logging
 * @param segments   steps applied left to right; empty for {@code $}
 */
public record PathExpression(String expression, List<PathSegment> segments) {

    public PathExpression {
        Objects.requireNonNull(expression, "expression");
        segments = List.copyOf(segments);
    }

    public static PathExpression parse(String expression) {
        return PathParser.parse(expression);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    @Override
    public String toString() {
        return expression;
    }
}
