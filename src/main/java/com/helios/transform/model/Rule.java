package com.helios.transform.model;

import com.helios.transform.core.path.PathExpression;

import java.util.Objects;

/**
 * A compiled rule: where to look, when to act, what to do.
 *
 * @param id        unique within its rule set
 * @param path      compiled path expression
 * @param condition optional guard; null means the action applies to every matched slot
 * @param action    single step or sequence
 */
public record Rule(String id, PathExpression path, Condition condition, Action action) {

    public Rule {
        Objects.requireNonNull(id, "Rule id cannot be null");
        Objects.requireNonNull(path, "Rule path cannot be null");
        Objects.requireNonNull(action, "Rule action cannot be null");
    }

    public boolean hasCondition() {
        return condition != null;
    }
}
