package com.helios.transform.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.helios.transform.model.RuleSet;

/**
 * Contract for applying a rule set snapshot to a JSON document.
 */
public interface ITransformer {

    /**
     * Applies every rule of the snapshot, in order, to the document.
     * <p>
     * Containers inside the document are mutated in place; callers must use the
     * returned node as the result because a rule targeting {@code $} may replace
     * the root itself.
     *
     * @param document finite, acyclic JSON value
     * @param ruleSet  snapshot to apply; it is only read
     * @return the mutated document
     */
    JsonNode apply(JsonNode document, RuleSet ruleSet);
}
