package com.helios.transform.api;

import com.helios.transform.model.RuleSet;

/**
 * Contract for managing the active rule set snapshot (publish and hot reload).
 */
public interface IRuleSetManager {

    /**
     * Starts watching the rule source for changes, if one is configured.
     */
    void start();

    /**
     * Stops watching and releases resources.
     */
    void shutdown();

    /**
     * Gets the currently published snapshot. Callers should read it once per
     * document (or batch) and use that reference throughout.
     *
     * @return current rule set (thread-safe, never null)
     */
    RuleSet getRuleSet();

    /**
     * Atomically replaces the active snapshot.
     *
     * @return the published snapshot, stamped with its version
     */
    RuleSet publish(RuleSet ruleSet);
}
