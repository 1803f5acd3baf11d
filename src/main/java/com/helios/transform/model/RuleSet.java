package com.helios.transform.model;

import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered list of compiled rules.
 * <p>
 * Instances are published by reference and shared by every transformation that
 * started while they were active, so nothing here may change after construction.
 */
public final class RuleSet implements Iterable<Rule> {

    private static final RuleSet EMPTY = new RuleSet(List.of(), 0L, "empty", Instant.EPOCH);

    private final List<Rule> rules;
    private final long version;
    private final String source;
    private final Instant createdAt;

    public RuleSet(List<Rule> rules, long version, String source, Instant createdAt) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.version = version;
        this.source = Objects.requireNonNull(source, "source");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public RuleSet(List<Rule> rules) {
        this(rules, 0L, "inline", Instant.now());
    }

    public static RuleSet empty() {
        return EMPTY;
    }

    /**
     * Returns a copy carrying a new version number; used by the manager when publishing.
     */
    public RuleSet withVersion(long newVersion) {
        return new RuleSet(rules, newVersion, source, createdAt);
    }

    public List<Rule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public long getVersion() {
        return version;
    }

    public String getSource() {
        return source;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public Iterator<Rule> iterator() {
        return rules.iterator();
    }

    @Override
    public String toString() {
        return "RuleSet{version=" + version + ", rules=" + rules.size() + ", source=" + source + "}";
    }
}
