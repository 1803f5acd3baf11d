package com.helios.transform.infra.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.helios.transform.core.path.PathExpression;

import java.util.logging.Logger;

/**
 * Bounded cache of parsed path expressions keyed by their source text.
 * <p>
 * The rule compiler parses every rule path through one shared instance, so
 * recompiling a rule file on reload reuses the expressions that did not change.
 * The resolver uses it for lookups by expression string. Invalid expressions are
 * not cached, so each lookup of one throws the parser's exception again.
 *
 * Thread-safe; backed by Caffeine (Window TinyLFU eviction, lock-free reads).
 */
public class PathExpressionCache {
    private static final Logger logger = Logger.getLogger(PathExpressionCache.class.getName());

    public static final long DEFAULT_MAX_SIZE = 1024;

    private final Cache<String, PathExpression> cache;
    private final boolean statsEnabled;

    private PathExpressionCache(Builder builder) {
        Caffeine<Object, Object> cacheBuilder = Caffeine.newBuilder();

        if (builder.maxSize > 0) {
            cacheBuilder.maximumSize(builder.maxSize);
        }

        this.statsEnabled = builder.recordStats;
        if (builder.recordStats) {
            cacheBuilder.recordStats();
        }

        if (builder.logEvictions) {
            cacheBuilder.removalListener((key, value, cause) ->
                    logger.fine(String.format("Path cache eviction: key=%s, cause=%s", key, cause)));
        }

        this.cache = cacheBuilder.build();

        logger.fine(String.format("PathExpressionCache initialized: maxSize=%d, stats=%b",
                builder.maxSize, builder.recordStats));
    }

    public PathExpressionCache() {
        this(builder());
    }

    /**
     * Returns the parsed expression, parsing and caching it on first use.
     *
     * @throws com.helios.transform.core.path.PathSyntaxException if the expression is malformed
     */
    public PathExpression get(String expression) {
        return cache.get(expression, PathExpression::parse);
    }

    public long size() {
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    public CacheStats stats() {
        return statsEnabled ? cache.stats() : CacheStats.empty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long maxSize = DEFAULT_MAX_SIZE;
        private boolean recordStats = false;
        private boolean logEvictions = false;

        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public Builder logEvictions(boolean logEvictions) {
            this.logEvictions = logEvictions;
            return this;
        }

        public PathExpressionCache build() {
            return new PathExpressionCache(this);
        }
    }
}
