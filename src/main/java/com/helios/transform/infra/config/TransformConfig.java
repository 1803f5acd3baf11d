package com.helios.transform.infra.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Runtime configuration for the transformer application.
 *
 * <p>Every key is resolved from its environment variable first, then from the
 * matching system property, then from the default:
 * <pre>
 * HELIOS_RULES_FILE            rules.file                      rules.json
 * HELIOS_RULES_RELOAD_SECONDS  rules.reload.interval.seconds   10 (0 disables)
 * HELIOS_PATH_CACHE_MAX_SIZE   path.cache.max.size             1024
 * </pre>
 *
 * @param rulesFile         rule source file
 * @param reloadInterval    rule file polling interval, zero when disabled
 * @param pathCacheMaxSize  maximum number of parsed path expressions kept
 */
public record TransformConfig(Path rulesFile, Duration reloadInterval, long pathCacheMaxSize) {
    private static final Logger logger = Logger.getLogger(TransformConfig.class.getName());

    static final String ENV_RULES_FILE = "HELIOS_RULES_FILE";
    static final String ENV_RELOAD_SECONDS = "HELIOS_RULES_RELOAD_SECONDS";
    static final String ENV_PATH_CACHE_MAX_SIZE = "HELIOS_PATH_CACHE_MAX_SIZE";

    static final String PROP_RULES_FILE = "rules.file";
    static final String PROP_RELOAD_SECONDS = "rules.reload.interval.seconds";
    static final String PROP_PATH_CACHE_MAX_SIZE = "path.cache.max.size";

    public static final String DEFAULT_RULES_FILE = "rules.json";
    public static final long DEFAULT_RELOAD_SECONDS = 10;
    public static final long DEFAULT_PATH_CACHE_MAX_SIZE = 1024;

    public TransformConfig {
        if (rulesFile == null) {
            throw new IllegalArgumentException("rulesFile must not be null");
        }
        if (reloadInterval == null || reloadInterval.isNegative()) {
            throw new IllegalArgumentException("reloadInterval must be zero or positive");
        }
        if (pathCacheMaxSize <= 0) {
            throw new IllegalArgumentException("pathCacheMaxSize must be positive");
        }
    }

    /**
     * Reads configuration from the process environment and system properties.
     */
    public static TransformConfig fromEnvironment() {
        return from(System::getenv, System.getProperties());
    }

    /**
     * Reads configuration from the given sources. Invalid numbers fall back to the
     * default with a warning.
     */
    public static TransformConfig from(Function<String, String> env, Properties properties) {
        String rulesFile = getEnvOrProperty(env, properties, ENV_RULES_FILE, PROP_RULES_FILE, DEFAULT_RULES_FILE);
        long reloadSeconds = parseLong(
                getEnvOrProperty(env, properties, ENV_RELOAD_SECONDS, PROP_RELOAD_SECONDS, null),
                ENV_RELOAD_SECONDS, DEFAULT_RELOAD_SECONDS);
        long cacheSize = parseLong(
                getEnvOrProperty(env, properties, ENV_PATH_CACHE_MAX_SIZE, PROP_PATH_CACHE_MAX_SIZE, null),
                ENV_PATH_CACHE_MAX_SIZE, DEFAULT_PATH_CACHE_MAX_SIZE);

        if (reloadSeconds < 0) {
            logger.warning(ENV_RELOAD_SECONDS + " is negative, disabling rule file monitoring");
            reloadSeconds = 0;
        }
        if (cacheSize <= 0) {
            logger.warning(ENV_PATH_CACHE_MAX_SIZE + " must be positive, using " + DEFAULT_PATH_CACHE_MAX_SIZE);
            cacheSize = DEFAULT_PATH_CACHE_MAX_SIZE;
        }
        return new TransformConfig(Paths.get(rulesFile), Duration.ofSeconds(reloadSeconds), cacheSize);
    }

    public boolean isReloadEnabled() {
        return !reloadInterval.isZero();
    }

    /**
     * Resolves one key: the environment variable wins over the system property, and
     * blank values count as unset. The result is trimmed.
     */
    public static String getEnvOrProperty(Function<String, String> env, Properties properties,
                                          String envKey, String propertyKey, String defaultValue) {
        String value = env.apply(envKey);
        if (value == null || value.isBlank()) {
            value = properties.getProperty(propertyKey, defaultValue);
        }
        return value == null ? null : value.trim();
    }

    private static long parseLong(String value, String key, long defaultValue) {
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            logger.warning("Invalid " + key + " '" + value + "', using default " + defaultValue);
            return defaultValue;
        }
    }
}
