package com.behavior.affinity.identity;

/**
 * Configuration for the resolved scope cache.
 *
 * @param maxSize    maximum number of (tenant name, cohort name) entries
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 */
public record ScopeCacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public ScopeCacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 1,000 entries, 600s TTL, enabled.
     */
    public static ScopeCacheConfig defaults() {
        return new ScopeCacheConfig(1_000, 600, true);
    }

    public static ScopeCacheConfig disabled() {
        return new ScopeCacheConfig(1, 1, false);
    }
}
