package com.behavior.affinity.lock;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for batch run locks.
 *
 * @param timeout maximum time a batch run waits for another run of the same tenant
 */
public record LockConfig(Duration timeout) {

    public LockConfig {
        Objects.requireNonNull(timeout, "timeout is required");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
    }

    /**
     * Waits up to 5 minutes, longer than a typical hourly run.
     */
    public static LockConfig defaults() {
        return new LockConfig(Duration.ofMinutes(5));
    }
}
