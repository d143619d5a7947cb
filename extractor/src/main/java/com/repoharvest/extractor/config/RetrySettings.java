package com.repoharvest.extractor.config;

import java.time.Duration;

/**
 * Tunables for per-item fetch retries.
 *
 * @param maxAttempts        fetch attempts per work item (K)
 * @param baseDelay          base of the exponential backoff
 * @param maxDelay           upper bound of a single backoff sleep
 * @param maxBlockedWait     upper bound of a single wait for a credential to cool down
 * @param defaultRetryAfter  throttle interval used when the response carries none
 * @param jitterRatio        extra random delay, as a fraction of the computed backoff
 */
public record RetrySettings(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        Duration maxBlockedWait,
        Duration defaultRetryAfter,
        double jitterRatio
) {

    public static RetrySettings defaults() {
        return new RetrySettings(5, Duration.ofSeconds(1), Duration.ofMinutes(5),
                Duration.ofHours(1), Duration.ofSeconds(60), 0.25);
    }

    public RetrySettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (jitterRatio < 0) {
            throw new IllegalArgumentException("jitterRatio must not be negative");
        }
    }
}
