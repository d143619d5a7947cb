package com.repoharvest.extractor.model;

import java.time.Instant;

/**
 * Quota signals read from one API response, either from the
 * {@code x-ratelimit-*} headers or from the query's {@code rateLimit} block.
 * Any field may be {@code null} when the response did not carry it.
 */
public record RateLimitSnapshot(
        Integer remaining,
        Integer limit,
        Instant resetAt
) {

    public static RateLimitSnapshot empty() {
        return new RateLimitSnapshot(null, null, null);
    }

    public boolean isEmpty() {
        return remaining == null && limit == null && resetAt == null;
    }

    /**
     * Fills any field missing here from {@code other}.
     */
    public RateLimitSnapshot orElse(RateLimitSnapshot other) {
        return new RateLimitSnapshot(
                remaining != null ? remaining : other.remaining(),
                limit != null ? limit : other.limit(),
                resetAt != null ? resetAt : other.resetAt());
    }
}
