package com.repoharvest.extractor.config;

import java.time.Duration;

/**
 * Tunables for batch persistence.
 *
 * @param batchSize       records per upsert batch, at most {@link #MAX_BATCH_SIZE}
 * @param maxBatchAge     a batch older than this is flushed on the next add
 * @param flushAttempts   attempts per batch on transient store errors
 * @param flushRetryDelay first delay between flush attempts, doubled each retry
 * @param connectTimeout  limit on opening a store connection
 * @param socketTimeout   limit on waiting for any single store read
 */
public record LoaderSettings(
        int batchSize,
        Duration maxBatchAge,
        int flushAttempts,
        Duration flushRetryDelay,
        Duration connectTimeout,
        Duration socketTimeout
) {

    /**
     * A record binds 15 project parameters plus two per topic, and the query
     * fetches at most 20 topics. PostgreSQL accepts at most 65535 bind
     * parameters per statement.
     */
    public static final int MAX_BATCH_SIZE = 1000;

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SOCKET_TIMEOUT = Duration.ofSeconds(60);

    public static LoaderSettings defaults() {
        return new LoaderSettings(100, Duration.ofSeconds(30), 3, Duration.ofMillis(500));
    }

    public LoaderSettings(int batchSize, Duration maxBatchAge, int flushAttempts, Duration flushRetryDelay) {
        this(batchSize, maxBatchAge, flushAttempts, flushRetryDelay,
                DEFAULT_CONNECT_TIMEOUT, DEFAULT_SOCKET_TIMEOUT);
    }

    public LoaderSettings {
        if (batchSize < 1 || batchSize > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException(
                    "batchSize must be between 1 and " + MAX_BATCH_SIZE + ", was " + batchSize);
        }
        if (flushAttempts < 1) {
            throw new IllegalArgumentException("flushAttempts must be at least 1");
        }
        if (connectTimeout.isNegative() || socketTimeout.isNegative()
                || connectTimeout.toSeconds() > Integer.MAX_VALUE
                || socketTimeout.toSeconds() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("store timeouts must be between 0 and "
                    + Integer.MAX_VALUE + " seconds");
        }
    }
}
