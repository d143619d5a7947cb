package com.repoharvest.extractor.config;

import java.time.Duration;

/**
 * Tunables for the extraction driver and the HTTP client.
 *
 * @param concurrency          upper bound on parallel workers
 * @param workersPerCredential workers allowed per usable credential
 * @param fetchTimeout         hard wall-clock timeout of one fetch attempt
 */
public record ExtractionSettings(
        int concurrency,
        int workersPerCredential,
        Duration fetchTimeout
) {

    public static ExtractionSettings defaults() {
        return new ExtractionSettings(8, 2, Duration.ofSeconds(30));
    }

    public ExtractionSettings {
        if (concurrency < 1 || workersPerCredential < 1) {
            throw new IllegalArgumentException("concurrency and workersPerCredential must be at least 1");
        }
    }
}
