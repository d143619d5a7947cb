package com.repoharvest.extractor.client;

import java.time.Instant;

/**
 * Result of {@link CredentialPool#acquire}: a granted credential, a time to wait
 * until one frees up, or the news that every credential has been retired.
 */
public record Acquisition(
        Status status,
        Credential credential,
        Instant waitUntil
) {

    public enum Status { GRANTED, BLOCKED, EXHAUSTED }

    public static Acquisition granted(Credential credential) {
        return new Acquisition(Status.GRANTED, credential, null);
    }

    public static Acquisition blocked(Instant waitUntil) {
        return new Acquisition(Status.BLOCKED, null, waitUntil);
    }

    public static Acquisition exhausted() {
        return new Acquisition(Status.EXHAUSTED, null, null);
    }
}
