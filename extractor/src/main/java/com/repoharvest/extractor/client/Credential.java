package com.repoharvest.extractor.client;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One API token and its rate-limit budget. State is guarded by the credential's
 * own lock and is only changed through {@link CredentialPool}.
 */
public final class Credential {

    private final String label;
    private final String token;
    final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    int remainingQuota;
    int limit;
    Instant resetAt;
    Instant cooldownUntil;
    int inFlight;
    boolean retired;

    Credential(String label, String token, int initialQuota) {
        this.label = label;
        this.token = token;
        this.remainingQuota = Math.max(0, initialQuota);
        this.limit = Math.max(1, initialQuota);
    }

    public String label() {
        return label;
    }

    public String token() {
        return token;
    }

    /**
     * Consistent copy of the credential's budget, for logging and tests.
     */
    public State state() {
        lock.lock();
        try {
            return new State(remainingQuota, limit, resetAt, cooldownUntil, inFlight, retired);
        } finally {
            lock.unlock();
        }
    }

    /** Requests this credential can still serve right now. */
    int available() {
        return remainingQuota - inFlight;
    }

    @Override
    public String toString() {
        return label;
    }

    public record State(
            int remainingQuota,
            int limit,
            Instant resetAt,
            Instant cooldownUntil,
            int inFlight,
            boolean retired
    ) {}
}
