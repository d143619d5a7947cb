package com.repoharvest.extractor.client;

import com.repoharvest.extractor.model.RateLimitSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns the run's API credentials and hands out the one with the most quota left.
 *
 * <p>Each credential is locked on its own; the pool never holds more than one
 * credential lock at a time, so workers using different credentials do not
 * contend. A granted credential counts as one in-flight request until
 * {@link #release} is called, which keeps concurrent workers from overdrawing a
 * budget before the server has reported it.</p>
 */
public class CredentialPool {

    private static final Logger logger = LoggerFactory.getLogger(CredentialPool.class);

    /** GitHub GraphQL points per hour for an installation token. */
    public static final int DEFAULT_QUOTA = 5_000;

    /** Re-check interval when every credential is busy with in-flight requests. */
    static final Duration IN_FLIGHT_POLL = Duration.ofMillis(250);

    private final List<Credential> credentials;
    private final Duration defaultCooldown;
    private final Clock clock;

    public CredentialPool(List<String> tokens, Duration defaultCooldown) {
        this(tokens, DEFAULT_QUOTA, defaultCooldown, Clock.systemUTC());
    }

    public CredentialPool(List<String> tokens, int initialQuota, Duration defaultCooldown, Clock clock) {
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("At least one API token is required");
        }
        List<Credential> created = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            created.add(new Credential(labelFor(i, tokens.get(i)), tokens.get(i), initialQuota));
        }
        this.credentials = List.copyOf(created);
        this.defaultCooldown = defaultCooldown;
        this.clock = clock;
    }

    private static String labelFor(int index, String token) {
        String tail = token.length() > 4 ? token.substring(token.length() - 4) : "****";
        return "token#" + (index + 1) + "(…" + tail + ")";
    }

    public List<Credential> credentials() {
        return credentials;
    }

    /**
     * Number of credentials not retired for the run.
     */
    public int usableCount() {
        int count = 0;
        for (Credential credential : credentials) {
            if (!credential.state().retired()) {
                count++;
            }
        }
        return count;
    }

    public Acquisition acquire() {
        return acquire(null);
    }

    /**
     * Grants the live credential with the highest available quota, preferring any
     * credential other than {@code avoid}. If none is usable right now, returns
     * the earliest instant at which one may be.
     */
    public Acquisition acquire(Credential avoid) {
        while (true) {
            Instant now = clock.instant();
            Credential best = null;
            int bestAvailable = 0;
            Credential fallback = null;
            Instant earliest = null;
            boolean anyLive = false;

            for (Credential credential : credentials) {
                credential.lock.lock();
                try {
                    if (credential.retired) {
                        continue;
                    }
                    anyLive = true;
                    refresh(credential, now);
                    if (credential.cooldownUntil == null && credential.available() > 0) {
                        if (credential == avoid) {
                            fallback = credential;
                        } else if (credential.available() > bestAvailable) {
                            best = credential;
                            bestAvailable = credential.available();
                        }
                    } else {
                        Instant wait = credential.cooldownUntil != null
                                ? credential.cooldownUntil
                                : now.plus(IN_FLIGHT_POLL);
                        if (earliest == null || wait.isBefore(earliest)) {
                            earliest = wait;
                        }
                    }
                } finally {
                    credential.lock.unlock();
                }
            }

            if (!anyLive) {
                return Acquisition.exhausted();
            }
            Credential chosen = best != null ? best : fallback;
            if (chosen == null) {
                return Acquisition.blocked(earliest);
            }
            if (reserve(chosen, now)) {
                return Acquisition.granted(chosen);
            }
            // another worker took the last unit between the scan and the reservation
        }
    }

    private boolean reserve(Credential credential, Instant now) {
        credential.lock.lock();
        try {
            refresh(credential, now);
            if (credential.retired || credential.cooldownUntil != null || credential.available() <= 0) {
                return false;
            }
            credential.inFlight++;
            return true;
        } finally {
            credential.lock.unlock();
        }
    }

    /**
     * Ends a cooldown whose time has passed and restores the full budget once
     * the reset time is behind us. Caller holds the credential's lock.
     */
    private void refresh(Credential credential, Instant now) {
        if (credential.cooldownUntil != null && !now.isBefore(credential.cooldownUntil)) {
            credential.cooldownUntil = null;
            if (credential.remainingQuota == 0) {
                credential.remainingQuota = credential.limit;
                credential.resetAt = null;
            }
            logger.debug("Credential {} cooled down, quota {}", credential, credential.remainingQuota);
        } else if (credential.cooldownUntil == null && credential.remainingQuota == 0
                && credential.resetAt != null && !now.isBefore(credential.resetAt)) {
            credential.remainingQuota = credential.limit;
            credential.resetAt = null;
        }
    }

    /**
     * Applies the quota signals of a response. A quota of zero puts the
     * credential into cooldown until its reset time.
     */
    public void report(Credential credential, RateLimitSnapshot snapshot) {
        if (snapshot == null || snapshot.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        credential.lock.lock();
        try {
            if (snapshot.limit() != null && snapshot.limit() > 0) {
                credential.limit = snapshot.limit();
            }
            if (snapshot.resetAt() != null) {
                credential.resetAt = snapshot.resetAt();
            }
            if (snapshot.remaining() != null) {
                credential.remainingQuota = Math.max(0, snapshot.remaining());
                if (credential.remainingQuota == 0) {
                    Instant until = credential.resetAt != null && credential.resetAt.isAfter(now)
                            ? credential.resetAt
                            : now.plus(defaultCooldown);
                    startCooldown(credential, until);
                    logger.warn("Credential {} exhausted its quota. Cooling down until {}",
                            credential, credential.cooldownUntil);
                }
            }
        } finally {
            credential.lock.unlock();
        }
    }

    /**
     * Puts a credential into cooldown after the API throttled it.
     */
    public void throttle(Credential credential, Instant until) {
        credential.lock.lock();
        try {
            credential.remainingQuota = 0;
            startCooldown(credential, until);
        } finally {
            credential.lock.unlock();
        }
        logger.warn("Credential {} throttled until {}", credential, until);
    }

    private static void startCooldown(Credential credential, Instant until) {
        if (credential.cooldownUntil == null || until.isAfter(credential.cooldownUntil)) {
            credential.cooldownUntil = until;
        }
    }

    /**
     * Takes a credential out of rotation for the rest of the run.
     */
    public void retire(Credential credential) {
        credential.lock.lock();
        try {
            credential.retired = true;
        } finally {
            credential.lock.unlock();
        }
        logger.error("Credential {} rejected by the API and retired for this run", credential);
    }

    /**
     * Returns the in-flight slot taken by {@link #acquire}.
     */
    public void release(Credential credential) {
        credential.lock.lock();
        try {
            credential.inFlight = Math.max(0, credential.inFlight - 1);
        } finally {
            credential.lock.unlock();
        }
    }
}
