package com.repoharvest.extractor.client;

import com.repoharvest.extractor.concurrent.CancellationSignal;
import com.repoharvest.extractor.concurrent.Sleeper;
import com.repoharvest.extractor.config.RetrySettings;
import com.repoharvest.extractor.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Fetches one work item with bounded retries, exponential backoff and
 * credential rotation.
 *
 * <p>Decision per attempt outcome:</p>
 * <ul>
 *   <li>SUCCESS, NOT_FOUND, FATAL_ERROR: stop.</li>
 *   <li>RATE_LIMITED: prefer another credential next time, back off by
 *       {@code max(retryAfter, backoff)}.</li>
 *   <li>TRANSIENT_ERROR: back off by {@code base * 2^(attempt - 1)}.</li>
 *   <li>AUTH_FAILED: retire the credential and retry at once.</li>
 * </ul>
 * <p>Waiting for a cooling-down credential does not use up an attempt.</p>
 */
public class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    private final CredentialPool pool;
    private final RepositoryFetcher fetcher;
    private final RetrySettings settings;
    private final Sleeper sleeper;
    private final Clock clock;

    public RetryPolicy(CredentialPool pool, RepositoryFetcher fetcher, RetrySettings settings,
                       Sleeper sleeper) {
        this(pool, fetcher, settings, sleeper, Clock.systemUTC());
    }

    public RetryPolicy(CredentialPool pool, RepositoryFetcher fetcher, RetrySettings settings,
                       Sleeper sleeper, Clock clock) {
        this.pool = pool;
        this.fetcher = fetcher;
        this.settings = settings;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public RetryResult execute(WorkItem item, CancellationSignal signal) {
        int attempts = 0;
        FetchOutcome last = null;
        Credential avoid = null;

        while (attempts < settings.maxAttempts()) {
            if (signal.isSet()) {
                return RetryResult.cancelled(item, last, attempts);
            }

            Acquisition acquisition = pool.acquire(avoid);
            if (acquisition.status() == Acquisition.Status.EXHAUSTED) {
                logger.error("No usable credentials left for {}", item.fullName());
                return RetryResult.exhausted(item, last, attempts);
            }
            if (acquisition.status() == Acquisition.Status.BLOCKED) {
                Duration wait = blockedWait(acquisition.waitUntil());
                logger.debug("All credentials cooling down. {} waits {}ms",
                        item.fullName(), wait.toMillis());
                if (!sleeper.sleep(wait)) {
                    return RetryResult.cancelled(item, last, attempts);
                }
                continue;
            }

            Credential credential = acquisition.credential();
            attempts++;
            FetchOutcome outcome = fetchOnce(item, credential);
            last = outcome;

            Duration delay;
            switch (outcome.kind()) {
                case SUCCESS:
                    return RetryResult.succeeded(item, outcome, attempts);
                case NOT_FOUND:
                    return RetryResult.notFound(item, outcome, attempts);
                case FATAL_ERROR:
                    logger.warn("Fatal error fetching {}: {}", item.fullName(), outcome.describe());
                    return RetryResult.failed(item, outcome, attempts);
                case AUTH_FAILED:
                    pool.retire(credential);
                    avoid = null;
                    continue;
                case RATE_LIMITED:
                    avoid = credential;
                    delay = max(outcome.retryAfter(), backoff(attempts));
                    break;
                case TRANSIENT_ERROR:
                default:
                    avoid = null;
                    delay = backoff(attempts);
                    break;
            }

            if (attempts >= settings.maxAttempts()) {
                break;
            }
            Duration sleep = withJitter(min(delay, settings.maxDelay()));
            logger.warn("Attempt {}/{} for {} failed ({}). Retrying in {}ms",
                    attempts, settings.maxAttempts(), item.fullName(), outcome.describe(),
                    sleep.toMillis());
            if (!sleeper.sleep(sleep)) {
                return RetryResult.cancelled(item, last, attempts);
            }
        }

        logger.error("Giving up on {} after {} attempts: {}", item.fullName(), attempts,
                last != null ? last.describe() : "no attempt made");
        return RetryResult.failed(item, last, attempts);
    }

    private FetchOutcome fetchOnce(WorkItem item, Credential credential) {
        try {
            return fetcher.fetch(item, credential);
        } catch (RuntimeException e) {
            logger.error("Unexpected error fetching {}", item.fullName(), e);
            return FetchOutcome.fatalError("unexpected error: " + e);
        } finally {
            pool.release(credential);
        }
    }

    /**
     * {@code base * 2^(attempt - 1)}: the first retry waits {@code base}.
     */
    Duration backoff(int attempt) {
        int exponent = Math.min(Math.max(0, attempt - 1), 30);
        long millis = settings.baseDelay().toMillis() * (1L << exponent);
        return Duration.ofMillis(Math.min(millis, settings.maxDelay().toMillis()));
    }

    private Duration blockedWait(Instant waitUntil) {
        Duration wait = waitUntil != null
                ? Duration.between(clock.instant(), waitUntil)
                : CredentialPool.IN_FLIGHT_POLL;
        if (wait.isNegative()) {
            return Duration.ZERO;
        }
        return min(wait, settings.maxBlockedWait());
    }

    private Duration withJitter(Duration delay) {
        long bound = (long) (delay.toMillis() * settings.jitterRatio());
        if (bound <= 0) {
            return delay;
        }
        return delay.plusMillis(ThreadLocalRandom.current().nextLong(bound + 1));
    }

    private static Duration max(Duration a, Duration b) {
        if (a == null) {
            return b;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
