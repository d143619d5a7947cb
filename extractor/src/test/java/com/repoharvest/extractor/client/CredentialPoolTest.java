package com.repoharvest.extractor.client;

import com.repoharvest.extractor.MutableClock;
import com.repoharvest.extractor.model.RateLimitSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CredentialPool} selection, cooldown and reservation logic.
 */
class CredentialPoolTest {

    private static final Instant START = Instant.parse("2024-06-01T12:00:00Z");

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
    }

    private CredentialPool pool(int quota, String... tokens) {
        return new CredentialPool(List.of(tokens), quota, Duration.ofSeconds(60), clock);
    }

    private static RateLimitSnapshot remaining(int remaining, Instant resetAt) {
        return new RateLimitSnapshot(remaining, 5000, resetAt);
    }

    // =========================================================================
    // Selection
    // =========================================================================

    @Test
    @DisplayName("Grants the credential with the highest remaining quota")
    void acquire_highestQuota() {
        CredentialPool pool = pool(5000, "ghs_aaaa", "ghs_bbbb", "ghs_cccc");
        List<Credential> credentials = pool.credentials();
        pool.report(credentials.get(0), remaining(10, null));
        pool.report(credentials.get(1), remaining(300, null));
        pool.report(credentials.get(2), remaining(200, null));

        Acquisition acquisition = pool.acquire();

        assertEquals(Acquisition.Status.GRANTED, acquisition.status());
        assertSame(credentials.get(1), acquisition.credential());
    }

    @Test
    @DisplayName("Prefers a credential other than the avoided one")
    void acquire_avoidsGivenCredential() {
        CredentialPool pool = pool(5000, "ghs_aaaa", "ghs_bbbb");
        Credential first = pool.credentials().get(0);
        pool.report(pool.credentials().get(1), remaining(10, null));

        Acquisition acquisition = pool.acquire(first);

        assertSame(pool.credentials().get(1), acquisition.credential());
    }

    @Test
    @DisplayName("Falls back to the avoided credential when it is the only usable one")
    void acquire_avoidedFallback() {
        CredentialPool pool = pool(5000, "ghs_aaaa");
        Credential only = pool.credentials().get(0);

        assertSame(only, pool.acquire(only).credential());
    }

    @Test
    @DisplayName("Labels never expose the full token")
    void labels_maskTokens() {
        CredentialPool pool = pool(5000, "ghs_secretvalue1234");

        String label = pool.credentials().get(0).label();

        assertFalse(label.contains("secretvalue"));
        assertTrue(label.endsWith("1234)"));
    }

    // =========================================================================
    // Cooldown
    // =========================================================================

    @Test
    @DisplayName("Never grants a credential with zero quota before its reset time")
    void zeroQuota_blockedUntilReset() {
        CredentialPool pool = pool(5000, "ghs_aaaa");
        Credential credential = pool.credentials().get(0);
        Instant reset = START.plusSeconds(120);
        pool.report(credential, remaining(0, reset));

        Acquisition blocked = pool.acquire();
        assertEquals(Acquisition.Status.BLOCKED, blocked.status());
        assertEquals(reset, blocked.waitUntil());

        clock.advance(Duration.ofSeconds(119));
        assertEquals(Acquisition.Status.BLOCKED, pool.acquire().status());

        clock.advance(Duration.ofSeconds(1));
        Acquisition granted = pool.acquire();
        assertEquals(Acquisition.Status.GRANTED, granted.status());
        assertEquals(5000, credential.state().remainingQuota());
        assertNull(credential.state().cooldownUntil());
    }

    @Test
    @DisplayName("Blocked acquisition reports the earliest cooldown end")
    void allCoolingDown_earliestWait() {
        CredentialPool pool = pool(5000, "ghs_aaaa", "ghs_bbbb");
        pool.report(pool.credentials().get(0), remaining(0, START.plusSeconds(300)));
        pool.report(pool.credentials().get(1), remaining(0, START.plusSeconds(30)));

        Acquisition acquisition = pool.acquire();

        assertEquals(Acquisition.Status.BLOCKED, acquisition.status());
        assertEquals(START.plusSeconds(30), acquisition.waitUntil());
    }

    @Test
    @DisplayName("Zero quota without a reset time uses the default cooldown")
    void zeroQuota_defaultCooldown() {
        CredentialPool pool = pool(5000, "ghs_aaaa");
        pool.report(pool.credentials().get(0), new RateLimitSnapshot(0, null, null));

        assertEquals(START.plusSeconds(60), pool.acquire().waitUntil());
    }

    @Test
    @DisplayName("A throttled credential is skipped until its cooldown ends")
    void throttle_putsCredentialInCooldown() {
        CredentialPool pool = pool(5000, "ghs_aaaa", "ghs_bbbb");
        Credential first = pool.credentials().get(0);
        Credential second = pool.credentials().get(1);
        pool.report(second, remaining(100, null));
        pool.throttle(first, START.plusSeconds(10));

        assertSame(second, pool.acquire().credential());

        clock.advance(Duration.ofSeconds(10));
        assertSame(first, pool.acquire().credential());
    }

    @Test
    @DisplayName("Reports with no quota signals leave the credential unchanged")
    void emptyReport_ignored() {
        CredentialPool pool = pool(5000, "ghs_aaaa");
        Credential credential = pool.credentials().get(0);

        pool.report(credential, RateLimitSnapshot.empty());
        pool.report(credential, null);

        assertEquals(5000, credential.state().remainingQuota());
    }

    // =========================================================================
    // Retirement
    // =========================================================================

    @Test
    @DisplayName("Returns EXHAUSTED once every credential is retired")
    void allRetired_exhausted() {
        CredentialPool pool = pool(5000, "ghs_aaaa", "ghs_bbbb");
        pool.retire(pool.credentials().get(0));
        assertEquals(1, pool.usableCount());
        assertSame(pool.credentials().get(1), pool.acquire().credential());

        pool.retire(pool.credentials().get(1));

        assertEquals(0, pool.usableCount());
        assertEquals(Acquisition.Status.EXHAUSTED, pool.acquire().status());
    }

    @Test
    @DisplayName("Rejects an empty token list")
    void noTokens_throws() {
        assertThrows(IllegalArgumentException.class, () -> pool(5000));
    }

    // =========================================================================
    // In-flight reservations
    // =========================================================================

    @Test
    @DisplayName("In-flight reservations count against the remaining quota")
    void reservation_limitsGrants() {
        CredentialPool pool = pool(1, "ghs_aaaa");
        Credential credential = pool.credentials().get(0);

        assertEquals(Acquisition.Status.GRANTED, pool.acquire().status());

        Acquisition second = pool.acquire();
        assertEquals(Acquisition.Status.BLOCKED, second.status());
        assertEquals(START.plus(CredentialPool.IN_FLIGHT_POLL), second.waitUntil());

        pool.release(credential);
        assertEquals(Acquisition.Status.GRANTED, pool.acquire().status());
    }

    @Test
    @DisplayName("Concurrent workers never reserve more than the remaining quota")
    void concurrentAcquire_neverOverdraws() throws Exception {
        CredentialPool pool = pool(10, "ghs_aaaa");
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Acquisition>> tasks = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                tasks.add(pool::acquire);
            }
            int granted = 0;
            for (Future<Acquisition> future : executor.invokeAll(tasks)) {
                if (future.get().status() == Acquisition.Status.GRANTED) {
                    granted++;
                }
            }
            assertEquals(10, granted);
            assertEquals(10, pool.credentials().get(0).state().inFlight());
        } finally {
            executor.shutdownNow();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
    }
}
