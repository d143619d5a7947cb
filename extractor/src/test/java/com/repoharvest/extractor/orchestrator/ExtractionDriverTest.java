package com.repoharvest.extractor.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.repoharvest.extractor.client.CredentialPool;
import com.repoharvest.extractor.client.FetchOutcome;
import com.repoharvest.extractor.client.RepositoryFetcher;
import com.repoharvest.extractor.client.RetryPolicy;
import com.repoharvest.extractor.concurrent.CancellationSignal;
import com.repoharvest.extractor.config.ExtractionSettings;
import com.repoharvest.extractor.config.LoaderSettings;
import com.repoharvest.extractor.config.RetrySettings;
import com.repoharvest.extractor.loader.BatchLoader;
import com.repoharvest.extractor.loader.FlushResult;
import com.repoharvest.extractor.model.RateLimitSnapshot;
import com.repoharvest.extractor.model.WorkItem;
import com.repoharvest.extractor.transform.RepositoryTransformer;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests for the extraction driver. Uses the real pool, retry policy,
 * transformer and an H2-backed loader, with a scripted fetcher standing in for
 * the GraphQL API.
 */
@ExtendWith(MockitoExtension.class)
class ExtractionDriverTest {

    private static final RetrySettings RETRY = new RetrySettings(3, Duration.ofMillis(10),
            Duration.ofMillis(100), Duration.ofSeconds(5), Duration.ofSeconds(1), 0.0);

    @Mock
    private BatchLoader mockLoader;

    private JdbcDataSource database;
    private CancellationSignal signal;

    @BeforeEach
    void setUp() {
        database = new JdbcDataSource();
        database.setURL("jdbc:h2:mem:driver-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        signal = new CancellationSignal();
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static JsonNode repository(String name) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("id", "R_" + name);
        node.put("name", name);
        node.putObject("owner").put("login", "octo");
        node.put("stargazerCount", 5);
        return node;
    }

    private static List<WorkItem> items(String... names) {
        List<WorkItem> items = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            items.add(WorkItem.of(i, "octo", names[i]));
        }
        return items;
    }

    private BatchLoader h2Loader(int batchSize) {
        return new BatchLoader(database,
                new LoaderSettings(batchSize, Duration.ofMinutes(5), 2, Duration.ofMillis(5)),
                signal, Clock.systemUTC());
    }

    private ExtractionDriver driver(CredentialPool pool, RepositoryFetcher fetcher, BatchLoader loader,
                                    int concurrency) {
        RetryPolicy retryPolicy = new RetryPolicy(pool, fetcher, RETRY, signal);
        return new ExtractionDriver(pool, retryPolicy, new RepositoryTransformer(), loader,
                new ExtractionSettings(concurrency, 2, Duration.ofSeconds(5)), signal);
    }

    private static CredentialPool pool(int quota, String... tokens) {
        return new CredentialPool(List.of(tokens), quota, Duration.ofSeconds(60), Clock.systemUTC());
    }

    private long projectCount(String where) throws SQLException {
        try (Connection connection = database.getConnection();
             Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM projects " + where)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static void assertPartition(List<WorkItem> items, RunReport report) {
        assertEquals(items.size(), report.results().size());
        Set<WorkItem> seen = new HashSet<>();
        for (ItemResult result : report.results()) {
            assertTrue(seen.add(result.item()), "duplicate disposition for " + result.item());
        }
        assertEquals(new HashSet<>(items), seen);
        assertEquals(items.size(),
                report.loadedCount() + report.skippedCount() + report.failedCount());
    }

    private static ItemResult resultFor(RunReport report, String name) {
        return report.results().stream()
                .filter(r -> r.item().name().equals(name))
                .findFirst()
                .orElseThrow();
    }

    // =========================================================================
    // Dispositions
    // =========================================================================

    @Test
    @DisplayName("Every input item ends in exactly one disposition")
    void run_partitionsItems() throws SQLException {
        Map<String, FetchOutcome> outcomes = Map.of(
                "one", FetchOutcome.success(repository("one")),
                "two", FetchOutcome.success(repository("two")),
                "three", FetchOutcome.success(repository("three")),
                "gone", FetchOutcome.notFound("HTTP 404"),
                "broken", FetchOutcome.fatalError("unparseable response body"),
                "odd", FetchOutcome.success(JsonNodeFactory.instance.objectNode().put("name", "odd")));
        List<WorkItem> items = items("one", "gone", "two", "broken", "odd", "three");

        RunReport report = driver(pool(5000, "ghs_a", "ghs_b"),
                (item, credential) -> outcomes.get(item.name()), h2Loader(2), 4).run(items);

        assertPartition(items, report);
        assertEquals(RunReport.Status.COMPLETED, report.status());
        assertNull(report.stopReason());
        assertEquals(3, report.loadedCount());
        assertEquals(2, report.skippedCount());
        assertEquals(1, report.failedCount());
        assertEquals(ItemResult.Disposition.SKIPPED, resultFor(report, "gone").disposition());
        assertEquals(ItemResult.Disposition.SKIPPED, resultFor(report, "odd").disposition());
        assertEquals(ItemResult.Disposition.FAILED, resultFor(report, "broken").disposition());
        assertEquals(1, resultFor(report, "one").attempts());
        assertEquals(1, resultFor(report, "gone").attempts());
        assertEquals(3, projectCount(""));
        assertEquals(0, projectCount("WHERE name = 'gone'"));
        assertEquals(List.of("one", "gone", "two", "broken", "odd", "three"),
                report.results().stream().map(r -> r.item().name()).toList());
    }

    @Test
    @DisplayName("Re-running the same work list leaves one row per repository")
    void run_idempotent() throws SQLException {
        List<WorkItem> items = items("one", "two");
        RepositoryFetcher fetcher = (item, credential) -> FetchOutcome.success(repository(item.name()));

        driver(pool(5000, "ghs_a"), fetcher, h2Loader(10), 2).run(items);
        RunReport second = driver(pool(5000, "ghs_a"), fetcher, h2Loader(10), 2).run(items);

        assertEquals(2, second.loadedCount());
        assertEquals(2, projectCount(""));
    }

    @Test
    @DisplayName("With one credential of quota 1, the second item waits for the reset")
    void run_waitsForQuotaReset() throws SQLException {
        CredentialPool pool = pool(1, "ghs_a");
        AtomicInteger fetches = new AtomicInteger();
        RepositoryFetcher fetcher = (item, credential) -> {
            fetches.incrementAndGet();
            pool.report(credential, new RateLimitSnapshot(0, 1, Instant.now().plusSeconds(2)));
            return FetchOutcome.success(repository(item.name()));
        };
        List<WorkItem> items = items("first", "second");

        Instant start = Instant.now();
        RunReport report = driver(pool, fetcher, h2Loader(10), 2).run(items);
        Duration elapsed = Duration.between(start, Instant.now());

        assertEquals(2, report.loadedCount());
        assertEquals(2, fetches.get());
        assertTrue(elapsed.toMillis() >= 2000, "elapsed " + elapsed.toMillis() + "ms");
        assertEquals(2, projectCount(""));
    }

    // =========================================================================
    // Run-level stops
    // =========================================================================

    @Test
    @DisplayName("Aborts the run when every credential is rejected")
    void run_abortsWhenCredentialsExhausted() throws SQLException {
        AtomicInteger fetches = new AtomicInteger();
        RepositoryFetcher fetcher = (item, credential) -> {
            fetches.incrementAndGet();
            return FetchOutcome.authFailed("HTTP 401");
        };
        List<WorkItem> items = items("a", "b", "c", "d");

        RunReport report = driver(pool(5000, "ghs_a", "ghs_b"), fetcher, h2Loader(10), 1).run(items);

        assertPartition(items, report);
        assertEquals(RunReport.Status.ABORTED, report.status());
        assertEquals("all API credentials were rejected", report.stopReason());
        assertEquals(4, report.failedCount());
        assertEquals(2, fetches.get());
        assertTrue(resultFor(report, "d").reason().startsWith("not processed"));
        assertEquals(0, projectCount(""));
    }

    @Test
    @DisplayName("Cancellation stops dispatching and still flushes loaded records")
    void run_cancelled() throws SQLException {
        List<String> fetched = Collections.synchronizedList(new ArrayList<>());
        RepositoryFetcher fetcher = (item, credential) -> {
            fetched.add(item.name());
            if (item.name().equals("b")) {
                signal.cancel("operator stop");
            }
            return FetchOutcome.success(repository(item.name()));
        };
        List<WorkItem> items = items("a", "b", "c", "d", "e");

        RunReport report = driver(pool(5000, "ghs_a"), fetcher, h2Loader(100), 1).run(items);

        assertPartition(items, report);
        assertEquals(RunReport.Status.CANCELLED, report.status());
        assertEquals("operator stop", report.stopReason());
        assertEquals(List.of("a", "b"), fetched);
        assertEquals(2, report.loadedCount());
        assertEquals(3, report.failedCount());
        assertEquals(2, projectCount(""));
    }

    @Test
    @DisplayName("Aborts with every item failed when the store schema cannot be created")
    void run_schemaFailure() throws SQLException {
        doThrow(new SQLException("connection refused", "08001")).when(mockLoader).ensureSchema();
        when(mockLoader.flush()).thenReturn(FlushResult.empty());
        AtomicInteger fetches = new AtomicInteger();
        RepositoryFetcher fetcher = (item, credential) -> {
            fetches.incrementAndGet();
            return FetchOutcome.success(repository(item.name()));
        };
        List<WorkItem> items = items("a", "b");

        RunReport report = driver(pool(5000, "ghs_a"), fetcher, mockLoader, 2).run(items);

        assertPartition(items, report);
        assertEquals(RunReport.Status.ABORTED, report.status());
        assertTrue(report.stopReason().contains("connection refused"));
        assertEquals(2, report.failedCount());
        assertEquals(0, fetches.get());
    }

    // =========================================================================
    // Batch outcomes
    // =========================================================================

    @Test
    @DisplayName("A failed batch marks exactly its own items failed")
    void run_batchFailureAttributedToItems() throws SQLException {
        when(mockLoader.add(any(WorkItem.class), any())).thenReturn(FlushResult.empty());
        List<WorkItem> items = items("a", "gone", "b");
        when(mockLoader.flush()).thenReturn(new FlushResult(
                List.of(items.get(0), items.get(2)), 0, 2, false, "SQLState 08006: connection lost"));
        RepositoryFetcher fetcher = (item, credential) -> item.name().equals("gone")
                ? FetchOutcome.notFound("HTTP 404")
                : FetchOutcome.success(repository(item.name()));

        RunReport report = driver(pool(5000, "ghs_a"), fetcher, mockLoader, 1).run(items);

        assertPartition(items, report);
        assertEquals(RunReport.Status.COMPLETED, report.status());
        assertEquals(2, report.failedCount());
        assertEquals(1, report.skippedCount());
        ItemResult failed = resultFor(report, "a");
        assertEquals("batch load failed: SQLState 08006: connection lost", failed.reason());
        assertEquals(1, failed.attempts());
        verify(mockLoader, times(2)).add(any(WorkItem.class), any());
    }

    @Test
    @DisplayName("Worker count is bounded by concurrency, credentials and items")
    void workerCount() {
        ExtractionDriver driver = driver(pool(5000, "ghs_a"),
                (item, credential) -> FetchOutcome.notFound("unused"), h2Loader(10), 8);

        assertEquals(2, driver.workerCount(100));
        assertEquals(1, driver.workerCount(1));
        assertEquals(1, driver.workerCount(0));
    }
}
