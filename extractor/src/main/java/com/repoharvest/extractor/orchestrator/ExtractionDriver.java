package com.repoharvest.extractor.orchestrator;

import com.repoharvest.extractor.client.CredentialPool;
import com.repoharvest.extractor.client.RetryPolicy;
import com.repoharvest.extractor.client.RetryResult;
import com.repoharvest.extractor.concurrent.CancellationSignal;
import com.repoharvest.extractor.config.ExtractionSettings;
import com.repoharvest.extractor.loader.BatchLoader;
import com.repoharvest.extractor.loader.FlushResult;
import com.repoharvest.extractor.model.WorkItem;
import com.repoharvest.extractor.transform.RecordTransformer;
import com.repoharvest.extractor.transform.TransformResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Coordinates the extraction run: fetch each work item through the
 * {@link RetryPolicy}, transform successful payloads, and push the records to the
 * {@link BatchLoader}. Items are processed concurrently; one item's failure never
 * stops the others.
 *
 * <p>The run ends with a {@link RunReport} in every case. Cancellation stops
 * dispatching new items, lets in-flight ones finish, and flushes the current batch.</p>
 */
public class ExtractionDriver {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionDriver.class);

    private final CredentialPool pool;
    private final RetryPolicy retryPolicy;
    private final RecordTransformer transformer;
    private final BatchLoader loader;
    private final ExtractionSettings settings;
    private final CancellationSignal signal;

    public ExtractionDriver(CredentialPool pool, RetryPolicy retryPolicy, RecordTransformer transformer,
                            BatchLoader loader, ExtractionSettings settings, CancellationSignal signal) {
        this.pool = pool;
        this.retryPolicy = retryPolicy;
        this.transformer = transformer;
        this.loader = loader;
        this.settings = settings;
        this.signal = signal;
    }

    /**
     * Requests a graceful stop of the current run.
     */
    public void cancel(String reason) {
        signal.cancel(reason);
    }

    /**
     * Runs the full extraction pipeline over {@code items}.
     *
     * @return report with exactly one disposition per input item
     */
    public RunReport run(List<WorkItem> items) {
        Instant runStart = Instant.now();
        RunRecorder recorder = new RunRecorder();
        logger.info("Starting extraction for {} repositories", items.size());

        // Ensure the store is ready before spending API quota
        try {
            loader.ensureSchema();
        } catch (SQLException e) {
            logger.error("Failed to initialize the store schema", e);
            signal.abort("store unavailable: " + e.getMessage());
        }

        if (!signal.isSet()) {
            processAll(items, recorder);
        }

        apply(loader.flush(), recorder);

        String notDispatched = signal.isSet()
                ? "not processed: " + signal.reason().message()
                : "not processed";
        for (WorkItem item : items) {
            if (!recorder.isRecorded(item)) {
                recorder.record(ItemResult.failed(item, notDispatched, 0));
            }
        }

        RunReport report = new RunReport(recorder.results(), status(), stopReason(), elapsed(runStart));
        logSummary(report);
        return report;
    }

    private void processAll(List<WorkItem> items, RunRecorder recorder) {
        int workers = workerCount(items.size());
        logger.info("Processing with {} workers over {} usable credentials",
                workers, pool.usableCount());

        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreads());
        boolean interrupted = false;
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (WorkItem item : items) {
                futures.add(executor.submit(() -> process(item, recorder)));
            }
            for (Future<?> future : futures) {
                interrupted |= awaitQuietly(future);
            }
        } finally {
            executor.shutdown();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Waits for one worker task. An interrupt of the driver thread cancels the
     * run but still waits for the task, so no worker outlives the final flush.
     *
     * @return whether the driver thread was interrupted while waiting
     */
    private boolean awaitQuietly(Future<?> future) {
        boolean interrupted = false;
        while (true) {
            try {
                future.get();
                return interrupted;
            } catch (InterruptedException e) {
                interrupted = true;
                signal.cancel("interrupted");
            } catch (ExecutionException e) {
                logger.error("Worker task failed unexpectedly", e.getCause());
                return interrupted;
            }
        }
    }

    int workerCount(int itemCount) {
        int byCredentials = Math.max(1, pool.usableCount()) * settings.workersPerCredential();
        return Math.max(1, Math.min(Math.min(settings.concurrency(), byCredentials), itemCount));
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "extract-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // =========================================================================
    // Per-item processing
    // =========================================================================

    void process(WorkItem item, RunRecorder recorder) {
        if (signal.isSet()) {
            recorder.record(ItemResult.failed(item, "not processed: " + signal.reason().message(), 0));
            return;
        }
        try {
            RetryResult result = retryPolicy.execute(item, signal);
            switch (result.status()) {
                case SUCCEEDED:
                    handlePayload(item, result, recorder);
                    break;
                case NOT_FOUND:
                    logger.info("Skipping {}: not found", item.fullName());
                    recorder.record(ItemResult.skipped(item, "not found: " + result.cause(), result.attempts()));
                    break;
                case CREDENTIALS_EXHAUSTED:
                    signal.abort("all API credentials were rejected");
                    recorder.record(ItemResult.failed(item, result.cause(), result.attempts()));
                    break;
                case CANCELLED:
                case FAILED:
                default:
                    recorder.record(ItemResult.failed(item, result.cause(), result.attempts()));
                    break;
            }
        } catch (RuntimeException e) {
            logger.error("Unexpected error processing {}", item.fullName(), e);
            recorder.record(ItemResult.failed(item, "unexpected error: " + e, 0));
        }
    }

    private void handlePayload(WorkItem item, RetryResult result, RunRecorder recorder) {
        TransformResult transformed = transformer.transform(result.payload());
        if (!transformed.isAccepted()) {
            logger.warn("Skipping {}: {}", item.fullName(), transformed.rejectionReason());
            recorder.record(ItemResult.skipped(item, transformed.rejectionReason(), result.attempts()));
            return;
        }
        recorder.pending(item, result.attempts());
        apply(loader.add(item, transformed.record()), recorder);
    }

    private static void apply(FlushResult flush, RunRecorder recorder) {
        if (flush.isEmpty()) {
            return;
        }
        if (flush.success()) {
            recorder.loaded(flush.items());
        } else {
            recorder.batchFailed(flush.items(), flush.errorMessage());
        }
    }

    // =========================================================================
    // Reporting
    // =========================================================================

    private RunReport.Status status() {
        CancellationSignal.Reason reason = signal.reason();
        if (reason == null) {
            return RunReport.Status.COMPLETED;
        }
        return reason.kind() == CancellationSignal.Kind.CANCELLED
                ? RunReport.Status.CANCELLED
                : RunReport.Status.ABORTED;
    }

    private String stopReason() {
        CancellationSignal.Reason reason = signal.reason();
        return reason != null ? reason.message() : null;
    }

    private void logSummary(RunReport report) {
        logger.info("=== Extraction Summary ===");
        logger.info("Status: {}{}", report.status(),
                report.stopReason() != null ? " (" + report.stopReason() + ")" : "");
        logger.info("Total duration: {}ms", report.totalDurationMs());
        logger.info("Loaded={}, skipped={}, failed={}",
                report.loadedCount(), report.skippedCount(), report.failedCount());

        if (report.hasFailures()) {
            logger.warn("Extraction completed with {} failures", report.failedCount());
            report.failures().forEach(r -> logger.warn("  FAILED: {}: {}",
                    r.item().fullName(), r.reason()));
        }
    }

    private long elapsed(Instant start) {
        return Instant.now().toEpochMilli() - start.toEpochMilli();
    }
}
