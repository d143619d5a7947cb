package com.repoharvest.extractor.orchestrator;

import com.repoharvest.extractor.client.CredentialPool;
import com.repoharvest.extractor.client.GraphQlClient;
import com.repoharvest.extractor.client.RetryPolicy;
import com.repoharvest.extractor.concurrent.CancellationSignal;
import com.repoharvest.extractor.config.AppConfig;
import com.repoharvest.extractor.input.WorkListReader;
import com.repoharvest.extractor.loader.BatchLoader;
import com.repoharvest.extractor.model.WorkItem;
import com.repoharvest.extractor.transform.RepositoryTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Main entry point for the repository metadata harvester.
 * Parses CLI arguments, initializes components, runs the extraction pipeline,
 * and exits with appropriate status codes.
 *
 * <p>Usage:
 * <pre>
 *   java -jar extractor.jar                      # reads REPOS_CSV (default repos.csv)
 *   java -jar extractor.jar --input other.csv    # reads the given work list
 * </pre>
 */
public class ExtractorApp {

    private static final Logger logger = LoggerFactory.getLogger(ExtractorApp.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(60);

    public static void main(String[] args) {
        logger.info("Starting repository harvest");

        try {
            AppConfig config = new AppConfig();
            Path input = Path.of(parseInputPath(args, config.getReposCsv()));
            List<WorkItem> items = new WorkListReader().read(input);
            if (items.isEmpty()) {
                logger.warn("No repositories to process in {}", input);
                System.exit(0);
            }

            CancellationSignal signal = new CancellationSignal();
            CredentialPool pool = new CredentialPool(
                    config.getGithubTokens(), config.getRetrySettings().defaultRetryAfter());
            GraphQlClient client = new GraphQlClient(
                    config.getGraphqlApiUrl(), pool,
                    config.getRetrySettings().defaultRetryAfter(),
                    config.getExtractionSettings().fetchTimeout());
            RetryPolicy retryPolicy = new RetryPolicy(pool, client, config.getRetrySettings(), signal);
            BatchLoader loader = new BatchLoader(
                    config.getDbHost(), config.getDbPort(), config.getDbName(),
                    config.getDbUser(), config.getDbPassword(), config.getLoaderSettings());

            ExtractionDriver driver = new ExtractionDriver(pool, retryPolicy,
                    new RepositoryTransformer(), loader, config.getExtractionSettings(), signal);

            // Let an interrupted run flush its current batch before the JVM goes down
            CountDownLatch runFinished = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                driver.cancel("shutdown requested");
                try {
                    runFinished.await(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "harvest-shutdown"));

            RunReport report = runAndReport(() -> driver.run(items),
                    new FailureLogFile(Path.of(config.getFailureLogFile())), runFinished);

            if (report.status() != RunReport.Status.COMPLETED || report.hasFailures()) {
                logger.warn("Extraction finished with status {} and {} failures",
                        report.status(), report.failedCount());
                System.exit(1);
            }

            logger.info("Repository harvest finished successfully.");
            System.exit(0);

        } catch (Exception e) {
            logger.error("Fatal error during extraction", e);
            System.exit(1);
        }
    }

    /**
     * Runs the pipeline, prints its summary and writes its failures. The latch is
     * released only after the failure log is written, so a shutdown hook waiting
     * on it never lets the JVM halt mid-write.
     */
    static RunReport runAndReport(Supplier<RunReport> run, FailureSink failureSink,
                                  CountDownLatch runFinished) {
        try {
            RunReport report = run.get();
            printSummary(report);
            writeFailures(failureSink, report);
            return report;
        } finally {
            runFinished.countDown();
        }
    }

    static String parseInputPath(String[] args, String defaultPath) {
        for (int i = 0; i < args.length; i++) {
            if ("--input".equals(args[i]) && i + 1 < args.length) {
                return args[i + 1];
            }
            if (args[i].startsWith("--input=")) {
                return args[i].substring("--input=".length());
            }
        }
        return defaultPath;
    }

    private static void writeFailures(FailureSink sink, RunReport report) {
        try {
            sink.write(report);
        } catch (IOException e) {
            logger.error("Could not write the failure log", e);
        }
    }

    private static void printSummary(RunReport report) {
        System.out.println();
        System.out.println("=== Repository Harvest Summary ===");
        System.out.println("Status:   " + report.status()
                + (report.stopReason() != null ? " (" + report.stopReason() + ")" : ""));
        System.out.println("Duration: " + report.totalDurationMs() + "ms");
        System.out.printf("Results:  loaded=%-6d skipped=%-6d failed=%d%n",
                report.loadedCount(), report.skippedCount(), report.failedCount());

        if (!report.skipped().isEmpty()) {
            System.out.println();
            System.out.println("Skipped:");
            report.skipped().forEach(r -> System.out.println("  - "
                    + r.item().fullName() + ": " + r.reason()));
        }
        if (report.hasFailures()) {
            System.out.println();
            System.out.println("Failures:");
            report.failures().forEach(r -> System.out.println("  - "
                    + r.item().fullName() + " [" + r.attempts() + " attempts]: " + r.reason()));
        }
        System.out.println();
    }
}
