package com.repoharvest.extractor.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;

/**
 * Appends one tab-separated line per failed item to a persistent log file:
 * {@code timestamp, owner/name, attempts, reason}.
 */
public class FailureLogFile implements FailureSink {

    private static final Logger logger = LoggerFactory.getLogger(FailureLogFile.class);

    private final Path path;
    private final Clock clock;

    public FailureLogFile(Path path) {
        this(path, Clock.systemUTC());
    }

    FailureLogFile(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
    }

    @Override
    public void write(RunReport report) throws IOException {
        if (!report.hasFailures()) {
            return;
        }
        Instant now = clock.instant();
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            for (ItemResult failure : report.failures()) {
                writer.write(now + "\t" + failure.item().fullName() + "\t" + failure.attempts()
                        + "\t" + singleLine(failure.reason()));
                writer.newLine();
            }
        }
        logger.info("Appended {} failures to {}", report.failedCount(), path);
    }

    private static String singleLine(String reason) {
        return reason == null ? "" : reason.replaceAll("[\\t\\r\\n]+", " ");
    }
}
