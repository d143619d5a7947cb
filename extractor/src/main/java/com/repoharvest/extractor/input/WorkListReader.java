package com.repoharvest.extractor.input;

import com.repoharvest.extractor.model.WorkItem;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the work list CSV with columns {@code name,num_downloads,owners_and_repo}.
 * Rows without a name or without an {@code owner/repo} identifier are skipped
 * with a warning.
 */
public class WorkListReader {

    private static final Logger logger = LoggerFactory.getLogger(WorkListReader.class);

    static final String COLUMN_NAME = "name";
    static final String COLUMN_DOWNLOADS = "num_downloads";
    static final String COLUMN_OWNER_AND_REPO = "owners_and_repo";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();

    public List<WorkItem> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<WorkItem> items = read(reader);
            logger.info("Loaded {} repositories from {}", items.size(), path);
            return items;
        }
    }

    public List<WorkItem> read(Reader reader) throws IOException {
        List<WorkItem> items = new ArrayList<>();
        try (CSVParser parser = FORMAT.parse(reader)) {
            List<String> headers = parser.getHeaderNames();
            for (String required : List.of(COLUMN_NAME, COLUMN_DOWNLOADS, COLUMN_OWNER_AND_REPO)) {
                if (!headers.contains(required)) {
                    throw new IOException("CSV file must contain all required columns: "
                            + String.join(", ", COLUMN_NAME, COLUMN_DOWNLOADS, COLUMN_OWNER_AND_REPO));
                }
            }

            for (CSVRecord record : parser) {
                WorkItem item = toWorkItem(record, items.size());
                if (item != null) {
                    items.add(item);
                }
            }
        }
        return items;
    }

    private static WorkItem toWorkItem(CSVRecord record, int sequence) {
        String displayName = column(record, COLUMN_NAME);
        String ownerAndRepo = column(record, COLUMN_OWNER_AND_REPO);
        if (displayName == null || ownerAndRepo == null) {
            logger.warn("Skipping CSV row {}: missing name or owners_and_repo", record.getRecordNumber());
            return null;
        }

        int slash = ownerAndRepo.indexOf('/');
        String owner = slash > 0 ? ownerAndRepo.substring(0, slash).trim() : "";
        String repo = slash > 0 ? ownerAndRepo.substring(slash + 1).trim() : "";
        if (owner.isEmpty() || repo.isEmpty()) {
            logger.warn("Skipping row due to invalid 'owners_and_repo' format: {}", ownerAndRepo);
            return null;
        }

        return new WorkItem(sequence, owner, repo, displayName, downloads(record));
    }

    private static Long downloads(CSVRecord record) {
        String value = column(record, COLUMN_DOWNLOADS);
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.replace(",", ""));
        } catch (NumberFormatException e) {
            logger.debug("Ignoring non-numeric num_downloads '{}' on row {}", value, record.getRecordNumber());
            return null;
        }
    }

    private static String column(CSVRecord record, String name) {
        if (!record.isSet(name)) {
            return null;
        }
        String value = record.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
