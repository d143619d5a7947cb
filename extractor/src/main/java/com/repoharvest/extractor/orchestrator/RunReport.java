package com.repoharvest.extractor.orchestrator;

import java.util.List;

/**
 * Aggregated result of an extraction run: one {@link ItemResult} per input item
 * plus how the run ended. Provides convenience methods for the summary counts.
 */
public record RunReport(
        List<ItemResult> results,
        Status status,
        String stopReason,
        long totalDurationMs
) {

    public enum Status {
        /** Every item was processed. */
        COMPLETED,
        /** The caller cancelled the run. */
        CANCELLED,
        /** The run stopped itself: no credentials left or the store was unreachable. */
        ABORTED
    }

    public RunReport {
        results = List.copyOf(results);
    }

    public int loadedCount() {
        return count(ItemResult.Disposition.LOADED);
    }

    public int skippedCount() {
        return count(ItemResult.Disposition.SKIPPED);
    }

    public int failedCount() {
        return count(ItemResult.Disposition.FAILED);
    }

    public boolean hasFailures() {
        return failedCount() > 0;
    }

    public List<ItemResult> failures() {
        return withDisposition(ItemResult.Disposition.FAILED);
    }

    public List<ItemResult> skipped() {
        return withDisposition(ItemResult.Disposition.SKIPPED);
    }

    private List<ItemResult> withDisposition(ItemResult.Disposition disposition) {
        return results.stream()
                .filter(r -> r.disposition() == disposition)
                .toList();
    }

    private int count(ItemResult.Disposition disposition) {
        return (int) results.stream().filter(r -> r.disposition() == disposition).count();
    }
}
