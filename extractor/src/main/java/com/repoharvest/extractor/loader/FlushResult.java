package com.repoharvest.extractor.loader;

import com.repoharvest.extractor.model.WorkItem;

import java.util.List;

/**
 * Result of flushing one batch. A batch commits or fails as a whole, so every
 * work item in {@code items} shares the outcome.
 */
public record FlushResult(
        List<WorkItem> items,
        int rowsWritten,
        int attempts,
        boolean success,
        String errorMessage
) {

    public static FlushResult empty() {
        return new FlushResult(List.of(), 0, 0, true, null);
    }

    static FlushResult committed(List<WorkItem> items, int rowsWritten, int attempts) {
        return new FlushResult(List.copyOf(items), rowsWritten, attempts, true, null);
    }

    static FlushResult failed(List<WorkItem> items, int attempts, String errorMessage) {
        return new FlushResult(List.copyOf(items), 0, attempts, false, errorMessage);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
