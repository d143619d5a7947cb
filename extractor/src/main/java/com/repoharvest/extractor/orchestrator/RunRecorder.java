package com.repoharvest.extractor.orchestrator;

import com.repoharvest.extractor.model.WorkItem;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Collects item dispositions from concurrent workers. Each work item has one
 * slot; the first disposition recorded for it is final.
 *
 * <p>Items accepted for loading are parked as pending, with their attempt count,
 * until the batch that holds them commits or fails.</p>
 */
class RunRecorder {

    private final Map<WorkItem, ItemResult> results = new ConcurrentHashMap<>();
    private final Map<WorkItem, Integer> pendingAttempts = new ConcurrentHashMap<>();

    boolean record(ItemResult result) {
        pendingAttempts.remove(result.item());
        return results.putIfAbsent(result.item(), result) == null;
    }

    void pending(WorkItem item, int attempts) {
        pendingAttempts.put(item, attempts);
    }

    void loaded(List<WorkItem> items) {
        for (WorkItem item : items) {
            record(ItemResult.loaded(item, attemptsOf(item)));
        }
    }

    void batchFailed(List<WorkItem> items, String reason) {
        for (WorkItem item : items) {
            record(ItemResult.failed(item, "batch load failed: " + reason, attemptsOf(item)));
        }
    }

    private int attemptsOf(WorkItem item) {
        Integer attempts = pendingAttempts.get(item);
        return attempts != null ? attempts : 0;
    }

    boolean isRecorded(WorkItem item) {
        return results.containsKey(item);
    }

    /**
     * Results in input order.
     */
    List<ItemResult> results() {
        return results.values().stream()
                .sorted(Comparator.comparingInt(r -> r.item().sequence()))
                .toList();
    }
}
