package com.repoharvest.extractor.orchestrator;

import com.repoharvest.extractor.model.WorkItem;

/**
 * Final disposition of one work item for the run report.
 *
 * @param reason why the item was skipped or failed; {@code null} when loaded
 */
public record ItemResult(
        WorkItem item,
        Disposition disposition,
        String reason,
        int attempts
) {

    public enum Disposition { LOADED, SKIPPED, FAILED }

    public static ItemResult loaded(WorkItem item, int attempts) {
        return new ItemResult(item, Disposition.LOADED, null, attempts);
    }

    public static ItemResult skipped(WorkItem item, String reason, int attempts) {
        return new ItemResult(item, Disposition.SKIPPED, reason, attempts);
    }

    public static ItemResult failed(WorkItem item, String reason, int attempts) {
        return new ItemResult(item, Disposition.FAILED, reason, attempts);
    }
}
