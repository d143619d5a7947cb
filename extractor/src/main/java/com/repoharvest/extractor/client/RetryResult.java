package com.repoharvest.extractor.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.repoharvest.extractor.model.WorkItem;

/**
 * Terminal result of {@link RetryPolicy#execute} for one work item.
 *
 * @param lastOutcome the outcome of the final attempt, or {@code null} if no
 *                    attempt was made
 * @param attempts    fetch attempts performed
 */
public record RetryResult(
        WorkItem item,
        Status status,
        FetchOutcome lastOutcome,
        int attempts,
        String cause
) {

    public enum Status {
        SUCCEEDED,
        NOT_FOUND,
        FAILED,
        CREDENTIALS_EXHAUSTED,
        CANCELLED
    }

    static RetryResult succeeded(WorkItem item, FetchOutcome outcome, int attempts) {
        return new RetryResult(item, Status.SUCCEEDED, outcome, attempts, null);
    }

    static RetryResult notFound(WorkItem item, FetchOutcome outcome, int attempts) {
        return new RetryResult(item, Status.NOT_FOUND, outcome, attempts, outcome.describe());
    }

    static RetryResult failed(WorkItem item, FetchOutcome outcome, int attempts) {
        return new RetryResult(item, Status.FAILED, outcome, attempts, outcome.describe());
    }

    static RetryResult exhausted(WorkItem item, FetchOutcome lastOutcome, int attempts) {
        return new RetryResult(item, Status.CREDENTIALS_EXHAUSTED, lastOutcome, attempts,
                "no usable API credentials left");
    }

    static RetryResult cancelled(WorkItem item, FetchOutcome lastOutcome, int attempts) {
        String cause = lastOutcome != null
                ? "cancelled after " + lastOutcome.describe()
                : "cancelled before fetch";
        return new RetryResult(item, Status.CANCELLED, lastOutcome, attempts, cause);
    }

    public JsonNode payload() {
        return lastOutcome != null ? lastOutcome.payload() : null;
    }
}
