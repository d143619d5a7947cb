package com.repoharvest.extractor.transform;

import com.repoharvest.extractor.model.RepositoryRecord;

/**
 * Either a normalized record or the reason the raw object could not become one.
 */
public record TransformResult(
        RepositoryRecord record,
        String rejectionReason
) {

    public static TransformResult accepted(RepositoryRecord record) {
        return new TransformResult(record, null);
    }

    public static TransformResult rejected(String reason) {
        return new TransformResult(null, reason);
    }

    public boolean isAccepted() {
        return record != null;
    }
}
