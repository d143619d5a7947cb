package com.repoharvest.extractor.model;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Normalized repository row for the {@code projects} table, plus the
 * repository's topics for {@code project_topics}.
 * Maps from: GraphQL {@code repository} object
 */
public record RepositoryRecord(
        String id,
        String name,
        String ownerLogin,
        String description,
        Integer stargazerCount,
        Integer forkCount,
        String primaryLanguage,
        OffsetDateTime createdAt,
        OffsetDateTime pushedAt,
        String licenseName,
        Boolean archived,
        Boolean disabled,
        Boolean fork,
        String url,
        List<String> topics,
        OffsetDateTime lastExtractedAt
) {

    public RepositoryRecord {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
