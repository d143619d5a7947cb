package com.repoharvest.extractor.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.repoharvest.extractor.model.RepositoryRecord;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Flattens a GraphQL {@code repository} object into a {@link RepositoryRecord}.
 * Records without an id, name or owner login are rejected.
 */
public class RepositoryTransformer implements RecordTransformer {

    private final Clock clock;

    public RepositoryTransformer() {
        this(Clock.systemUTC());
    }

    public RepositoryTransformer(Clock clock) {
        this.clock = clock;
    }

    @Override
    public TransformResult transform(JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return TransformResult.rejected("no repository data");
        }
        if (!raw.isObject()) {
            return TransformResult.rejected("repository data is not an object");
        }

        String id = text(raw, "id");
        String name = text(raw, "name");
        String ownerLogin = text(raw.path("owner"), "login");
        if (id == null || name == null || ownerLogin == null) {
            return TransformResult.rejected("essential field missing (id, name or owner.login) for "
                    + (text(raw, "url") != null ? text(raw, "url") : "unknown repository"));
        }

        OffsetDateTime createdAt;
        OffsetDateTime pushedAt;
        try {
            createdAt = timestamp(raw, "createdAt");
            pushedAt = timestamp(raw, "pushedAt");
        } catch (DateTimeParseException e) {
            return TransformResult.rejected("unparseable date in " + ownerLogin + "/" + name
                    + ": " + e.getParsedString());
        }

        return TransformResult.accepted(new RepositoryRecord(
                id,
                name,
                ownerLogin,
                text(raw, "description"),
                integer(raw, "stargazerCount"),
                integer(raw, "forkCount"),
                text(raw.path("primaryLanguage"), "name"),
                createdAt,
                pushedAt,
                text(raw.path("licenseInfo"), "name"),
                bool(raw, "isArchived"),
                bool(raw, "isDisabled"),
                bool(raw, "isFork"),
                text(raw, "url"),
                topics(raw),
                OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC)));
    }

    static List<String> topics(JsonNode raw) {
        List<String> topics = new ArrayList<>();
        for (JsonNode node : raw.path("repositoryTopics").path("nodes")) {
            String topic = text(node.path("topic"), "name");
            if (topic != null) {
                String normalized = topic.trim().toLowerCase(Locale.ROOT);
                if (!topics.contains(normalized)) {
                    topics.add(normalized);
                }
            }
        }
        return topics;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.canConvertToInt() ? value.asInt() : null;
    }

    private static Boolean bool(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isBoolean() ? value.asBoolean() : null;
    }

    private static OffsetDateTime timestamp(JsonNode node, String field) {
        String value = text(node, field);
        return value != null ? OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC) : null;
    }
}
