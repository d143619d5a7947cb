package com.repoharvest.extractor.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * Classified result of a single fetch attempt.
 *
 * <p>{@code payload} is set only for {@link Kind#SUCCESS}, {@code retryAfter} only
 * for {@link Kind#RATE_LIMITED}.</p>
 */
public record FetchOutcome(
        Kind kind,
        JsonNode payload,
        Duration retryAfter,
        String cause
) {

    public enum Kind {
        SUCCESS,
        RATE_LIMITED,
        AUTH_FAILED,
        NOT_FOUND,
        TRANSIENT_ERROR,
        FATAL_ERROR
    }

    public static FetchOutcome success(JsonNode payload) {
        return new FetchOutcome(Kind.SUCCESS, payload, null, null);
    }

    public static FetchOutcome rateLimited(Duration retryAfter, String cause) {
        return new FetchOutcome(Kind.RATE_LIMITED, null, retryAfter, cause);
    }

    public static FetchOutcome authFailed(String cause) {
        return new FetchOutcome(Kind.AUTH_FAILED, null, null, cause);
    }

    public static FetchOutcome notFound(String cause) {
        return new FetchOutcome(Kind.NOT_FOUND, null, null, cause);
    }

    public static FetchOutcome transientError(String cause) {
        return new FetchOutcome(Kind.TRANSIENT_ERROR, null, null, cause);
    }

    public static FetchOutcome fatalError(String cause) {
        return new FetchOutcome(Kind.FATAL_ERROR, null, null, cause);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    /**
     * Short human-readable description for logs and the run report.
     */
    public String describe() {
        return cause != null ? kind + ": " + cause : kind.toString();
    }
}
