package com.repoharvest.extractor.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.repoharvest.extractor.model.RateLimitSnapshot;
import com.repoharvest.extractor.model.WorkItem;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * GitHub GraphQL client that fetches one repository per call and classifies
 * every response into a {@link FetchOutcome}.
 *
 * <p>Quota signals from each response (the {@code x-ratelimit-*} headers, or the
 * query's {@code rateLimit} block when headers are absent) are reported to the
 * {@link CredentialPool}. Throttle responses put the credential into cooldown.</p>
 *
 * <p>Thread-safe: the underlying {@link OkHttpClient} and {@link ObjectMapper}
 * are both thread-safe, and this class holds no mutable per-request state.</p>
 */
public class GraphQlClient implements RepositoryFetcher {

    private static final Logger logger = LoggerFactory.getLogger(GraphQlClient.class);

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    /** Upper bound on a server-supplied {@code Retry-After}. */
    static final Duration MAX_RETRY_AFTER = Duration.ofHours(24);

    static final String REPOSITORY_QUERY = """
            query GetRepositoryMetadata($owner: String!, $name: String!) {
                repository(owner: $owner, name: $name) {
                    id
                    name
                    owner {
                        login
                    }
                    description
                    stargazerCount
                    forkCount
                    primaryLanguage {
                        name
                    }
                    createdAt
                    pushedAt
                    licenseInfo {
                        name
                    }
                    isArchived
                    isDisabled
                    isFork
                    url
                    repositoryTopics(first: 20) {
                        nodes {
                            topic {
                                name
                            }
                        }
                    }
                }
                rateLimit {
                    limit
                    cost
                    remaining
                    resetAt
                }
            }
            """;

    private final String apiUrl;
    private final CredentialPool pool;
    private final Duration defaultRetryAfter;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GraphQlClient(String apiUrl, CredentialPool pool, Duration defaultRetryAfter,
                         Duration fetchTimeout) {
        this(apiUrl, pool, defaultRetryAfter, defaultHttpClient(fetchTimeout), Clock.systemUTC());
    }

    public GraphQlClient(String apiUrl, CredentialPool pool, Duration defaultRetryAfter,
                         OkHttpClient httpClient, Clock clock) {
        this.apiUrl = apiUrl;
        this.pool = pool;
        this.defaultRetryAfter = defaultRetryAfter;
        this.httpClient = httpClient;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * The call timeout bounds the whole attempt (connect, write, read) so a
     * stalled response cannot hold a worker past it.
     */
    static OkHttpClient defaultHttpClient(Duration fetchTimeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(fetchTimeout)
                .callTimeout(fetchTimeout)
                .build();
    }

    // -------------------------------------------------------------------------
    // Fetch
    // -------------------------------------------------------------------------

    @Override
    public FetchOutcome fetch(WorkItem item, Credential credential) {
        Request request = buildRequest(item, credential);

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody != null ? responseBody.string() : "";
            logResponse(item, credential, response);
            return classify(credential, response, body);
        } catch (InterruptedIOException e) {
            logger.warn("Fetch of {} timed out with {}", item.fullName(), credential);
            return FetchOutcome.transientError("timeout: " + e.getMessage());
        } catch (IOException e) {
            logger.warn("Network error fetching {}: {}", item.fullName(), e.getMessage());
            return FetchOutcome.transientError("network error: " + e.getMessage());
        }
    }

    /**
     * Builds the GraphQL POST with bearer authentication.
     */
    Request buildRequest(WorkItem item, Credential credential) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("query", REPOSITORY_QUERY);
        ObjectNode variables = payload.putObject("variables");
        variables.put("owner", item.owner());
        variables.put("name", item.name());

        return new Request.Builder()
                .url(apiUrl)
                .header("Authorization", "Bearer " + credential.token())
                .header("Accept", "application/json")
                .header("User-Agent", "repo-harvest")
                .post(RequestBody.create(payload.toString(), JSON))
                .build();
    }

    // -------------------------------------------------------------------------
    // Classification
    // -------------------------------------------------------------------------

    FetchOutcome classify(Credential credential, Response response, String body) {
        int statusCode = response.code();
        RateLimitSnapshot headerSnapshot = parseRateLimitHeaders(response);

        if (statusCode == 429 || (statusCode == 403 && isThrottle(headerSnapshot, body))) {
            pool.report(credential, headerSnapshot);
            return throttled(credential, response, headerSnapshot, "HTTP " + statusCode);
        }
        if (statusCode == 401 || statusCode == 403) {
            return FetchOutcome.authFailed("HTTP " + statusCode);
        }
        if (statusCode == 404) {
            return FetchOutcome.notFound("HTTP 404");
        }
        if (statusCode >= 500) {
            pool.report(credential, headerSnapshot);
            return FetchOutcome.transientError("HTTP " + statusCode);
        }
        if (statusCode < 200 || statusCode >= 300) {
            return FetchOutcome.fatalError("unexpected HTTP " + statusCode);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return FetchOutcome.fatalError("unparseable response body: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return FetchOutcome.fatalError("response body is not a JSON object");
        }

        RateLimitSnapshot snapshot = headerSnapshot.orElse(
                parseRateLimitBlock(root.path("data").path("rateLimit")));
        pool.report(credential, snapshot);

        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            List<String> types = new ArrayList<>();
            List<String> messages = new ArrayList<>();
            for (JsonNode error : errors) {
                types.add(error.path("type").asText(""));
                messages.add(error.path("message").asText("Unknown error"));
            }
            String joined = String.join("; ", messages);
            if (types.contains("RATE_LIMITED")) {
                return throttled(credential, response, snapshot, "GraphQL RATE_LIMITED: " + joined);
            }
            if (types.contains("NOT_FOUND")) {
                return FetchOutcome.notFound(joined);
            }
            return FetchOutcome.fatalError("GraphQL API errors: " + joined);
        }

        JsonNode data = root.get("data");
        if (data == null || !data.isObject()) {
            return FetchOutcome.fatalError("response has no data object");
        }
        JsonNode repository = data.get("repository");
        if (repository == null || repository.isNull()) {
            return FetchOutcome.notFound("repository is null");
        }
        if (!repository.isObject()) {
            return FetchOutcome.fatalError("repository is not a JSON object");
        }
        return FetchOutcome.success(repository);
    }

    private FetchOutcome throttled(Credential credential, Response response,
                                   RateLimitSnapshot snapshot, String cause) {
        Duration retryAfter = retryAfter(response, snapshot);
        pool.throttle(credential, clock.instant().plus(retryAfter));
        return FetchOutcome.rateLimited(retryAfter, cause);
    }

    /**
     * GitHub answers primary and secondary rate limits with 403; tell those
     * apart from a bad credential.
     */
    static boolean isThrottle(RateLimitSnapshot snapshot, String body) {
        if (snapshot.remaining() != null && snapshot.remaining() == 0) {
            return true;
        }
        return body != null && body.toLowerCase(Locale.ROOT).contains("rate limit");
    }

    /**
     * Wait before the throttled credential may be used again: {@code Retry-After}
     * if present, else the time to the reported reset, else the configured default.
     */
    Duration retryAfter(Response response, RateLimitSnapshot snapshot) {
        String retryAfter = response.header("Retry-After");
        if (retryAfter != null) {
            Long seconds = parseLong(retryAfter);
            if (seconds != null && seconds >= 0) {
                return Duration.ofSeconds(Math.min(seconds, MAX_RETRY_AFTER.toSeconds()));
            }
        }
        if (snapshot.resetAt() != null) {
            Duration untilReset = Duration.between(clock.instant(), snapshot.resetAt());
            if (!untilReset.isNegative() && !untilReset.isZero()) {
                return untilReset;
            }
        }
        return defaultRetryAfter;
    }

    // -------------------------------------------------------------------------
    // Rate limit parsing
    // -------------------------------------------------------------------------

    /**
     * The query's {@code rateLimit} block. Other fields such as {@code cost} are ignored.
     */
    record RateLimitBlock(Integer limit, Integer remaining, Instant resetAt) {}

    /**
     * Values that are missing, malformed or out of range are left {@code null}.
     */
    static RateLimitSnapshot parseRateLimitHeaders(Response response) {
        return new RateLimitSnapshot(
                parseInt(response.header("X-RateLimit-Remaining")),
                parseInt(response.header("X-RateLimit-Limit")),
                parseEpochSecond(response.header("X-RateLimit-Reset")));
    }

    RateLimitSnapshot parseRateLimitBlock(JsonNode rateLimit) {
        if (rateLimit == null || !rateLimit.isObject()) {
            return RateLimitSnapshot.empty();
        }
        try {
            RateLimitBlock block = objectMapper.treeToValue(rateLimit, RateLimitBlock.class);
            return new RateLimitSnapshot(block.remaining(), block.limit(), block.resetAt());
        } catch (JsonProcessingException e) {
            logger.debug("Ignoring unreadable rateLimit block: {}", e.getOriginalMessage());
            return RateLimitSnapshot.empty();
        }
    }

    private static Integer parseInt(String value) {
        Long parsed = parseLong(value);
        if (parsed == null || parsed < Integer.MIN_VALUE || parsed > Integer.MAX_VALUE) {
            return null;
        }
        return parsed.intValue();
    }

    private static Instant parseEpochSecond(String value) {
        Long seconds = parseLong(value);
        if (seconds == null || seconds < Instant.MIN.getEpochSecond() || seconds > Instant.MAX.getEpochSecond()) {
            return null;
        }
        return Instant.ofEpochSecond(seconds);
    }

    private static Long parseLong(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // -------------------------------------------------------------------------
    // Logging
    // -------------------------------------------------------------------------

    private void logResponse(WorkItem item, Credential credential, Response response) {
        String remaining = response.header("X-RateLimit-Remaining");
        logger.info("GitHub GraphQL {} {} via {} | rate-limit-remaining: {}",
                response.code(), item.fullName(), credential,
                remaining != null ? remaining : "n/a");
    }
}
