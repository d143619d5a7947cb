package com.repoharvest.extractor.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Configuration management class that reads environment variables
 * and .env file settings using dotenv-java. Validates required
 * variables on startup and exposes the pipeline tunables with their defaults.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    static final String DEFAULT_API_URL = "https://api.github.com/graphql";

    private final List<String> githubTokens;
    private final String graphqlApiUrl;
    private final String dbHost;
    private final int dbPort;
    private final String dbName;
    private final String dbUser;
    private final String dbPassword;
    private final String failureLogFile;
    private final String reposCsv;
    private final RetrySettings retrySettings;
    private final LoaderSettings loaderSettings;
    private final ExtractionSettings extractionSettings;

    public AppConfig() {
        this(dotenvLookup(Dotenv.configure()
                .ignoreIfMissing()
                .load()));

        logger.info("Configuration loaded: {} token(s), database {}@{}:{}/{}",
                githubTokens.size(), dbUser, dbHost, dbPort, dbName);
    }

    /**
     * Constructor for testing. Resolves every key from the given map.
     */
    public AppConfig(Map<String, String> values) {
        this(values::get);
    }

    private AppConfig(Function<String, String> lookup) {
        this.githubTokens = parseTokens(lookup.apply("GITHUB_APP_INSTALLATION_TOKENS"));
        this.graphqlApiUrl = orDefault(lookup.apply("GITHUB_GRAPHQL_API_URL"), DEFAULT_API_URL);
        this.dbHost = lookup.apply("DB_HOST");
        this.dbName = lookup.apply("DB_NAME");
        this.dbUser = lookup.apply("DB_USER");
        this.dbPassword = orDefault(lookup.apply("DB_PASSWORD"), "");

        validate();

        this.dbPort = intValue(lookup, "DB_PORT", 5432);
        this.failureLogFile = orDefault(lookup.apply("FAILURE_LOG_FILE"), "pipeline_failures.log");
        this.reposCsv = orDefault(lookup.apply("REPOS_CSV"), "repos.csv");

        RetrySettings retryDefaults = RetrySettings.defaults();
        this.retrySettings = new RetrySettings(
                intValue(lookup, "RETRY_MAX_ATTEMPTS", retryDefaults.maxAttempts()),
                Duration.ofMillis(longValue(lookup, "RETRY_BASE_DELAY_MS",
                        retryDefaults.baseDelay().toMillis())),
                Duration.ofMillis(longValue(lookup, "RETRY_MAX_DELAY_MS",
                        retryDefaults.maxDelay().toMillis())),
                Duration.ofMillis(longValue(lookup, "MAX_BLOCKED_WAIT_MS",
                        retryDefaults.maxBlockedWait().toMillis())),
                Duration.ofSeconds(longValue(lookup, "RATE_LIMIT_DEFAULT_RETRY_AFTER_SECONDS",
                        retryDefaults.defaultRetryAfter().toSeconds())),
                retryDefaults.jitterRatio());

        this.loaderSettings = loaderSettings(lookup);

        ExtractionSettings extractionDefaults = ExtractionSettings.defaults();
        this.extractionSettings = new ExtractionSettings(
                intValue(lookup, "EXTRACT_CONCURRENCY", extractionDefaults.concurrency()),
                intValue(lookup, "WORKERS_PER_CREDENTIAL", extractionDefaults.workersPerCredential()),
                Duration.ofSeconds(longValue(lookup, "FETCH_TIMEOUT_SECONDS",
                        extractionDefaults.fetchTimeout().toSeconds())));
    }

    private static LoaderSettings loaderSettings(Function<String, String> lookup) {
        LoaderSettings defaults = LoaderSettings.defaults();
        try {
            return new LoaderSettings(
                    intValue(lookup, "BATCH_SIZE", defaults.batchSize()),
                    Duration.ofSeconds(longValue(lookup, "BATCH_MAX_AGE_SECONDS",
                            defaults.maxBatchAge().toSeconds())),
                    intValue(lookup, "STORE_FLUSH_ATTEMPTS", defaults.flushAttempts()),
                    Duration.ofMillis(longValue(lookup, "STORE_RETRY_DELAY_MS",
                            defaults.flushRetryDelay().toMillis())),
                    Duration.ofSeconds(longValue(lookup, "DB_CONNECT_TIMEOUT_SECONDS",
                            defaults.connectTimeout().toSeconds())),
                    Duration.ofSeconds(longValue(lookup, "DB_SOCKET_TIMEOUT_SECONDS",
                            defaults.socketTimeout().toSeconds())));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid store settings: " + e.getMessage(), e);
        }
    }

    private void validate() {
        StringBuilder missing = new StringBuilder();
        if (githubTokens.isEmpty()) missing.append("GITHUB_APP_INSTALLATION_TOKENS ");
        if (isBlank(dbHost)) missing.append("DB_HOST ");
        if (isBlank(dbName)) missing.append("DB_NAME ");
        if (isBlank(dbUser)) missing.append("DB_USER ");

        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                    "Missing required environment variables: " + missing.toString().trim());
        }
    }

    private static Function<String, String> dotenvLookup(Dotenv dotenv) {
        return key -> {
            String envValue = System.getenv(key);
            if (envValue != null && !envValue.isBlank()) {
                return envValue;
            }
            return dotenv.get(key);
        };
    }

    static List<String> parseTokens(String raw) {
        if (isBlank(raw)) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .toList();
    }

    private static int intValue(Function<String, String> lookup, String key, int defaultValue) {
        return Math.toIntExact(longValue(lookup, key, defaultValue));
    }

    private static long longValue(Function<String, String> lookup, String key, long defaultValue) {
        String value = lookup.apply(key);
        if (isBlank(value)) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Environment variable " + key
                    + " must be a whole number, got: " + value, e);
        }
    }

    private static String orDefault(String value, String defaultValue) {
        return isBlank(value) ? defaultValue : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public List<String> getGithubTokens() {
        return githubTokens;
    }

    public String getGraphqlApiUrl() {
        return graphqlApiUrl;
    }

    public String getDbHost() {
        return dbHost;
    }

    public int getDbPort() {
        return dbPort;
    }

    public String getDbName() {
        return dbName;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    public String getFailureLogFile() {
        return failureLogFile;
    }

    public String getReposCsv() {
        return reposCsv;
    }

    public RetrySettings getRetrySettings() {
        return retrySettings;
    }

    public LoaderSettings getLoaderSettings() {
        return loaderSettings;
    }

    public ExtractionSettings getExtractionSettings() {
        return extractionSettings;
    }
}
