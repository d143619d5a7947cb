package com.repoharvest.extractor.loader;

import com.repoharvest.extractor.concurrent.Sleeper;
import com.repoharvest.extractor.config.LoaderSettings;
import com.repoharvest.extractor.model.RepositoryRecord;
import com.repoharvest.extractor.model.WorkItem;
import org.postgresql.ds.PGSimpleDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Relational writer responsible for loading normalized repositories into the
 * {@code projects} and {@code project_topics} tables. Handles schema creation,
 * batching, idempotent upserts, and batch-level retries on transient store errors.
 *
 * <p>Thread-safe: adding and flushing are serialized on one lock around the
 * batch buffer, so a flush triggered by one worker never interleaves with
 * another worker's add.</p>
 */
public class BatchLoader {

    private static final Logger logger = LoggerFactory.getLogger(BatchLoader.class);

    private final DataSource dataSource;
    private final LoaderSettings settings;
    private final Sleeper sleeper;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    // guarded by lock
    private final List<PendingRow> batch = new ArrayList<>();
    private Instant batchStartedAt;

    private record PendingRow(WorkItem item, RepositoryRecord record) {}

    /**
     * Production constructor. Connects to PostgreSQL with the given parameters.
     */
    public BatchLoader(String host, int port, String database, String user, String password,
                       LoaderSettings settings) {
        this(postgresDataSource(host, port, database, user, password, settings), settings,
                Sleeper.threadSleeper(), Clock.systemUTC());
        logger.info("BatchLoader initialized for {}@{}:{}/{}", user, host, port, database);
    }

    /**
     * Test constructor. Accepts any {@link DataSource}.
     */
    public BatchLoader(DataSource dataSource, LoaderSettings settings, Sleeper sleeper, Clock clock) {
        this.dataSource = dataSource;
        this.settings = settings;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Connect and socket timeouts are whole seconds; a zero timeout means none.
     */
    static PGSimpleDataSource postgresDataSource(String host, int port, String database,
                                                 String user, String password, LoaderSettings settings) {
        PGSimpleDataSource source = new PGSimpleDataSource();
        source.setServerNames(new String[] {host});
        source.setPortNumbers(new int[] {port});
        source.setDatabaseName(database);
        source.setUser(user);
        source.setPassword(password);
        source.setApplicationName("repo-harvest");
        source.setConnectTimeout(Math.toIntExact(settings.connectTimeout().toSeconds()));
        source.setSocketTimeout(Math.toIntExact(settings.socketTimeout().toSeconds()));
        return source;
    }

    // =========================================================================
    // Schema management
    // =========================================================================

    /**
     * Creates the target tables if they don't already exist. Safe to run on
     * every start.
     */
    public void ensureSchema() throws SQLException {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            for (String ddl : ProjectSchemas.CREATE_TABLE_STATEMENTS) {
                statement.execute(ddl);
            }
        }
        logger.info("All necessary tables ensured to exist.");
    }

    // =========================================================================
    // Batching
    // =========================================================================

    /**
     * Appends a record to the current batch and flushes it when it is full or
     * too old.
     *
     * @return the flush result if this call flushed the batch
     */
    public FlushResult add(WorkItem item, RepositoryRecord record) {
        lock.lock();
        try {
            if (batch.isEmpty()) {
                batchStartedAt = clock.instant();
            }
            batch.add(new PendingRow(item, record));

            boolean full = batch.size() >= settings.batchSize();
            boolean stale = Duration.between(batchStartedAt, clock.instant())
                    .compareTo(settings.maxBatchAge()) >= 0;
            if (full || stale) {
                return flushLocked();
            }
            return FlushResult.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes the current batch, if any. Never throws for store errors; a batch
     * that could not be written is returned as failed and dropped.
     */
    public FlushResult flush() {
        lock.lock();
        try {
            return flushLocked();
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return batch.size();
        } finally {
            lock.unlock();
        }
    }

    private FlushResult flushLocked() {
        if (batch.isEmpty()) {
            return FlushResult.empty();
        }
        List<PendingRow> rows = new ArrayList<>(batch);
        batch.clear();
        batchStartedAt = null;

        List<WorkItem> items = rows.stream().map(PendingRow::item).toList();
        List<RepositoryRecord> records = latestPerKey(rows);

        SQLException lastError = null;
        Duration delay = settings.flushRetryDelay();
        for (int attempt = 1; attempt <= settings.flushAttempts(); attempt++) {
            try {
                int written = upsert(records);
                logger.info("Successfully loaded/updated {} project records ({} work items, attempt {})",
                        written, items.size(), attempt);
                return FlushResult.committed(items, written, attempt);
            } catch (SQLException e) {
                lastError = e;
                if (!isTransient(e)) {
                    logger.error("Error loading project data batch of {} records, not retrying",
                            records.size(), e);
                    return FlushResult.failed(items, attempt, describe(e));
                }
                if (attempt < settings.flushAttempts()) {
                    logger.warn("Transient store error on batch of {} records (attempt {}/{}): {}. "
                                    + "Retrying in {}ms", records.size(), attempt,
                            settings.flushAttempts(), e.getMessage(), delay.toMillis());
                    if (!sleeper.sleep(delay)) {
                        return FlushResult.failed(items, attempt, "interrupted: " + describe(e));
                    }
                    delay = delay.multipliedBy(2);
                }
            }
        }

        logger.error("Giving up on batch of {} records after {} attempts",
                records.size(), settings.flushAttempts(), lastError);
        return FlushResult.failed(items, settings.flushAttempts(), describe(lastError));
    }

    /**
     * Collapses records sharing a repository id to the last one added; a MERGE
     * source must not match the same target row twice.
     */
    private static List<RepositoryRecord> latestPerKey(List<PendingRow> rows) {
        Map<String, RepositoryRecord> byId = new LinkedHashMap<>();
        for (PendingRow row : rows) {
            byId.remove(row.record().id());
            byId.put(row.record().id(), row.record());
        }
        return new ArrayList<>(byId.values());
    }

    // =========================================================================
    // Upsert
    // =========================================================================

    /**
     * Upserts projects and their topics in one transaction.
     *
     * @return number of project rows written
     */
    int upsert(List<RepositoryRecord> records) throws SQLException {
        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try {
                int written = upsertProjects(connection, records);
                upsertTopics(connection, records);
                connection.commit();
                return written;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(connection, e);
                throw e;
            }
        }
    }

    private int upsertProjects(Connection connection, List<RepositoryRecord> records) throws SQLException {
        String sql = ProjectSchemas.projectsUpsertSql(records.size());
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            int index = 1;
            for (RepositoryRecord record : records) {
                for (ProjectSchemas.Column column : ProjectSchemas.PROJECT_COLUMNS) {
                    bind(statement, index++, column.value().apply(record), column.jdbcType());
                }
            }
            statement.executeUpdate();
            return records.size();
        }
    }

    private void upsertTopics(Connection connection, List<RepositoryRecord> records) throws SQLException {
        List<String[]> pairs = new ArrayList<>();
        for (RepositoryRecord record : records) {
            for (String topic : record.topics()) {
                pairs.add(new String[] {record.id(), topic});
            }
        }
        if (pairs.isEmpty()) {
            return;
        }
        try (PreparedStatement statement = connection.prepareStatement(
                ProjectSchemas.topicsUpsertSql(pairs.size()))) {
            int index = 1;
            for (String[] pair : pairs) {
                statement.setString(index++, pair[0]);
                statement.setString(index++, pair[1]);
            }
            statement.executeUpdate();
        }
    }

    private static void bind(PreparedStatement statement, int index, Object value, int jdbcType)
            throws SQLException {
        if (value == null) {
            statement.setNull(index, jdbcType);
        } else {
            statement.setObject(index, value);
        }
    }

    private static void rollbackQuietly(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }

    // =========================================================================
    // Error classification
    // =========================================================================

    /**
     * Connection failures (SQLState class 08), transaction rollbacks such as
     * serialization failures and deadlocks (40), insufficient resources (53) and
     * operator intervention (57) are worth retrying; everything else is not.
     */
    static boolean isTransient(SQLException e) {
        if (e instanceof SQLTransientException || e instanceof SQLRecoverableException) {
            return true;
        }
        String state = e.getSQLState();
        if (state == null || state.length() < 2) {
            return false;
        }
        String stateClass = state.substring(0, 2);
        return stateClass.equals("08") || stateClass.equals("40")
                || stateClass.equals("53") || stateClass.equals("57");
    }

    private static String describe(SQLException e) {
        if (e == null) {
            return "unknown store error";
        }
        return e.getSQLState() != null
                ? "SQLState " + e.getSQLState() + ": " + e.getMessage()
                : e.getMessage();
    }
}
