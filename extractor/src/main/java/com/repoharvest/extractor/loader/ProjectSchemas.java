package com.repoharvest.extractor.loader;

import com.repoharvest.extractor.model.RepositoryRecord;

import java.sql.Types;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Table definitions and upsert statements for the {@code projects} and
 * {@code project_topics} tables.
 *
 * <p>Upserts use standard SQL {@code MERGE} with a typed {@code VALUES} source,
 * so one statement covers a whole batch.</p>
 */
public final class ProjectSchemas {

    private ProjectSchemas() {}

    // =========================================================================
    // Table names
    // =========================================================================

    public static final String TABLE_PROJECTS = "projects";
    public static final String TABLE_PROJECT_TOPICS = "project_topics";

    // =========================================================================
    // Columns
    // =========================================================================

    /**
     * One column of {@code projects}: its SQL type, JDBC type for nulls, and the
     * record accessor that supplies its value.
     */
    record Column(String name, String sqlType, int jdbcType, Function<RepositoryRecord, Object> value) {}

    static final String KEY_COLUMN = "id";

    static final List<Column> PROJECT_COLUMNS = List.of(
            new Column("id", "VARCHAR(255)", Types.VARCHAR, RepositoryRecord::id),
            new Column("name", "VARCHAR(255)", Types.VARCHAR, RepositoryRecord::name),
            new Column("owner_login", "VARCHAR(255)", Types.VARCHAR, RepositoryRecord::ownerLogin),
            new Column("description", "VARCHAR", Types.VARCHAR, RepositoryRecord::description),
            new Column("stargazer_count", "INTEGER", Types.INTEGER, RepositoryRecord::stargazerCount),
            new Column("fork_count", "INTEGER", Types.INTEGER, RepositoryRecord::forkCount),
            new Column("primary_language", "VARCHAR(100)", Types.VARCHAR, RepositoryRecord::primaryLanguage),
            new Column("created_at", "TIMESTAMP WITH TIME ZONE", Types.TIMESTAMP_WITH_TIMEZONE,
                    RepositoryRecord::createdAt),
            new Column("pushed_at", "TIMESTAMP WITH TIME ZONE", Types.TIMESTAMP_WITH_TIMEZONE,
                    RepositoryRecord::pushedAt),
            new Column("license_name", "VARCHAR(255)", Types.VARCHAR, RepositoryRecord::licenseName),
            new Column("is_archived", "BOOLEAN", Types.BOOLEAN, RepositoryRecord::archived),
            new Column("is_disabled", "BOOLEAN", Types.BOOLEAN, RepositoryRecord::disabled),
            new Column("is_fork", "BOOLEAN", Types.BOOLEAN, RepositoryRecord::fork),
            new Column("url", "VARCHAR", Types.VARCHAR, RepositoryRecord::url),
            new Column("last_extracted_at", "TIMESTAMP WITH TIME ZONE", Types.TIMESTAMP_WITH_TIMEZONE,
                    RepositoryRecord::lastExtractedAt)
    );

    // =========================================================================
    // DDL
    // =========================================================================

    static final List<String> CREATE_TABLE_STATEMENTS = List.of(
            """
            CREATE TABLE IF NOT EXISTS projects (
                id VARCHAR(255) PRIMARY KEY,
                name VARCHAR(255) NOT NULL,
                owner_login VARCHAR(255) NOT NULL,
                description VARCHAR,
                stargazer_count INTEGER,
                fork_count INTEGER,
                primary_language VARCHAR(100),
                created_at TIMESTAMP WITH TIME ZONE,
                pushed_at TIMESTAMP WITH TIME ZONE,
                license_name VARCHAR(255),
                is_archived BOOLEAN,
                is_disabled BOOLEAN,
                is_fork BOOLEAN,
                url VARCHAR,
                last_extracted_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS project_topics (
                project_id VARCHAR(255) NOT NULL REFERENCES projects(id) ON DELETE CASCADE,
                topic VARCHAR(255) NOT NULL,
                PRIMARY KEY (project_id, topic)
            )
            """
    );

    // =========================================================================
    // Upsert statements
    // =========================================================================

    /**
     * MERGE for {@code rowCount} projects: inserts unknown ids, updates every
     * non-key column of known ids.
     */
    static String projectsUpsertSql(int rowCount) {
        String placeholders = PROJECT_COLUMNS.stream()
                .map(column -> "CAST(? AS " + column.sqlType() + ")")
                .collect(Collectors.joining(", ", "(", ")"));
        String columnNames = PROJECT_COLUMNS.stream()
                .map(Column::name)
                .collect(Collectors.joining(", "));
        String updates = PROJECT_COLUMNS.stream()
                .filter(column -> !column.name().equals(KEY_COLUMN))
                .map(column -> column.name() + " = s." + column.name())
                .collect(Collectors.joining(", "));
        String sourceValues = PROJECT_COLUMNS.stream()
                .map(column -> "s." + column.name())
                .collect(Collectors.joining(", "));

        return "MERGE INTO " + TABLE_PROJECTS + " AS t "
                + "USING (VALUES " + repeat(placeholders, rowCount) + ") AS s (" + columnNames + ") "
                + "ON t." + KEY_COLUMN + " = s." + KEY_COLUMN + " "
                + "WHEN MATCHED THEN UPDATE SET " + updates + " "
                + "WHEN NOT MATCHED THEN INSERT (" + columnNames + ") VALUES (" + sourceValues + ")";
    }

    /**
     * MERGE for {@code rowCount} (project_id, topic) pairs; existing pairs are left alone.
     */
    static String topicsUpsertSql(int rowCount) {
        String placeholders = "(CAST(? AS VARCHAR(255)), CAST(? AS VARCHAR(255)))";
        return "MERGE INTO " + TABLE_PROJECT_TOPICS + " AS t "
                + "USING (VALUES " + repeat(placeholders, rowCount) + ") AS s (project_id, topic) "
                + "ON t.project_id = s.project_id AND t.topic = s.topic "
                + "WHEN NOT MATCHED THEN INSERT (project_id, topic) VALUES (s.project_id, s.topic)";
    }

    private static String repeat(String tuple, int count) {
        return String.join(", ", Collections.nCopies(count, tuple));
    }
}
