package com.codesurvey.core.store;

import com.codesurvey.core.analyzer.Feature;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link CompletionStore} backed by an SQLite database accessed over JDBC.
 *
 * <p>Three tables hold the records:
 * <ul>
 *   <li>{@code repo_metadata}: one JSON value per (source, repo, metadata key)</li>
 *   <li>{@code repo_feature}: repository-level aggregates per (source, repo, analyzer, feature),
 *       plus the {@code archived_*} counts folded in from deleted unit results</li>
 *   <li>{@code code_feature}: unit-level results per (source, repo, analyzer, code, feature);
 *       a {@code NULL} occurrence count marks a skipped unit and a {@code NULL} occurrence
 *       payload marks occurrences that were not persisted</li>
 * </ul>
 *
 * <p>Every write runs in its own transaction while holding the connection's monitor.
 */
public class SqliteCompletionStore implements CompletionStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteCompletionStore.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final TypeReference<List<Map<String, Object>>> OCCURRENCES_TYPE = new TypeReference<>() {};

    private static final List<String> SCHEMA = List.of(
        """
        CREATE TABLE IF NOT EXISTS repo_metadata (
            source_name TEXT NOT NULL,
            repo_key TEXT NOT NULL,
            metadata_key TEXT NOT NULL,
            updated INTEGER NOT NULL,
            metadata_value TEXT,
            PRIMARY KEY (source_name, repo_key, metadata_key)
        )""",
        """
        CREATE TABLE IF NOT EXISTS repo_feature (
            source_name TEXT NOT NULL,
            repo_key TEXT NOT NULL,
            analyzer_name TEXT NOT NULL,
            feature_name TEXT NOT NULL,
            updated INTEGER NOT NULL,
            occurrence_count INTEGER NOT NULL,
            code_occurrence_count INTEGER NOT NULL,
            code_total_count INTEGER NOT NULL,
            archived_occurrence_count INTEGER NOT NULL DEFAULT 0,
            archived_code_occurrence_count INTEGER NOT NULL DEFAULT 0,
            archived_code_total_count INTEGER NOT NULL DEFAULT 0,
            PRIMARY KEY (source_name, repo_key, analyzer_name, feature_name)
        )""",
        """
        CREATE TABLE IF NOT EXISTS code_feature (
            source_name TEXT NOT NULL,
            repo_key TEXT NOT NULL,
            analyzer_name TEXT NOT NULL,
            code_key TEXT NOT NULL,
            feature_name TEXT NOT NULL,
            updated INTEGER NOT NULL,
            occurrence_count INTEGER,
            occurrences TEXT,
            PRIMARY KEY (source_name, repo_key, analyzer_name, code_key, feature_name)
        )"""
    );

    private static final String UPSERT_CODE_FEATURE = """
        INSERT INTO code_feature
            (source_name, repo_key, analyzer_name, code_key, feature_name, updated, occurrence_count, occurrences)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (source_name, repo_key, analyzer_name, code_key, feature_name) DO UPDATE SET
            updated = excluded.updated,
            occurrence_count = excluded.occurrence_count,
            occurrences = excluded.occurrences""";

    private static final String UPSERT_REPO_METADATA = """
        INSERT INTO repo_metadata (source_name, repo_key, metadata_key, updated, metadata_value)
        VALUES (?, ?, ?, ?, ?)
        ON CONFLICT (source_name, repo_key, metadata_key) DO UPDATE SET
            updated = excluded.updated,
            metadata_value = excluded.metadata_value""";

    private static final String AGGREGATE_REPO_FEATURES = """
        INSERT INTO repo_feature
            (source_name, repo_key, analyzer_name, feature_name, updated,
             occurrence_count, code_occurrence_count, code_total_count)
        SELECT source_name, repo_key, analyzer_name, feature_name, MAX(updated),
               COALESCE(SUM(occurrence_count), 0),
               SUM(CASE WHEN occurrence_count >= 1 THEN 1 ELSE 0 END),
               COUNT(occurrence_count)
        FROM code_feature
        WHERE source_name = ? AND repo_key = ?
        GROUP BY source_name, repo_key, analyzer_name, feature_name
        ON CONFLICT (source_name, repo_key, analyzer_name, feature_name) DO UPDATE SET
            updated = MAX(repo_feature.updated, excluded.updated),
            occurrence_count = repo_feature.archived_occurrence_count + excluded.occurrence_count,
            code_occurrence_count = repo_feature.archived_code_occurrence_count + excluded.code_occurrence_count,
            code_total_count = repo_feature.archived_code_total_count + excluded.code_total_count""";

    private static final String ARCHIVE_REPO_FEATURES = """
        UPDATE repo_feature SET
            archived_occurrence_count = occurrence_count,
            archived_code_occurrence_count = code_occurrence_count,
            archived_code_total_count = code_total_count
        WHERE source_name = ? AND repo_key = ?""";

    private final Connection connection;
    private final boolean ownsConnection;
    private final Clock clock;
    private boolean closed;

    /**
     * Wraps an open SQLite connection, creating the tables if needed.
     *
     * @param connection JDBC connection to an SQLite database
     * @param ownsConnection whether {@link #close()} closes the connection
     * @param clock source of record update times
     */
    public SqliteCompletionStore(Connection connection, boolean ownsConnection, Clock clock) {
        this.connection = connection;
        this.ownsConnection = ownsConnection;
        this.clock = clock;
        createSchema();
    }

    /**
     * Creates a factory opening a new connection to a database file for every store.
     *
     * @param databasePath SQLite database file, created if missing
     * @return store factory
     */
    public static CompletionStoreFactory fileFactory(Path databasePath) {
        return fileFactory(databasePath, Clock.systemUTC());
    }

    public static CompletionStoreFactory fileFactory(Path databasePath, Clock clock) {
        String url = "jdbc:sqlite:" + databasePath.toAbsolutePath();
        return () -> new SqliteCompletionStore(connect(url), true, clock);
    }

    /**
     * Creates a factory whose stores share one in-memory database that lives until the
     * factory is closed.
     *
     * @return store factory
     */
    public static CompletionStoreFactory inMemoryFactory() {
        return inMemoryFactory(Clock.systemUTC());
    }

    public static CompletionStoreFactory inMemoryFactory(Clock clock) {
        return new InMemoryFactory(clock);
    }

    private static Connection connect(String url) {
        try {
            return DriverManager.getConnection(url);
        } catch (SQLException e) {
            throw new StoreException("Failed to open database " + url, e);
        }
    }

    private void createSchema() {
        inTransaction(() -> {
            try (Statement statement = connection.createStatement()) {
                for (String ddl : SCHEMA) {
                    statement.execute(ddl);
                }
            }
        }, "create schema");
    }

    @Override
    public Map<String, List<String>> outstandingFeatures(String source, String repoKey,
                                                         Map<String, List<String>> requested) {
        Map<String, List<String>> outstanding = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : requested.entrySet()) {
            Set<String> recorded = selectNames("""
                SELECT feature_name FROM repo_feature
                WHERE source_name = ? AND repo_key = ? AND analyzer_name = ?""",
                source, repoKey, entry.getKey());
            List<String> remaining = entry.getValue().stream().filter(name -> !recorded.contains(name)).toList();
            if (!remaining.isEmpty()) {
                outstanding.put(entry.getKey(), remaining);
            }
        }
        return outstanding;
    }

    @Override
    public List<String> outstandingUnitFeatures(String source, String repoKey, String analyzer, String codeKey,
                                                List<String> requested) {
        Set<String> recorded = selectNames("""
            SELECT feature_name FROM code_feature
            WHERE source_name = ? AND repo_key = ? AND analyzer_name = ? AND code_key = ?""",
            source, repoKey, analyzer, codeKey);
        return requested.stream().filter(name -> !recorded.contains(name)).toList();
    }

    @Override
    public void recordUnitResult(String source, String repoKey, String analyzer, String codeKey,
                                 Map<String, Feature> features, boolean persistOccurrences) {
        long now = clock.millis();
        inTransaction(() -> {
            try (PreparedStatement statement = connection.prepareStatement(UPSERT_CODE_FEATURE)) {
                for (Map.Entry<String, Feature> entry : features.entrySet()) {
                    Feature feature = entry.getValue();
                    statement.setString(1, source);
                    statement.setString(2, repoKey);
                    statement.setString(3, analyzer);
                    statement.setString(4, codeKey);
                    statement.setString(5, entry.getKey());
                    statement.setLong(6, now);
                    if (feature.isSkipped()) {
                        statement.setNull(7, Types.INTEGER);
                    } else {
                        statement.setInt(7, feature.occurrenceCount());
                    }
                    if (feature.isSkipped() || !persistOccurrences) {
                        statement.setNull(8, Types.VARCHAR);
                    } else {
                        statement.setString(8, toJson(feature.occurrences()));
                    }
                    statement.addBatch();
                }
                statement.executeBatch();
            }
        }, "record results of " + source + ":" + repoKey + ":" + analyzer + ":" + codeKey);
    }

    @Override
    public void recordRepoMetadata(String source, String repoKey, Map<String, Object> metadata) {
        if (metadata.isEmpty()) {
            return;
        }
        long now = clock.millis();
        inTransaction(() -> {
            try (PreparedStatement statement = connection.prepareStatement(UPSERT_REPO_METADATA)) {
                for (Map.Entry<String, Object> entry : metadata.entrySet()) {
                    statement.setString(1, source);
                    statement.setString(2, repoKey);
                    statement.setString(3, entry.getKey());
                    statement.setLong(4, now);
                    statement.setString(5, toJson(entry.getValue()));
                    statement.addBatch();
                }
                statement.executeBatch();
            }
        }, "record metadata of " + source + ":" + repoKey);
    }

    @Override
    public void aggregateAndPersist(String source, String repoKey, boolean deleteUnitRecords) {
        inTransaction(() -> {
            int aggregated = update(AGGREGATE_REPO_FEATURES, source, repoKey);
            log.debug("Aggregated {} features of repo {}:{}", aggregated, source, repoKey);
            if (deleteUnitRecords) {
                update(ARCHIVE_REPO_FEATURES, source, repoKey);
                update("DELETE FROM code_feature WHERE source_name = ? AND repo_key = ?", source, repoKey);
            }
        }, "aggregate results of " + source + ":" + repoKey);
    }

    @Override
    public void discardRepoResults(String source, String repoKey, Map<String, List<String>> features) {
        inTransaction(() -> {
            for (Map.Entry<String, List<String>> entry : features.entrySet()) {
                for (String feature : entry.getValue()) {
                    for (String table : List.of("code_feature", "repo_feature")) {
                        update("DELETE FROM " + table
                                + " WHERE source_name = ? AND repo_key = ? AND analyzer_name = ? AND feature_name = ?",
                            source, repoKey, entry.getKey(), feature);
                    }
                }
            }
        }, "discard results of " + source + ":" + repoKey);
    }

    @Override
    public List<RepoFeature> queryRepoAggregates(FeatureQuery query) {
        Filter filter = new Filter(query, "analyzer_name", "feature_name");
        String sql = """
            SELECT source_name, repo_key, analyzer_name, feature_name, updated,
                   occurrence_count, code_occurrence_count, code_total_count
            FROM repo_feature""" + filter.whereClause()
            + " ORDER BY source_name, repo_key, analyzer_name, feature_name";

        synchronized (connection) {
            Map<String, Map<String, Object>> metadataCache = new HashMap<>();
            List<RepoFeature> results = new ArrayList<>();
            try (PreparedStatement statement = filter.prepare(connection, sql);
                 ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    String source = rs.getString("source_name");
                    String repoKey = rs.getString("repo_key");
                    results.add(new RepoFeature(
                        source,
                        repoKey,
                        rs.getString("analyzer_name"),
                        rs.getString("feature_name"),
                        Instant.ofEpochMilli(rs.getLong("updated")),
                        rs.getLong("occurrence_count"),
                        rs.getLong("code_occurrence_count"),
                        rs.getLong("code_total_count"),
                        metadataCache.computeIfAbsent(source + "\u0000" + repoKey, k -> repoMetadata(source, repoKey))
                    ));
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to query repo features", e);
            }
            return results;
        }
    }

    @Override
    public List<CodeFeature> queryUnitResults(FeatureQuery query) {
        Filter filter = new Filter(query, "analyzer_name", "feature_name");
        String sql = """
            SELECT source_name, repo_key, analyzer_name, code_key, feature_name, updated,
                   occurrence_count, occurrences
            FROM code_feature""" + filter.whereClause()
            + " ORDER BY source_name, repo_key, analyzer_name, code_key, feature_name";

        synchronized (connection) {
            Map<String, Map<String, Object>> metadataCache = new HashMap<>();
            List<CodeFeature> results = new ArrayList<>();
            try (PreparedStatement statement = filter.prepare(connection, sql);
                 ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    String source = rs.getString("source_name");
                    String repoKey = rs.getString("repo_key");
                    int count = rs.getInt("occurrence_count");
                    Integer occurrenceCount = rs.wasNull() ? null : count;
                    String occurrences = rs.getString("occurrences");
                    results.add(new CodeFeature(
                        source,
                        repoKey,
                        rs.getString("analyzer_name"),
                        rs.getString("code_key"),
                        rs.getString("feature_name"),
                        Instant.ofEpochMilli(rs.getLong("updated")),
                        occurrenceCount,
                        occurrences == null ? null : fromJson(occurrences, OCCURRENCES_TYPE),
                        metadataCache.computeIfAbsent(source + "\u0000" + repoKey, k -> repoMetadata(source, repoKey))
                    ));
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to query code features", e);
            }
            return results;
        }
    }

    private Map<String, Object> repoMetadata(String source, String repoKey) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        try (PreparedStatement statement = connection.prepareStatement("""
                SELECT metadata_key, metadata_value FROM repo_metadata
                WHERE source_name = ? AND repo_key = ? ORDER BY metadata_key""")) {
            statement.setString(1, source);
            statement.setString(2, repoKey);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    String value = rs.getString("metadata_value");
                    metadata.put(rs.getString("metadata_key"), value == null ? null : fromJson(value, Object.class));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to query metadata of " + source + ":" + repoKey, e);
        }
        return metadata;
    }

    @Override
    public void close() {
        synchronized (connection) {
            if (closed) {
                return;
            }
            closed = true;
            if (ownsConnection) {
                try {
                    connection.close();
                } catch (SQLException e) {
                    throw new StoreException("Failed to close database connection", e);
                }
            }
        }
    }

    @FunctionalInterface
    private interface SqlWork {
        void run() throws SQLException;
    }

    private void inTransaction(SqlWork work, String description) {
        synchronized (connection) {
            try {
                connection.setAutoCommit(false);
                try {
                    work.run();
                    connection.commit();
                } catch (SQLException | RuntimeException e) {
                    connection.rollback();
                    throw e;
                } finally {
                    connection.setAutoCommit(true);
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to " + description, e);
            }
        }
    }

    private Set<String> selectNames(String sql, String... params) {
        synchronized (connection) {
            Set<String> names = new HashSet<>();
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                for (int i = 0; i < params.length; i++) {
                    statement.setString(i + 1, params[i]);
                }
                try (ResultSet rs = statement.executeQuery()) {
                    while (rs.next()) {
                        names.add(rs.getString(1));
                    }
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to query recorded features", e);
            }
            return names;
        }
    }

    private int update(String sql, String... params) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                statement.setString(i + 1, params[i]);
            }
            return statement.executeUpdate();
        }
    }

    private static String toJson(Object value) {
        try {
            return JSON_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable as JSON: " + value, e);
        }
    }

    private static <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return JSON_MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Stored value is not valid JSON: " + json, e);
        }
    }

    private static <T> T fromJson(String json, Class<T> type) {
        try {
            return JSON_MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Stored value is not valid JSON: " + json, e);
        }
    }

    /**
     * WHERE clause built from a {@link FeatureQuery}.
     */
    private static final class Filter {
        private final List<String> conditions = new ArrayList<>();
        private final List<String> params = new ArrayList<>();

        Filter(FeatureQuery query, String analyzerColumn, String featureColumn) {
            add("source_name", query.sources());
            add("repo_key", query.repoKeys());
            add(analyzerColumn, query.analyzers());
            add(featureColumn, query.features());
        }

        private void add(String column, List<String> values) {
            if (values == null) {
                return;
            }
            if (values.isEmpty()) {
                conditions.add("0 = 1");
                return;
            }
            conditions.add(column + " IN (" + String.join(", ", values.stream().map(v -> "?").toList()) + ")");
            params.addAll(values);
        }

        String whereClause() {
            return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
        }

        PreparedStatement prepare(Connection connection, String sql) throws SQLException {
            PreparedStatement statement = connection.prepareStatement(sql);
            for (int i = 0; i < params.size(); i++) {
                statement.setString(i + 1, params.get(i));
            }
            return statement;
        }
    }

    /**
     * Keeps a private in-memory database alive through one shared connection.
     */
    private static final class InMemoryFactory implements CompletionStoreFactory {
        private final Clock clock;
        private Connection connection;

        InMemoryFactory(Clock clock) {
            this.clock = clock;
        }

        @Override
        public synchronized CompletionStore open() {
            if (connection == null) {
                connection = connect("jdbc:sqlite::memory:");
            }
            return new SqliteCompletionStore(connection, false, clock);
        }

        @Override
        public synchronized void close() {
            if (connection == null) {
                return;
            }
            try {
                connection.close();
            } catch (SQLException e) {
                throw new StoreException("Failed to close in-memory database", e);
            } finally {
                connection = null;
            }
        }
    }
}
