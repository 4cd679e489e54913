package com.triagebot.core.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.triagebot.core.embedding.EmbeddingVector;
import com.triagebot.core.error.StorageUnavailableException;
import com.triagebot.core.model.IssueRecord;
import com.triagebot.core.model.Priority;
import com.triagebot.core.model.SimilarityMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link IssueMemoryStore} persisting issue records to the
 * {@code issue_embeddings} table.
 * <p>
 * Rows are keyed by {@code (repo_name, issue_number)} so several repositories can share
 * one table. Embeddings and labels are stored as JSON text, which keeps the schema portable
 * between PostgreSQL and H2; similarity is computed in the JVM over the repository's rows.
 * The table is created by {@link #createTables()}.
 */
public class JdbcIssueMemoryStore implements IssueMemoryStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcIssueMemoryStore.class);

    private static final String TABLE_NAME = "issue_embeddings";

    private static final String UNIQUE_VIOLATION = "23505";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                repo_name    VARCHAR(255) NOT NULL,
                issue_number INTEGER NOT NULL,
                title        TEXT NOT NULL,
                body         TEXT,
                embedding    TEXT NOT NULL,
                labels       TEXT,
                priority     VARCHAR(8),
                created_at   TIMESTAMP WITH TIME ZONE NOT NULL,
                PRIMARY KEY (repo_name, issue_number)
            )
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s
            SET title = ?, body = ?, embedding = ?, labels = ?, priority = ?, created_at = ?
            WHERE repo_name = ? AND issue_number = ?
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (title, body, embedding, labels, priority, created_at, repo_name, issue_number)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_NUMBER_SQL = """
            SELECT issue_number, title, body, embedding, labels, priority, created_at
            FROM %s
            WHERE repo_name = ? AND issue_number = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_EMBEDDINGS_SQL = """
            SELECT issue_number, embedding
            FROM %s
            WHERE repo_name = ?
            """.formatted(TABLE_NAME);

    private static final String COUNT_SQL = """
            SELECT COUNT(*) FROM %s WHERE repo_name = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final String repository;
    private final int dimension;

    public JdbcIssueMemoryStore(DataSource dataSource, String repository, int dimension) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.dimension = dimension;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Creates the issue table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Issue memory table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void upsert(IssueRecord record) {
        SimilarityRanking.requireDimension(dimension, record.embedding());
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                if (update(conn, record) == 0) {
                    try {
                        insert(conn, record);
                    } catch (SQLException e) {
                        if (!UNIQUE_VIOLATION.equals(e.getSQLState())) {
                            throw e;
                        }
                        // a concurrent writer inserted first; last write still wins
                        conn.rollback();
                        update(conn, record);
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
            log.debug("Upserted issue #{} for repository '{}'", record.issueNumber(), repository);
        } catch (SQLException e) {
            throw new StorageUnavailableException(
                    "Failed to store issue #" + record.issueNumber() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<IssueRecord> get(int issueNumber) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_NUMBER_SQL)) {
            stmt.setString(1, repository);
            stmt.setInt(2, issueNumber);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to load issue #" + issueNumber + ": " + e.getMessage(), e);
        }
        return Optional.empty();
    }

    @Override
    public List<SimilarityMatch> queryNearest(EmbeddingVector query, double minScore, int maxResults,
                                              Integer excludedIssueNumber) {
        SimilarityRanking.requireDimension(dimension, query);

        var candidates = new ArrayList<Map.Entry<Integer, EmbeddingVector>>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_EMBEDDINGS_SQL)) {
            stmt.setString(1, repository);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    candidates.add(new AbstractMap.SimpleImmutableEntry<>(
                            rs.getInt("issue_number"), readEmbedding(rs.getString("embedding"))));
                }
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to query similar issues: " + e.getMessage(), e);
        }

        return SimilarityRanking.rank(query, candidates, minScore, maxResults, excludedIssueNumber);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public long count() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_SQL)) {
            stmt.setString(1, repository);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to count issues: " + e.getMessage(), e);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int update(Connection conn, IssueRecord record) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
            bindRecord(stmt, record);
            return stmt.executeUpdate();
        }
    }

    private void insert(Connection conn, IssueRecord record) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            bindRecord(stmt, record);
            stmt.executeUpdate();
        }
    }

    /** Both statements take the record columns first and the key last. */
    private void bindRecord(PreparedStatement stmt, IssueRecord record) throws SQLException {
        stmt.setString(1, record.title());
        stmt.setString(2, record.body());
        stmt.setString(3, writeJson(record.embedding().values()));
        stmt.setString(4, writeJson(List.copyOf(record.labels())));
        stmt.setString(5, record.priority() != null ? record.priority().name() : null);
        stmt.setObject(6, OffsetDateTime.ofInstant(record.storedAt(), ZoneOffset.UTC));
        stmt.setString(7, repository);
        stmt.setInt(8, record.issueNumber());
    }

    private IssueRecord fromResultSet(ResultSet rs) throws SQLException {
        String priority = rs.getString("priority");
        return new IssueRecord(
                rs.getInt("issue_number"),
                rs.getString("title"),
                rs.getString("body"),
                readEmbedding(rs.getString("embedding")),
                new LinkedHashSet<>(readLabels(rs.getString("labels"))),
                priority != null ? Priority.valueOf(priority) : null,
                rs.getObject("created_at", OffsetDateTime.class).toInstant());
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize issue record column", e);
        }
    }

    private EmbeddingVector readEmbedding(String json) {
        try {
            return new EmbeddingVector(objectMapper.readValue(json, double[].class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize stored embedding", e);
        }
    }

    private List<String> readLabels(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize stored labels", e);
        }
    }
}
