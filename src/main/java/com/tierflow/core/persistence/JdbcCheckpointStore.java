package com.tierflow.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link CheckpointStore}.
 * <p>
 * Each checkpoint is one row keyed by {@code (task_id, sequence_number)} holding the
 * JSON-serialized task state. Every save runs in its own transaction, so a checkpoint is
 * either fully written or absent. Plain SQL only, so it runs on PostgreSQL and H2 alike.
 * <p>
 * The table {@code tierflow_checkpoints} is created by {@link #createTables()}.
 */
public class JdbcCheckpointStore extends AbstractCheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointStore.class);

    private static final String TABLE_NAME = "tierflow_checkpoints";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                task_id         VARCHAR(255) NOT NULL,
                sequence_number BIGINT       NOT NULL,
                state           TEXT         NOT NULL,
                created_at      TIMESTAMP    NOT NULL,
                PRIMARY KEY (task_id, sequence_number)
            )
            """.formatted(TABLE_NAME);

    private static final String SELECT_MAX_SEQUENCE_SQL = """
            SELECT MAX(sequence_number) FROM %s WHERE task_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_EXISTS_SQL = """
            SELECT 1 FROM %s WHERE task_id = ? AND sequence_number = ?
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (task_id, sequence_number, state, created_at)
            VALUES (?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String PRUNE_SQL = """
            DELETE FROM %s WHERE task_id = ? AND sequence_number <= ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_TASK_SQL = """
            SELECT task_id, sequence_number, state, created_at
            FROM %s
            WHERE task_id = ?
            ORDER BY sequence_number ASC
            """.formatted(TABLE_NAME);

    private static final String SELECT_LATEST_SQL = """
            SELECT task_id, sequence_number, state, created_at
            FROM %s
            WHERE task_id = ?
            ORDER BY sequence_number DESC
            """.formatted(TABLE_NAME);

    private static final String SELECT_TASK_IDS_SQL = """
            SELECT DISTINCT task_id FROM %s ORDER BY task_id
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcCheckpointStore(DataSource dataSource) {
        this(dataSource, new TaskStateCodec(), 0, Clock.systemUTC());
    }

    public JdbcCheckpointStore(DataSource dataSource, TaskStateCodec codec, int retention, Clock clock) {
        super(codec, retention, clock);
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the checkpoint table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Checkpoint table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void save(Checkpoint checkpoint) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                if (insertIfNewer(conn, checkpoint)) {
                    prune(conn, checkpoint);
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            log.error("Failed to save checkpoint {}@{}", checkpoint.taskId(), checkpoint.sequenceNumber(), e);
            throw new CheckpointException("Failed to save checkpoint for task " + checkpoint.taskId(), e);
        }
    }

    private boolean insertIfNewer(Connection conn, Checkpoint checkpoint) throws SQLException {
        try (PreparedStatement exists = conn.prepareStatement(SELECT_EXISTS_SQL)) {
            exists.setString(1, checkpoint.taskId());
            exists.setLong(2, checkpoint.sequenceNumber());
            try (ResultSet rs = exists.executeQuery()) {
                if (rs.next()) {
                    log.debug("Checkpoint {}@{} already stored; ignoring",
                            checkpoint.taskId(), checkpoint.sequenceNumber());
                    return false;
                }
            }
        }

        try (PreparedStatement max = conn.prepareStatement(SELECT_MAX_SEQUENCE_SQL)) {
            max.setString(1, checkpoint.taskId());
            try (ResultSet rs = max.executeQuery()) {
                if (rs.next()) {
                    long latest = rs.getLong(1);
                    if (!rs.wasNull() && latest > checkpoint.sequenceNumber()) {
                        throw new CheckpointException("Out-of-order checkpoint for task " + checkpoint.taskId()
                                + ": sequence " + checkpoint.sequenceNumber() + " after " + latest);
                    }
                }
            }
        }

        try (PreparedStatement insert = conn.prepareStatement(INSERT_SQL)) {
            insert.setString(1, checkpoint.taskId());
            insert.setLong(2, checkpoint.sequenceNumber());
            insert.setString(3, checkpoint.state());
            insert.setTimestamp(4, Timestamp.from(checkpoint.timestamp()));
            insert.executeUpdate();
        }
        log.debug("Saved checkpoint {}@{}", checkpoint.taskId(), checkpoint.sequenceNumber());
        return true;
    }

    private void prune(Connection conn, Checkpoint checkpoint) throws SQLException {
        if (retention <= 0) {
            return;
        }
        // sequences within a task are not necessarily contiguous, so find the cutoff row
        List<Long> sequences = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_LATEST_SQL)) {
            stmt.setString(1, checkpoint.taskId());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    sequences.add(rs.getLong("sequence_number"));
                }
            }
        }
        if (sequences.size() <= retention) {
            return;
        }
        try (PreparedStatement stmt = conn.prepareStatement(PRUNE_SQL)) {
            stmt.setString(1, checkpoint.taskId());
            stmt.setLong(2, sequences.get(retention));
            int removed = stmt.executeUpdate();
            log.debug("Pruned {} checkpoint(s) of task {}", removed, checkpoint.taskId());
        }
    }

    @Override
    public Optional<Checkpoint> load(String taskId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_LATEST_SQL)) {
            stmt.setString(1, taskId);
            stmt.setMaxRows(1);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new CheckpointException("Failed to load checkpoint for task " + taskId, e);
        }
    }

    @Override
    public List<Checkpoint> history(String taskId) {
        List<Checkpoint> checkpoints = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_TASK_SQL)) {
            stmt.setString(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    checkpoints.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new CheckpointException("Failed to list checkpoints for task " + taskId, e);
        }
        return checkpoints;
    }

    @Override
    public List<String> listTaskIds() {
        List<String> taskIds = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_TASK_IDS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                taskIds.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new CheckpointException("Failed to list checkpointed tasks", e);
        }
        return taskIds;
    }

    private Checkpoint fromResultSet(ResultSet rs) throws SQLException {
        return new Checkpoint(
                rs.getString("task_id"),
                rs.getString("state"),
                rs.getLong("sequence_number"),
                rs.getTimestamp("created_at").toInstant());
    }
}
