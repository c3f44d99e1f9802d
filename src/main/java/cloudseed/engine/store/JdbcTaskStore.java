package cloudseed.engine.store;

import cloudseed.engine.model.TaskState;
import cloudseed.engine.model.TransferTask;
import cloudseed.engine.repository.IllegalTransitionException;
import cloudseed.engine.repository.TaskStore;
import cloudseed.engine.repository.TaskStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of TaskStore.
 * Each save is one transaction that locks the row, checks the transition
 * and writes the whole record.
 */
public class JdbcTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskStore.class);

    private final Database db;

    public JdbcTaskStore(Database db) {
        this.db = db;
    }

    @Override
    public int load() {
        String sql = "SELECT COUNT(*) FROM transfer_tasks";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            int count = rs.next() ? rs.getInt(1) : 0;
            conn.commit();
            log.debug("Task table holds {} tasks", count);
            return count;
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to load tasks", e);
        }
    }

    @Override
    public void save(TransferTask task) {
        String selectSql = "SELECT state FROM transfer_tasks WHERE id = ? FOR UPDATE";

        String insertSql = """
                    INSERT INTO transfer_tasks (source, state, download_handle, name, progress, local_path,
                                                remote_path, error, failure_count, created_at, updated_at, id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        String updateSql = """
                    UPDATE transfer_tasks
                    SET source = ?, state = ?, download_handle = ?, name = ?, progress = ?, local_path = ?,
                        remote_path = ?, error = ?, failure_count = ?, created_at = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection()) {
            try {
                TaskState current = null;
                try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                    ps.setString(1, task.id());
                    try (ResultSet rs = ps.executeQuery()) {
                        if (rs.next()) {
                            current = TaskState.valueOf(rs.getString("state"));
                        }
                    }
                }

                if (current != null) {
                    IllegalTransitionException.check(task.id(), current, task.state());
                }

                try (PreparedStatement ps = conn.prepareStatement(current == null ? insertSql : updateSql)) {
                    bind(ps, task);
                    ps.executeUpdate();
                }

                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public Optional<TransferTask> findById(String taskId) {
        String sql = "SELECT * FROM transfer_tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<TransferTask> list() {
        String sql = "SELECT * FROM transfer_tasks ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<TransferTask> results = new ArrayList<>();
            while (rs.next()) {
                results.add(mapRow(rs));
            }
            return results;
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to list tasks", e);
        }
    }

    @Override
    public boolean isHealthy() {
        return db.isHealthy();
    }

    // ==================== Helper Methods ====================

    private static void bind(PreparedStatement ps, TransferTask task) throws SQLException {
        ps.setString(1, task.source());
        ps.setString(2, task.state().name());
        ps.setString(3, task.downloadHandle());
        ps.setString(4, task.name());
        ps.setDouble(5, task.progress());
        ps.setString(6, task.localPath());
        ps.setString(7, task.remotePath());
        ps.setString(8, task.error());
        ps.setInt(9, task.failureCount());
        setTimestamp(ps, 10, task.createdAt());
        setTimestamp(ps, 11, task.updatedAt());
        ps.setString(12, task.id());
    }

    private TransferTask mapRow(ResultSet rs) throws SQLException {
        return TransferTask.builder()
                .id(rs.getString("id"))
                .source(rs.getString("source"))
                .state(TaskState.valueOf(rs.getString("state")))
                .downloadHandle(rs.getString("download_handle"))
                .name(rs.getString("name"))
                .progress(rs.getDouble("progress"))
                .localPath(rs.getString("local_path"))
                .remotePath(rs.getString("remote_path"))
                .error(rs.getString("error"))
                .failureCount(rs.getInt("failure_count"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
