package robotrader.core.store;

import robotrader.core.error.StoreException;
import robotrader.core.model.Task;
import robotrader.core.model.TaskStatus;
import robotrader.core.repository.TaskRepository;
import robotrader.core.util.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static robotrader.core.store.JdbcSupport.getLongOrNull;
import static robotrader.core.store.JdbcSupport.setLongOrNull;
import static robotrader.core.store.JdbcSupport.setTimestamp;
import static robotrader.core.store.JdbcSupport.toInstant;
import static robotrader.core.store.JdbcSupport.truncate;

/**
 * JDBC implementation of TaskRepository.
 * Transitions are conditional UPDATEs; the row count tells whether the task moved.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    /** Execution order within a queue. */
    static final String QUEUE_ORDER = "priority, created_at, seq";

    private final ConnectionSource db;
    private final Clock clock;

    public JdbcTaskRepository(ConnectionSource db) {
        this(db, Clock.systemUTC());
    }

    public JdbcTaskRepository(ConnectionSource db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    INSERT INTO queue_tasks (task_id, seq, queue_name, task_type, status, priority, payload,
                                             retry_count, max_retries, created_at, started_at, completed_at,
                                             scheduled_at, duration_ms, error)
                    VALUES (?, NEXT VALUE FOR queue_task_seq, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.taskId());
            ps.setString(2, task.queueName());
            ps.setString(3, task.taskType());
            ps.setString(4, task.status().name());
            ps.setInt(5, task.priority());
            ps.setString(6, JsonCodec.toJson(task.payload()));
            ps.setInt(7, task.retryCount());
            ps.setInt(8, task.maxRetries());
            setTimestamp(ps, 9, task.createdAt() != null ? task.createdAt() : clock.instant());
            setTimestamp(ps, 10, task.startedAt());
            setTimestamp(ps, 11, task.completedAt());
            setTimestamp(ps, 12, task.scheduledAt());
            setLongOrNull(ps, 13, task.durationMs());
            ps.setString(14, truncate(task.error()));

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved task {} to queue {}", task.taskId(), task.queueName());
        } catch (SQLException e) {
            throw new StoreException("Failed to save task: " + task.taskId(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM queue_tasks WHERE task_id = ?";

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
            throw new StoreException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public Optional<Task> findNextPending(String queueName) {
        List<Task> head = findPending(queueName, 1);
        return head.isEmpty() ? Optional.empty() : Optional.of(head.get(0));
    }

    @Override
    public List<Task> findPending(String queueName, int limit) {
        String sql = "SELECT * FROM queue_tasks WHERE queue_name = ? AND status = 'PENDING' ORDER BY "
                + QUEUE_ORDER + " LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queueName);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find pending tasks for queue: " + queueName, e);
        }
    }

    @Override
    public List<Task> findRunning(String queueName) {
        String sql = queueName == null
                ? "SELECT * FROM queue_tasks WHERE status = 'RUNNING' ORDER BY started_at"
                : "SELECT * FROM queue_tasks WHERE status = 'RUNNING' AND queue_name = ? ORDER BY started_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (queueName != null) {
                ps.setString(1, queueName);
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find running tasks", e);
        }
    }

    @Override
    public List<Task> findHistory(String queueName, Duration window, int limit) {
        String sql = """
                    SELECT * FROM queue_tasks
                    WHERE queue_name = ?
                      AND status IN ('COMPLETED', 'FAILED', 'CANCELLED')
                      AND completed_at >= ?
                    ORDER BY completed_at DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queueName);
            setTimestamp(ps, 2, clock.instant().minus(window));
            ps.setInt(3, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to load task history for queue: " + queueName, e);
        }
    }

    @Override
    public List<Task> findRecentFailures(Duration window, int limit) {
        String sql = """
                    SELECT * FROM queue_tasks
                    WHERE status = 'FAILED' AND completed_at >= ?
                    ORDER BY completed_at DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, clock.instant().minus(window));
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to load recent failures", e);
        }
    }

    @Override
    public List<Task> findStuckRunning(Instant startedBefore) {
        String sql = """
                    SELECT * FROM queue_tasks
                    WHERE status = 'RUNNING' AND started_at < ?
                    ORDER BY started_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, startedBefore);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find stuck tasks", e);
        }
    }

    @Override
    public boolean markRunning(String taskId, String queueName, Instant startedAt) {
        String sql = """
                    UPDATE queue_tasks
                    SET status = 'RUNNING', started_at = ?, completed_at = NULL
                    WHERE task_id = ? AND status = 'PENDING'
                      AND NOT EXISTS (
                          SELECT 1 FROM queue_tasks r WHERE r.queue_name = ? AND r.status = 'RUNNING'
                      )
                """;

        return executeTransition(sql, taskId, "mark task running", ps -> {
            setTimestamp(ps, 1, startedAt);
            ps.setString(2, taskId);
            ps.setString(3, queueName);
        });
    }

    @Override
    public boolean markCompleted(String taskId, Instant completedAt, long durationMs) {
        String sql = """
                    UPDATE queue_tasks
                    SET status = 'COMPLETED', completed_at = ?, duration_ms = ?, error = NULL, scheduled_at = NULL
                    WHERE task_id = ? AND status = 'RUNNING'
                """;

        return executeTransition(sql, taskId, "complete task", ps -> {
            setTimestamp(ps, 1, completedAt);
            ps.setLong(2, durationMs);
            ps.setString(3, taskId);
        });
    }

    @Override
    public boolean markRetry(String taskId, String error, Instant scheduledAt, Long durationMs) {
        String sql = """
                    UPDATE queue_tasks
                    SET status = 'PENDING', retry_count = retry_count + 1, started_at = NULL,
                        error = ?, scheduled_at = ?, duration_ms = ?
                    WHERE task_id = ? AND status = 'RUNNING' AND retry_count < max_retries
                """;

        return executeTransition(sql, taskId, "requeue task", ps -> {
            ps.setString(1, truncate(error));
            setTimestamp(ps, 2, scheduledAt);
            setLongOrNull(ps, 3, durationMs);
            ps.setString(4, taskId);
        });
    }

    @Override
    public boolean markFailed(String taskId, String error, Instant completedAt, Long durationMs) {
        String sql = """
                    UPDATE queue_tasks
                    SET status = 'FAILED', error = ?, completed_at = ?, duration_ms = COALESCE(?, duration_ms)
                    WHERE task_id = ? AND status IN ('PENDING', 'RUNNING')
                """;

        return executeTransition(sql, taskId, "mark task as failed", ps -> {
            ps.setString(1, truncate(error));
            setTimestamp(ps, 2, completedAt);
            setLongOrNull(ps, 3, durationMs);
            ps.setString(4, taskId);
        });
    }

    @Override
    public boolean markCancelled(String taskId, String reason, Instant completedAt) {
        String sql = """
                    UPDATE queue_tasks
                    SET status = 'CANCELLED', error = ?, completed_at = ?
                    WHERE task_id = ? AND status IN ('PENDING', 'RUNNING')
                """;

        return executeTransition(sql, taskId, "cancel task", ps -> {
            ps.setString(1, truncate(reason));
            setTimestamp(ps, 2, completedAt);
            ps.setString(3, taskId);
        });
    }

    @Override
    public boolean cancelPending(String taskId, String reason, Instant completedAt) {
        String sql = """
                    UPDATE queue_tasks
                    SET status = 'CANCELLED', error = ?, completed_at = ?
                    WHERE task_id = ? AND status = 'PENDING'
                """;

        return executeTransition(sql, taskId, "cancel pending task", ps -> {
            ps.setString(1, truncate(reason));
            setTimestamp(ps, 2, completedAt);
            ps.setString(3, taskId);
        });
    }

    // ==================== Helpers ====================

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private boolean executeTransition(String sql, String taskId, String action, Binder binder) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {}: {}", taskId, action);
            }

            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to " + action + ": " + taskId, e);
        }
    }

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> tasks = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                tasks.add(mapRow(rs));
            }
        }
        return tasks;
    }

    static Task mapRow(ResultSet rs) throws SQLException {
        String rawPayload = rs.getString("payload");
        Map<String, Object> payload;
        String defect = null;
        try {
            payload = JsonCodec.parseObject(rawPayload);
        } catch (IllegalArgumentException e) {
            payload = Map.of();
            defect = e.getMessage();
        }

        return Task.builder()
                .taskId(rs.getString("task_id"))
                .queueName(rs.getString("queue_name"))
                .taskType(rs.getString("task_type"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .priority(rs.getInt("priority"))
                .payload(payload)
                .payloadDefect(defect)
                .retryCount(rs.getInt("retry_count"))
                .maxRetries(rs.getInt("max_retries"))
                .createdAt(toInstant(rs, "created_at"))
                .startedAt(toInstant(rs, "started_at"))
                .completedAt(toInstant(rs, "completed_at"))
                .scheduledAt(toInstant(rs, "scheduled_at"))
                .durationMs(getLongOrNull(rs, "duration_ms"))
                .error(rs.getString("error"))
                .build();
    }
}
