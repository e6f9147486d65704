package robotrader.core.store;

import robotrader.core.error.StoreException;
import robotrader.core.model.QueueState;
import robotrader.core.model.QueueStatistics;
import robotrader.core.model.QueueStatus;
import robotrader.core.model.Task;
import robotrader.core.repository.QueueStateRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static robotrader.core.store.JdbcSupport.setTimestamp;
import static robotrader.core.store.JdbcSupport.toInstant;

/**
 * Computes queue states straight from {@code queue_tasks}.
 * <p>
 * {@link #getAllStatuses()} issues exactly two queries whatever the number of
 * queues: one grouped aggregate and one scan of RUNNING rows.
 */
public class JdbcQueueStateRepository implements QueueStateRepository {

    private static final String AGGREGATE_COLUMNS = """
                SELECT queue_name,
                       COALESCE(SUM(CASE WHEN status = 'PENDING' THEN 1 ELSE 0 END), 0) AS pending_count,
                       COALESCE(SUM(CASE WHEN status = 'RUNNING' THEN 1 ELSE 0 END), 0) AS running_count,
                       COALESCE(SUM(CASE WHEN status = 'COMPLETED' AND completed_at >= ? THEN 1 ELSE 0 END), 0)
                           AS completed_count,
                       COALESCE(SUM(CASE WHEN status = 'FAILED' AND completed_at >= ? THEN 1 ELSE 0 END), 0)
                           AS failed_count,
                       AVG(CASE WHEN status = 'COMPLETED' AND completed_at >= ? THEN duration_ms END)
                           AS avg_duration_ms,
                       MAX(COALESCE(completed_at, started_at, created_at)) AS last_activity
                FROM queue_tasks
            """;

    private final ConnectionSource db;
    private final List<String> knownQueues;
    private final Duration statisticsWindow;
    private final Clock clock;

    public JdbcQueueStateRepository(ConnectionSource db, List<String> knownQueues, Duration statisticsWindow,
            Clock clock) {
        this.db = db;
        this.knownQueues = List.copyOf(knownQueues);
        this.statisticsWindow = statisticsWindow;
        this.clock = clock;
    }

    @Override
    public QueueState getStatus(String queueName) {
        String aggregateSql = AGGREGATE_COLUMNS + " WHERE queue_name = ? GROUP BY queue_name";
        String runningSql = """
                    SELECT * FROM queue_tasks
                    WHERE queue_name = ? AND status = 'RUNNING'
                    ORDER BY started_at
                    LIMIT 1
                """;

        try (Connection conn = db.getConnection()) {
            Map<String, Task> running = new HashMap<>();
            try (PreparedStatement ps = conn.prepareStatement(runningSql)) {
                ps.setString(1, queueName);
                collectRunning(ps, running);
            }

            QueueState state = QueueState.empty(queueName);
            try (PreparedStatement ps = conn.prepareStatement(aggregateSql)) {
                bindWindow(ps);
                ps.setString(4, queueName);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        state = mapState(rs, running.get(queueName));
                    }
                }
            }
            conn.commit();
            return state;
        } catch (SQLException e) {
            throw new StoreException("Failed to load status of queue: " + queueName, e);
        }
    }

    @Override
    public Map<String, QueueState> getAllStatuses() {
        String aggregateSql = AGGREGATE_COLUMNS + " GROUP BY queue_name";
        String runningSql = "SELECT * FROM queue_tasks WHERE status = 'RUNNING' ORDER BY started_at";

        try (Connection conn = db.getConnection()) {
            Map<String, Task> running = new HashMap<>();
            try (PreparedStatement ps = conn.prepareStatement(runningSql)) {
                collectRunning(ps, running);
            }

            Map<String, QueueState> found = new TreeMap<>();
            try (PreparedStatement ps = conn.prepareStatement(aggregateSql)) {
                bindWindow(ps);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String name = rs.getString("queue_name");
                        found.put(name, mapState(rs, running.get(name)));
                    }
                }
            }
            conn.commit();

            // Configured queues first, in configuration order, then any other queue with rows
            Map<String, QueueState> states = new LinkedHashMap<>();
            for (String name : knownQueues) {
                QueueState state = found.remove(name);
                states.put(name, state != null ? state : QueueState.empty(name));
            }
            states.putAll(found);
            return states;
        } catch (SQLException e) {
            throw new StoreException("Failed to load queue statuses", e);
        }
    }

    @Override
    public QueueStatistics getStatistics() {
        Map<String, QueueState> states = getAllStatuses();

        int pending = 0;
        int running = 0;
        int completed = 0;
        int failed = 0;
        int degraded = 0;
        double weightedDuration = 0;
        int timedCompletions = 0;
        String busiest = null;
        int busiestLoad = 0;

        for (QueueState state : states.values()) {
            pending += state.pendingCount();
            running += state.runningCount();
            completed += state.completedCount();
            failed += state.failedCount();
            if (state.status() == QueueStatus.DEGRADED) {
                degraded++;
            }
            if (state.averageDurationMs() != null) {
                weightedDuration += (double) state.averageDurationMs() * state.completedCount();
                timedCompletions += state.completedCount();
            }
            int load = state.pendingCount() + state.runningCount();
            if (load > busiestLoad) {
                busiestLoad = load;
                busiest = state.name();
            }
        }

        Long averageDuration = timedCompletions > 0 ? Math.round(weightedDuration / timedCompletions) : null;
        double successRate = completed + failed == 0
                ? 100.0
                : Math.round(completed * 10000.0 / (completed + failed)) / 100.0;

        return new QueueStatistics(states.size(), pending, running, completed, failed, successRate,
                averageDuration, busiest, degraded);
    }

    private void bindWindow(PreparedStatement ps) throws SQLException {
        Instant since = clock.instant().minus(statisticsWindow);
        setTimestamp(ps, 1, since);
        setTimestamp(ps, 2, since);
        setTimestamp(ps, 3, since);
    }

    private static void collectRunning(PreparedStatement ps, Map<String, Task> running) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                Task task = JdbcTaskRepository.mapRow(rs);
                running.putIfAbsent(task.queueName(), task);
            }
        }
    }

    private static QueueState mapState(ResultSet rs, Task current) throws SQLException {
        double avg = rs.getDouble("avg_duration_ms");
        Long averageDuration = rs.wasNull() ? null : Math.round(avg);

        return QueueState.of(
                rs.getString("queue_name"),
                rs.getInt("pending_count"),
                rs.getInt("running_count"),
                rs.getInt("completed_count"),
                rs.getInt("failed_count"),
                averageDuration,
                current,
                toInstant(rs, "last_activity"));
    }
}
