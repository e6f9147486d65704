package robotrader.core.store;

import robotrader.core.model.Task;
import robotrader.core.model.TaskStatus;
import robotrader.core.support.MutableClock;
import org.junit.jupiter.api.*;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JdbcTaskRepository ordering and transitions.
 */
class JdbcTaskRepositoryTest {

    private static Database db;
    private static MutableClock clock;
    private static JdbcTaskRepository repo;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-task-repo;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        clock = MutableClock.startingAt("2026-03-02T10:00:00Z");
        repo = new JdbcTaskRepository(db, clock);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTasks() throws Exception {
        clock.set(Instant.parse("2026-03-02T10:00:00Z"));
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM queue_tasks");
            conn.commit();
        }
    }

    private Task pending(String id, String queue, int priority) {
        return Task.builder()
                .taskId(id)
                .queueName(queue)
                .taskType("fetch_prices")
                .priority(priority)
                .payload(Map.of("symbol", "AAPL"))
                .maxRetries(2)
                .createdAt(clock.instant())
                .build();
    }

    @Test
    void saveAndFindRoundTripsPayload() {
        repo.save(pending("t-1", "data_fetcher", 5));

        Task found = repo.findById("t-1").orElseThrow();
        assertEquals("data_fetcher", found.queueName());
        assertEquals("fetch_prices", found.taskType());
        assertEquals(TaskStatus.PENDING, found.status());
        assertEquals("AAPL", found.payload().get("symbol"));
        assertEquals(2, found.maxRetries());
        assertEquals(clock.instant(), found.createdAt());
        assertFalse(found.hasPayloadDefect());
    }

    @Test
    void unknownTaskIsEmpty() {
        assertEquals(Optional.empty(), repo.findById("missing"));
    }

    @Test
    void pendingTasksComeOutByPriorityThenCreationTimeThenInsertionOrder() {
        repo.save(pending("low", "data_fetcher", 3));
        repo.save(pending("high-first", "data_fetcher", 1));
        repo.save(pending("high-second", "data_fetcher", 1));
        clock.advance(Duration.ofSeconds(-10));
        repo.save(pending("mid-older", "data_fetcher", 2));
        repo.save(pending("other-queue", "ai_analysis", 1));

        List<String> ids = repo.findPending("data_fetcher", 10).stream().map(Task::taskId).toList();

        assertEquals(List.of("high-first", "high-second", "mid-older", "low"), ids);
        assertEquals("high-first", repo.findNextPending("data_fetcher").orElseThrow().taskId());
    }

    @Test
    void onlyOneTaskPerQueueCanBeRunning() {
        repo.save(pending("a", "data_fetcher", 1));
        repo.save(pending("b", "data_fetcher", 2));
        repo.save(pending("c", "ai_analysis", 1));

        assertTrue(repo.markRunning("a", "data_fetcher", clock.instant()));
        assertFalse(repo.markRunning("b", "data_fetcher", clock.instant()));
        assertTrue(repo.markRunning("c", "ai_analysis", clock.instant()));

        assertEquals(1, repo.findRunning("data_fetcher").size());
        assertEquals(2, repo.findRunning(null).size());
    }

    @Test
    void markRunningRequiresPendingStatus() {
        repo.save(pending("a", "data_fetcher", 1));
        assertTrue(repo.cancelPending("a", "Cancelled by request", clock.instant()));

        assertFalse(repo.markRunning("a", "data_fetcher", clock.instant()));
        assertEquals(TaskStatus.CANCELLED, repo.findById("a").orElseThrow().status());
    }

    @Test
    void completedTaskRecordsDurationAndClearsError() {
        repo.save(pending("a", "data_fetcher", 1));
        repo.markRunning("a", "data_fetcher", clock.instant());
        clock.advance(Duration.ofSeconds(2));

        assertTrue(repo.markCompleted("a", clock.instant(), 2000));

        Task done = repo.findById("a").orElseThrow();
        assertEquals(TaskStatus.COMPLETED, done.status());
        assertEquals(2000L, done.durationMs());
        assertEquals(clock.instant(), done.completedAt());
        assertNull(done.error());
        assertFalse(repo.markCompleted("a", clock.instant(), 10), "terminal tasks do not move again");
    }

    @Test
    void retryRespectsBudget() {
        repo.save(pending("a", "data_fetcher", 1));
        Instant later = clock.instant().plusSeconds(30);

        repo.markRunning("a", "data_fetcher", clock.instant());
        assertTrue(repo.markRetry("a", "boom", later, 15L));
        Task requeued = repo.findById("a").orElseThrow();
        assertEquals(TaskStatus.PENDING, requeued.status());
        assertEquals(1, requeued.retryCount());
        assertEquals("boom", requeued.error());
        assertEquals(later, requeued.scheduledAt());
        assertNull(requeued.startedAt());
        assertFalse(requeued.isEligibleAt(clock.instant()));
        assertTrue(requeued.isEligibleAt(later));

        repo.markRunning("a", "data_fetcher", clock.instant());
        assertTrue(repo.markRetry("a", "boom again", later, null));

        repo.markRunning("a", "data_fetcher", clock.instant());
        assertFalse(repo.markRetry("a", "third", later, null), "retry_count reached max_retries");
        assertTrue(repo.markFailed("a", "third", clock.instant(), 5L));

        Task failed = repo.findById("a").orElseThrow();
        assertEquals(TaskStatus.FAILED, failed.status());
        assertEquals(2, failed.retryCount());
        assertEquals("third", failed.error());
    }

    @Test
    void cancelPendingLeavesRunningTasksAlone() {
        repo.save(pending("a", "data_fetcher", 1));
        repo.markRunning("a", "data_fetcher", clock.instant());

        assertFalse(repo.cancelPending("a", "nope", clock.instant()));
        assertTrue(repo.markCancelled("a", "Cancelled: queue stopped", clock.instant()));
        assertEquals(TaskStatus.CANCELLED, repo.findById("a").orElseThrow().status());
    }

    @Test
    void historyAndFailuresAreLimitedToTheWindow() {
        repo.save(pending("old", "data_fetcher", 1));
        repo.markRunning("old", "data_fetcher", clock.instant());
        repo.markFailed("old", "old failure", clock.instant(), 1L);

        clock.advance(Duration.ofHours(30));
        repo.save(pending("new", "data_fetcher", 1));
        repo.markRunning("new", "data_fetcher", clock.instant());
        repo.markFailed("new", "new failure", clock.instant(), 1L);

        List<Task> history = repo.findHistory("data_fetcher", Duration.ofHours(24), 10);
        assertEquals(List.of("new"), history.stream().map(Task::taskId).toList());
        assertEquals(1, repo.findRecentFailures(Duration.ofHours(24), 10).size());
        assertEquals(2, repo.findRecentFailures(Duration.ofHours(48), 10).size());
    }

    @Test
    void stuckRunningUsesStartTime() {
        repo.save(pending("a", "data_fetcher", 1));
        repo.markRunning("a", "data_fetcher", clock.instant());

        assertTrue(repo.findStuckRunning(clock.instant()).isEmpty());
        assertEquals(1, repo.findStuckRunning(clock.instant().plusSeconds(1)).size());
    }

    @Test
    void unreadablePayloadIsFlaggedNotThrown() throws Exception {
        String sql = """
                    INSERT INTO queue_tasks (task_id, seq, queue_name, task_type, status, priority, payload,
                                             retry_count, max_retries, created_at)
                    VALUES ('broken', NEXT VALUE FOR queue_task_seq, 'data_fetcher', 'fetch_prices', 'PENDING',
                            1, '{not json', 0, 3, ?)
                """;
        try (var conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.from(clock.instant()));
            ps.executeUpdate();
            conn.commit();
        }

        Task task = repo.findById("broken").orElseThrow();
        assertTrue(task.hasPayloadDefect());
        assertTrue(task.payload().isEmpty());
    }
}
