package robotrader.core.scheduler;

import robotrader.core.config.CoordinatorConfig;
import robotrader.core.events.Event;
import robotrader.core.events.EventBus;
import robotrader.core.events.EventType;
import robotrader.core.model.Task;
import robotrader.core.model.TaskStatus;
import robotrader.core.store.Database;
import robotrader.core.store.JdbcTaskRepository;
import robotrader.core.support.MutableClock;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TaskReaper functionality.
 */
class TaskReaperTest {

    private static Database db;
    private static MutableClock clock;
    private static JdbcTaskRepository repo;
    private static CoordinatorConfig config;

    private EventBus bus;
    private List<Event> failures;

    @BeforeAll
    static void setup() {
        config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-reaper;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withTaskStuckThreshold(Duration.ofMinutes(16));

        db = new Database(config);
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
        bus = new EventBus();
        failures = new ArrayList<>();
        bus.subscribe(EventType.TASK_FAILED, failures::add);
    }

    private TaskReaper reaper(Set<String> inFlight) {
        return new TaskReaper(repo, bus, new ExponentialBackoffRetryPolicy(1000, 1000, 1.0, false),
                inFlight::contains, config, clock);
    }

    private void startTask(String id, int retryCount, int maxRetries) {
        repo.save(Task.builder()
                .taskId(id)
                .queueName("ai_analysis")
                .taskType("deep_analysis")
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .createdAt(clock.instant())
                .build());
        assertTrue(repo.markRunning(id, "ai_analysis", clock.instant()));
    }

    @Test
    void reapsStuckTaskWithRetryAvailable() {
        startTask("stuck-retry", 0, 3);
        clock.advance(Duration.ofMinutes(17));

        int reaped = reaper(Set.of()).reapStuckTasks();

        assertEquals(1, reaped);
        Task updated = repo.findById("stuck-retry").orElseThrow();
        assertEquals(TaskStatus.PENDING, updated.status());
        assertEquals(1, updated.retryCount());
        assertEquals(clock.instant().plusSeconds(1), updated.scheduledAt());
        assertNull(updated.startedAt());
        assertEquals(true, failures.get(0).data().get("will_retry"));
        assertEquals("timeout_error", failures.get(0).dataString("error_type"));
    }

    @Test
    void reapsStuckTaskWithNoRetryLeft() {
        startTask("stuck-final", 3, 3);
        clock.advance(Duration.ofMinutes(17));

        assertEquals(1, reaper(Set.of()).reapStuckTasks());

        Task updated = repo.findById("stuck-final").orElseThrow();
        assertEquals(TaskStatus.FAILED, updated.status());
        assertTrue(updated.error().contains("stalled"));
        assertEquals(false, failures.get(0).data().get("will_retry"));
    }

    @Test
    void leavesRecentTasksAlone() {
        startTask("fresh", 0, 3);
        clock.advance(Duration.ofMinutes(5));

        assertEquals(0, reaper(Set.of()).reapStuckTasks());
        assertEquals(TaskStatus.RUNNING, repo.findById("fresh").orElseThrow().status());
        assertTrue(failures.isEmpty());
    }

    @Test
    void leavesTasksALiveWorkerIsExecuting() {
        startTask("long-but-alive", 0, 3);
        clock.advance(Duration.ofMinutes(30));

        assertEquals(0, reaper(Set.of("long-but-alive")).reapStuckTasks());
        assertEquals(TaskStatus.RUNNING, repo.findById("long-but-alive").orElseThrow().status());
    }
}
