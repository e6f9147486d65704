package robotrader.core.scheduler;

import robotrader.core.config.CoordinatorConfig;
import robotrader.core.error.TaskValidationException;
import robotrader.core.events.Event;
import robotrader.core.events.EventBus;
import robotrader.core.events.EventType;
import robotrader.core.model.Task;
import robotrader.core.model.TaskStatus;
import robotrader.core.store.Database;
import robotrader.core.store.JdbcTaskRepository;
import robotrader.core.support.Await;
import org.junit.jupiter.api.*;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for QueueScheduler ordering, retries, timeouts and stop handling against H2.
 */
class QueueSchedulerTest {

    private static final String URL =
            "jdbc:h2:mem:test-scheduler;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";

    private static Database db;
    private static JdbcTaskRepository repo;

    private EventBus bus;
    private List<Event> events;
    private TaskExecutorRegistry executors;
    private QueueScheduler scheduler;

    @BeforeAll
    static void setup() {
        db = new Database(URL, 6);
        repo = new JdbcTaskRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTasks() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM queue_tasks");
            conn.commit();
        }
        bus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        for (EventType type : EventType.values()) {
            bus.subscribe(type, "recorder", events::add);
        }
        executors = new TaskExecutorRegistry();
    }

    @AfterEach
    void stopScheduler() {
        if (scheduler != null) {
            scheduler.stopAll();
        }
    }

    private static CoordinatorConfig config() {
        return CoordinatorConfig.defaults()
                .withQueueNames(List.of("data_fetcher", "ai_analysis"))
                .withPollInterval(Duration.ofMillis(20))
                .withRetryDelays(Duration.ofMillis(10), Duration.ofMillis(50))
                .withStoreRetryDelay(Duration.ofMillis(50))
                .withTaskTimeout(Duration.ofSeconds(5))
                .withQueueStopTimeout(Duration.ofMillis(300))
                .withMaxRetries(2);
    }

    private QueueScheduler scheduler(CoordinatorConfig config) {
        scheduler = new QueueScheduler(repo, executors, bus, config,
                new ExponentialBackoffRetryPolicy(10, 50, 2.0, false), Clock.systemUTC());
        return scheduler;
    }

    private static TaskStatus statusOf(String taskId) {
        return repo.findById(taskId).orElseThrow().status();
    }

    private List<Event> eventsOf(EventType type, String taskId) {
        List<Event> found = new ArrayList<>();
        for (Event event : events) {
            if (event.type() == type && taskId.equals(event.dataString("task_id"))) {
                found.add(event);
            }
        }
        return found;
    }

    @Test
    void runsTasksInPriorityOrderWhileOtherQueuesProceed() throws Exception {
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch fetchesDone = new CountDownLatch(3);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();

        executors.register("fetch_prices", task -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            order.add((String) task.payload().get("symbol"));
            Thread.sleep(20);
            active.decrementAndGet();
            fetchesDone.countDown();
            return Map.of("rows", 1);
        });
        // Holds the ai_analysis queue busy until every fetch finished
        executors.register("score_news", task -> {
            assertTrue(fetchesDone.await(5, TimeUnit.SECONDS));
            return Map.of();
        });

        QueueScheduler scheduler = scheduler(config());
        Task ai = scheduler.enqueue(TaskRequest.of("ai_analysis", "score_news", Map.of()));
        Task low = scheduler.enqueue(TaskRequest.of("data_fetcher", "fetch_prices", Map.of("symbol", "C"))
                .withPriority(3));
        Task high = scheduler.enqueue(TaskRequest.of("data_fetcher", "fetch_prices", Map.of("symbol", "A"))
                .withPriority(1));
        Task mid = scheduler.enqueue(TaskRequest.of("data_fetcher", "fetch_prices", Map.of("symbol", "B"))
                .withPriority(2));

        scheduler.startAll();

        Await.until("all tasks completed", () -> statusOf(ai.taskId()) == TaskStatus.COMPLETED
                && statusOf(low.taskId()) == TaskStatus.COMPLETED);
        assertEquals(List.of("A", "B", "C"), order);
        assertEquals(1, maxActive.get());
        assertEquals(TaskStatus.COMPLETED, statusOf(high.taskId()));
        assertEquals(TaskStatus.COMPLETED, statusOf(mid.taskId()));

        List<Event> completed = eventsOf(EventType.TASK_COMPLETED, high.taskId());
        assertEquals(1, completed.size());
        assertEquals(Map.of("rows", 1), completed.get(0).data().get("result"));
    }

    @Test
    void runsOneTaskAtATimeAndStartsThemInAcceptanceOrder() {
        AtomicInteger maxRunningRows = new AtomicInteger();
        executors.register("fetch_prices", task -> {
            maxRunningRows.accumulateAndGet(repo.findRunning("data_fetcher").size(), Math::max);
            Thread.sleep(5);
            return Map.of();
        });

        QueueScheduler scheduler = scheduler(config());
        List<Task> accepted = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            accepted.add(scheduler.enqueue(TaskRequest.of("data_fetcher", "fetch_prices", Map.of("n", i))));
        }
        scheduler.startAll();

        Task last = accepted.get(accepted.size() - 1);
        Await.until("all tasks completed", () -> statusOf(last.taskId()) == TaskStatus.COMPLETED);

        assertEquals(1, maxRunningRows.get());
        Instant previous = Instant.MIN;
        for (Task task : accepted) {
            Task stored = repo.findById(task.taskId()).orElseThrow();
            assertEquals(TaskStatus.COMPLETED, stored.status());
            assertNotNull(stored.startedAt());
            assertFalse(stored.startedAt().isBefore(previous), "started_at went backwards for " + task.taskId());
            previous = stored.startedAt();
        }
    }

    @Test
    void errorInsideTheLoopDoesNotStopTheQueue() {
        AtomicInteger completions = new AtomicInteger();
        JdbcTaskRepository flaky = new JdbcTaskRepository(db) {
            @Override
            public boolean markCompleted(String taskId, Instant completedAt, long durationMs) {
                if (completions.incrementAndGet() == 1) {
                    throw new AssertionError("completion write blew up");
                }
                return super.markCompleted(taskId, completedAt, durationMs);
            }
        };
        executors.register("fetch_prices", task -> Map.of());

        scheduler = new QueueScheduler(flaky, executors, bus, config(),
                new ExponentialBackoffRetryPolicy(10, 50, 2.0, false), Clock.systemUTC());
        scheduler.startAll();
        Task first = scheduler.enqueue(TaskRequest.of("data_fetcher", "fetch_prices", Map.of()));

        Await.until("first task completed", () -> statusOf(first.taskId()) == TaskStatus.COMPLETED);
        assertEquals(1, repo.findById(first.taskId()).orElseThrow().retryCount());

        Task second = scheduler.enqueue(TaskRequest.of("data_fetcher", "fetch_prices", Map.of()));
        Await.until("second task completed", () -> statusOf(second.taskId()) == TaskStatus.COMPLETED);
        assertTrue(scheduler.isRunning("data_fetcher"));
        assertTrue(repo.findRunning("data_fetcher").isEmpty());
    }

    @Test
    void subscriberThrowingErrorDoesNotStallTheQueue() {
        AtomicInteger starts = new AtomicInteger();
        bus.subscribe(EventType.TASK_STARTED, "strict-listener", event -> {
            if (starts.incrementAndGet() == 1) {
                throw new AssertionError("listener invariant broken");
            }
        });
        executors.register("fetch_prices", task -> Map.of());

        QueueScheduler scheduler = scheduler(config());
        scheduler.startAll();
        Task first = scheduler.enqueue(TaskRequest.of("data_fetcher", "fetch_prices", Map.of()));
        Task second = scheduler.enqueue(TaskRequest.of("data_fetcher", "fetch_prices", Map.of()));

        Await.until("both tasks completed", () -> statusOf(first.taskId()) == TaskStatus.COMPLETED
                && statusOf(second.taskId()) == TaskStatus.COMPLETED);
        assertEquals(0, repo.findById(first.taskId()).orElseThrow().retryCount());
        assertEquals(1, bus.handlerFailureCount());
    }

    @Test
    void failingTaskIsRetriedThenFailedPermanently() {
        AtomicInteger attempts = new AtomicInteger();
        executors.register("fetch_prices", task -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("provider down");
        });

        QueueScheduler scheduler = scheduler(config());
        scheduler.startAll();
        Task task = scheduler.enqueue(TaskRequest.of("data_fetcher", "fetch_prices", Map.of()));

        Await.until("final failure published", () -> eventsOf(EventType.TASK_FAILED, task.taskId()).size() == 3);

        Task failed = repo.findById(task.taskId()).orElseThrow();
        assertEquals(3, attempts.get());
        assertEquals(2, failed.retryCount());
        assertEquals("provider down", failed.error());

        List<Event> failures = eventsOf(EventType.TASK_FAILED, task.taskId());
        assertEquals(3, failures.size());
        assertEquals(true, failures.get(0).data().get("will_retry"));
        assertEquals(true, failures.get(1).data().get("will_retry"));
        assertEquals(false, failures.get(2).data().get("will_retry"));
        assertEquals("execution_error", failures.get(2).dataString("error_type"));
    }

    @Test
    void taskSucceedsOnRetry() {
        AtomicInteger attempts = new AtomicInteger();
        executors.register("sync_positions", task -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("broker timeout");
            }
            return Map.of("positions", 4);
        });

        QueueScheduler scheduler = scheduler(config().withQueueNames(List.of("portfolio_sync")));
        scheduler.startAll();
        Task task = scheduler.enqueue(TaskRequest.of("portfolio_sync", "sync_positions", Map.of()));

        Await.until("task completed", () -> statusOf(task.taskId()) == TaskStatus.COMPLETED);
        assertEquals(1, repo.findById(task.taskId()).orElseThrow().retryCount());
        assertNull(repo.findById(task.taskId()).orElseThrow().error());
    }

    @Test
    void slowTaskTimesOut() {
        executors.register("deep_analysis", task -> {
            Thread.sleep(5_000);
            return Map.of();
        });

        QueueScheduler scheduler = scheduler(config().withTaskTimeout(Duration.ofMillis(200)));
        scheduler.startAll();
        Task task = scheduler.enqueue(TaskRequest.of("ai_analysis", "deep_analysis", Map.of()).withMaxRetries(0));

        Await.until("timeout recorded", () -> !scheduler.history("ai_analysis").isEmpty());
        assertEquals(TaskStatus.FAILED, statusOf(task.taskId()));

        List<Event> failures = eventsOf(EventType.TASK_FAILED, task.taskId());
        assertEquals("timeout_error", failures.get(0).dataString("error_type"));
        assertEquals(ExecutionOutcome.FAILED, scheduler.history("ai_analysis").get(0).outcome());
    }

    @Test
    void unknownTaskTypeFailsWithoutRetry() {
        QueueScheduler scheduler = scheduler(config());
        scheduler.startAll();
        Task task = scheduler.enqueue(TaskRequest.of("data_fetcher", "no_such_type", Map.of()));

        Await.until("task failed", () -> statusOf(task.taskId()) == TaskStatus.FAILED);
        assertEquals(0, repo.findById(task.taskId()).orElseThrow().retryCount());
    }

    @Test
    void stopCancelsHungTask() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        executors.register("fetch_prices", task -> {
            started.countDown();
            new CountDownLatch(1).await();
            return Map.of();
        });

        QueueScheduler scheduler = scheduler(config());
        scheduler.startAll();
        Task task = scheduler.enqueue(TaskRequest.of("data_fetcher", "fetch_prices", Map.of()));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(scheduler.isExecuting(task.taskId()));

        assertTrue(scheduler.stop("data_fetcher"));

        Task cancelled = repo.findById(task.taskId()).orElseThrow();
        assertEquals(TaskStatus.CANCELLED, cancelled.status());
        assertEquals(QueueWorker.STOP_REASON, cancelled.error());
        assertFalse(scheduler.isRunning("data_fetcher"));
        assertTrue(scheduler.isRunning("ai_analysis"));
        assertEquals(1, eventsOf(EventType.TASK_CANCELLED, task.taskId()).size());
    }

    @Test
    void unreadablePayloadFailsWithoutCallingExecutor() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        executors.register("fetch_prices", task -> {
            calls.incrementAndGet();
            return Map.of();
        });
        String sql = """
                    INSERT INTO queue_tasks (task_id, seq, queue_name, task_type, status, priority, payload,
                                             retry_count, max_retries, created_at)
                    VALUES ('corrupt', NEXT VALUE FOR queue_task_seq, 'data_fetcher', 'fetch_prices', 'PENDING',
                            1, '{"symbol": ', 0, 3, ?)
                """;
        try (var conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.executeUpdate();
            conn.commit();
        }

        scheduler(config()).startAll();

        Await.until("corrupt task failed", () -> statusOf("corrupt") == TaskStatus.FAILED);
        assertEquals(0, calls.get());
        assertTrue(repo.findById("corrupt").orElseThrow().error().startsWith("Unreadable payload"));
    }

    @Test
    void taskLeftRunningByAPreviousProcessIsRecovered() {
        executors.register("fetch_prices", task -> Map.of());
        repo.save(Task.builder()
                .taskId("orphan")
                .queueName("data_fetcher")
                .taskType("fetch_prices")
                .status(TaskStatus.RUNNING)
                .maxRetries(3)
                .createdAt(Instant.now().minusSeconds(60))
                .startedAt(Instant.now().minusSeconds(30))
                .build());

        scheduler(config()).startAll();

        Await.until("orphan completed", () -> statusOf("orphan") == TaskStatus.COMPLETED);
        assertEquals(1, repo.findById("orphan").orElseThrow().retryCount());
    }

    @Test
    void pendingTaskCanBeCancelledOnce() {
        QueueScheduler scheduler = scheduler(config());
        Task task = scheduler.enqueue(TaskRequest.of("data_fetcher", "fetch_prices", Map.of()));

        assertTrue(scheduler.cancel(task.taskId()));
        assertFalse(scheduler.cancel(task.taskId()));
        assertFalse(scheduler.cancel("missing"));
        assertEquals(TaskStatus.CANCELLED, statusOf(task.taskId()));
        assertEquals(QueueScheduler.CANCEL_REASON, repo.findById(task.taskId()).orElseThrow().error());
    }

    @Test
    void enqueueValidatesRequests() {
        QueueScheduler scheduler = scheduler(config());

        assertThrows(IllegalArgumentException.class,
                () -> scheduler.enqueue(TaskRequest.of("nowhere", "fetch_prices", Map.of())));
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.enqueue(TaskRequest.of("data_fetcher", " ", Map.of())));
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.enqueue(TaskRequest.of("data_fetcher", "fetch_prices", Map.of()).withPriority(0)));
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.enqueue(TaskRequest.of("data_fetcher", "fetch_prices", Map.of()).withPriority(11)));
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.enqueue(TaskRequest.of("data_fetcher", "fetch_prices", Map.of()).withMaxRetries(-1)));
        assertThrows(TaskValidationException.class,
                () -> scheduler.enqueue(TaskRequest.of("data_fetcher", "fetch_prices", Map.of("x", new Object()))));

        assertTrue(repo.findPending("data_fetcher", 10).isEmpty());
    }

    @Test
    void enqueuedTaskIsPendingWithDefaults() {
        QueueScheduler scheduler = scheduler(config());
        Task task = scheduler.enqueue(TaskRequest.of("ai_analysis", "score_news", Map.of("ticker", "MSFT")));

        assertEquals(TaskStatus.PENDING, task.status());
        assertEquals(TaskRequest.DEFAULT_PRIORITY, task.priority());
        assertEquals(2, task.maxRetries());
        assertEquals(1, eventsOf(EventType.TASK_CREATED, task.taskId()).size());
        assertEquals(List.of("data_fetcher", "ai_analysis"), scheduler.queueNames());
    }
}
