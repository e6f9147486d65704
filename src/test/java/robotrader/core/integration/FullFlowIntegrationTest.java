package robotrader.core.integration;

import robotrader.core.config.CoordinatorConfig;
import robotrader.core.config.Dependencies;
import robotrader.core.coordinator.queue.EventTrigger;
import robotrader.core.events.Event;
import robotrader.core.events.EventType;
import robotrader.core.model.Task;
import robotrader.core.model.TaskStatus;
import robotrader.core.scheduler.TaskRequest;
import robotrader.core.support.Await;
import robotrader.core.util.JsonCodec;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wires the whole core against an in-memory database and exercises it through
 * the coordinators and the observer server.
 */
class FullFlowIntegrationTest {

    private static Dependencies deps;
    private static HttpClient http;
    private static String baseUrl;

    @BeforeAll
    static void setup() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-full-flow;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withDatabasePoolSize(6)
                .withQueueNames(List.of("data_fetcher", "ai_analysis"))
                .withServerHost("127.0.0.1")
                .withServerPort(0)
                .withPollInterval(Duration.ofMillis(20))
                .withRetryDelays(Duration.ofMillis(10), Duration.ofMillis(50))
                .withQueueStopTimeout(Duration.ofMillis(500))
                .withStatusDebounce(Duration.ofMillis(50))
                .withEventJournal(true);

        deps = Dependencies.create(config);
        deps.executors()
                .register("fetch_prices", task -> Map.of("symbol", task.payload().get("symbol"), "price", 187.5))
                .register("score_news", task -> Map.of("score", 0.7))
                .register("flaky", task -> {
                    throw new IllegalStateException("upstream unavailable");
                });
        deps.start();
        deps.startServer();

        http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        baseUrl = "http://127.0.0.1:" + deps.statusServer().boundPort();
    }

    @AfterAll
    static void teardown() {
        if (deps != null)
            deps.close();
    }

    private static HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(5))
                .GET()
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void completedFetchTriggersAnalysis() {
        deps.queueCoordinator().registerTrigger(EventTrigger.on("prices-to-analysis", EventType.TASK_COMPLETED,
                "data_fetcher", "ai_analysis", "score_news"));
        try {
            Task fetch = deps.queueCoordinator().createTask("data_fetcher", "fetch_prices",
                    Map.of("symbol", "NVDA"), 2);

            Await.until("chained analysis completed", Duration.ofSeconds(10), () -> deps.stateRepository()
                    .getTaskHistory("ai_analysis", Duration.ofHours(1)).stream()
                    .anyMatch(t -> fetch.taskId().equals(t.payload().get("completed_task_id"))
                            && t.status() == TaskStatus.COMPLETED));

            assertEquals(TaskStatus.COMPLETED, deps.taskRepository().findById(fetch.taskId()).orElseThrow().status());
        } finally {
            deps.queueCoordinator().unregisterTrigger("prices-to-analysis");
        }
    }

    @Test
    void failingTaskRetriesThenFails() {
        Task task = deps.queueCoordinator().createTask(
                new TaskRequest("data_fetcher", "flaky", Map.of(), 5, 1));

        Await.until("task failed", Duration.ofSeconds(10), () -> deps.taskRepository().findById(task.taskId())
                .orElseThrow().status() == TaskStatus.FAILED);

        Task failed = deps.taskRepository().findById(task.taskId()).orElseThrow();
        assertEquals(1, failed.retryCount());
        assertTrue(failed.error().contains("upstream unavailable"));
    }

    @Test
    void eventsAreJournaled() {
        Instant from = Instant.now().minusSeconds(1);
        Task task = deps.queueCoordinator().createTask("ai_analysis", "score_news", Map.of(), 5);

        Await.until("completion journaled", Duration.ofSeconds(10), () -> deps.eventBus().journal()
                .findBetween(from, Instant.now().plusSeconds(1)).stream()
                .filter(e -> e.type() == EventType.TASK_COMPLETED)
                .map(Event::data)
                .anyMatch(data -> task.taskId().equals(data.get("task_id"))));
    }

    @Test
    void healthEndpoint() throws Exception {
        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("content-type").orElse("").startsWith("application/json"));
        Map<String, Object> body = JsonCodec.parseObject(response.body());
        assertEquals("healthy", body.get("status"));
        assertEquals("ok", body.get("database"));
        assertEquals(2, body.get("running_queues"));
        assertEquals("CLOSED", body.get("broadcast_circuit"));
    }

    @Test
    void statusEndpointListsComponents() throws Exception {
        HttpResponse<String> response = get("/api/v1/status");

        assertEquals(200, response.statusCode());
        Map<String, Object> body = JsonCodec.parseObject(response.body());
        Map<String, Object> components = JsonCodec.toMap(body.get("components"));
        assertTrue(components.keySet().containsAll(
                List.of("queues", "scheduler", "database", "events", "agents", "broadcast")));
        assertNotNull(body.get("hash"));
    }

    @Test
    void queueEndpoints() throws Exception {
        HttpResponse<String> all = get("/api/v1/queues");
        assertEquals(200, all.statusCode());
        Map<String, Object> queues = JsonCodec.toMap(JsonCodec.parseObject(all.body()).get("queues"));
        assertEquals(List.of("data_fetcher", "ai_analysis"), List.copyOf(queues.keySet()));

        HttpResponse<String> one = get("/api/v1/queues/ai_analysis");
        assertEquals(200, one.statusCode());
        assertEquals("ai_analysis", JsonCodec.parseObject(one.body()).get("name"));

        HttpResponse<String> unknown = get("/api/v1/queues/nowhere");
        assertEquals(404, unknown.statusCode());
        assertTrue(unknown.body().contains("nowhere"));
    }

    @Test
    void unknownPathsAndWritesAreRejected() throws Exception {
        assertEquals(404, get("/api/v1/nothing-here").statusCode());

        HttpRequest post = HttpRequest.newBuilder(URI.create(baseUrl + "/api/v1/health"))
                .timeout(Duration.ofSeconds(5))
                .POST(HttpRequest.BodyPublishers.ofString("{}"))
                .build();
        assertEquals(405, http.send(post, HttpResponse.BodyHandlers.ofString()).statusCode());
    }

    @Test
    void webSocketClientReceivesStatusOnConnect() throws Exception {
        List<String> frames = new CopyOnWriteArrayList<>();
        WebSocket.Listener listener = new WebSocket.Listener() {
            private final StringBuilder partial = new StringBuilder();

            @Override
            public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                partial.append(data);
                if (last) {
                    frames.add(partial.toString());
                    partial.setLength(0);
                }
                webSocket.request(1);
                return null;
            }
        };

        WebSocket ws = http.newWebSocketBuilder()
                .buildAsync(URI.create("ws://127.0.0.1:" + deps.statusServer().boundPort() + "/ws"), listener)
                .get(5, TimeUnit.SECONDS);
        try {
            Await.until("status pushed", Duration.ofSeconds(5), () -> frames.stream()
                    .anyMatch(f -> f.contains("\"system_status_update\"")));

            Map<String, Object> message = JsonCodec.parseObject(frames.stream()
                    .filter(f -> f.contains("\"system_status_update\""))
                    .findFirst()
                    .orElseThrow());
            assertEquals("system_status_update", message.get("type"));
            assertNotNull(message.get("timestamp"));
            assertEquals(1, deps.webSocketTransport().clientCount());
        } finally {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "done").get(5, TimeUnit.SECONDS);
        }
    }
}
