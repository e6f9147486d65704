package robotrader.core.coordinator.message;

import robotrader.core.events.Event;
import robotrader.core.events.EventBus;
import robotrader.core.events.EventType;
import robotrader.core.support.Await;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class MessageCoordinatorTest {

    private EventBus bus;
    private List<Event> received;
    private List<Event> systemErrors;
    private MessageRoutingCoordinator routing;
    private MessageCoordinator messages;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        received = new CopyOnWriteArrayList<>();
        systemErrors = new CopyOnWriteArrayList<>();
        bus.subscribe(EventType.AGENT_MESSAGE_RECEIVED, received::add);
        bus.subscribe(EventType.SYSTEM_ERROR, systemErrors::add);

        routing = new MessageRoutingCoordinator(bus, Duration.ofMillis(250));
        messages = new MessageCoordinator(routing, new MessageHandlingCoordinator(bus));
        messages.initialize();
    }

    @AfterEach
    void tearDown() {
        messages.cleanup();
    }

    @Test
    void requestGetsCorrelatedResponse() {
        messages.registerHandler(MessageType.ANALYSIS_REQUEST, request -> routing.sendMessage(
                request.replyTo(MessageType.ANALYSIS_RESPONSE, "ta-1", Map.of("signal", "buy"))));

        AgentMessage request = AgentMessage.of(MessageType.ANALYSIS_REQUEST, "strategy-1", "ta-1",
                Map.of("symbol", "AAPL"));
        Optional<AgentMessage> response = messages.sendRequest(request);

        assertTrue(response.isPresent());
        assertEquals(request.messageId(), response.get().correlationId());
        assertEquals("buy", response.get().content().get("signal"));
        assertEquals("strategy-1", response.get().recipient());
        assertEquals(0, messages.pendingRequests());
        assertTrue(received.isEmpty(), "a correlated response goes to the waiting caller only");
    }

    @Test
    void unansweredRequestTimesOutEmpty() {
        AgentMessage request = AgentMessage.of(MessageType.ANALYSIS_REQUEST, "strategy-1", "nobody", Map.of());

        long start = System.nanoTime();
        Optional<AgentMessage> response = routing.sendRequest(request, Duration.ofMillis(200));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(response.isEmpty());
        assertTrue(elapsedMs >= 190, "returned after " + elapsedMs + "ms");
        assertEquals(0, messages.pendingRequests());
    }

    @Test
    void defaultHandlersPublishReceivedEvents() {
        AgentMessage vote = messages.send(MessageType.VOTE, "risk-1", "strategy-1", Map.of("approve", true));

        Await.until("message received event", () -> received.size() == 1);
        Event event = received.get(0);
        assertEquals(vote.messageId(), event.dataString("message_id"));
        assertEquals("vote", event.dataString("message_type"));
        assertEquals("risk-1", event.dataString("agent_id"));
        assertEquals(Map.of("approve", true), event.data().get("content"));
    }

    @Test
    void errorReportAlsoRaisesSystemError() {
        messages.send(MessageType.ERROR_REPORT, "mon-1", null, Map.of("error", "feed stalled"));

        Await.until("system error event", () -> systemErrors.size() == 1);
        assertEquals("mon-1", systemErrors.get(0).dataString("agent_id"));
        assertEquals(1, received.size());
    }

    @Test
    void failingHandlerDoesNotStopRouting() {
        messages.registerHandler(MessageType.DECISION_PROPOSAL, message -> {
            throw new IllegalStateException("bad proposal");
        });

        messages.send(MessageType.DECISION_PROPOSAL, "strategy-1", null, Map.of("n", 1));
        messages.send(MessageType.DECISION_PROPOSAL, "strategy-1", null, Map.of("n", 2));

        Await.until("both proposals delivered to the default handler", () -> received.size() == 2);
    }

    @Test
    void requestFromRouterThreadIsRefused() {
        AtomicReference<Throwable> failure = new AtomicReference<>();
        messages.registerHandler(MessageType.STATUS_UPDATE, message -> {
            try {
                routing.sendRequest(AgentMessage.of(MessageType.ANALYSIS_REQUEST, "x", "y", Map.of()));
            } catch (IllegalStateException e) {
                failure.set(e);
            }
        });

        messages.send(MessageType.STATUS_UPDATE, "mon-1", null, Map.of());

        Await.until("handler ran", () -> failure.get() != null);
        assertInstanceOf(IllegalStateException.class, failure.get());
    }

    @Test
    void reinitializingDoesNotDuplicateDefaultHandlers() {
        messages.cleanup();
        messages.initialize();

        messages.send(MessageType.STATUS_UPDATE, "mon-1", null, Map.of());

        Await.until("status update received", () -> received.size() == 1);
        assertEquals(1, received.size());
    }

    @Test
    void sendingWhileStoppedIsRejected() {
        messages.cleanup();

        assertThrows(IllegalStateException.class,
                () -> messages.send(MessageType.VOTE, "risk-1", null, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> routing.registerHandler(null, message -> {
        }));
    }
}
