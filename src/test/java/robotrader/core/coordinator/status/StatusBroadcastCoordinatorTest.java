package robotrader.core.coordinator.status;

import robotrader.core.events.Event;
import robotrader.core.events.EventBus;
import robotrader.core.events.EventType;
import robotrader.core.support.Await;
import robotrader.core.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StatusBroadcastCoordinatorTest {

    private EventBus bus;
    private List<Event> aggregated;
    private AtomicInteger collections;
    private StatusCoordinator status;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        aggregated = new CopyOnWriteArrayList<>();
        bus.subscribe(EventType.STATUS_AGGREGATED, aggregated::add);
        collections = new AtomicInteger();

        StatusAggregationCoordinator aggregation = new StatusAggregationCoordinator(Duration.ofSeconds(1),
                MutableClock.startingAt("2026-03-02T10:00:00Z"));
        aggregation.addSource("counter", () -> Map.of("calls", collections.incrementAndGet()));
        StatusBroadcastCoordinator broadcast = new StatusBroadcastCoordinator(bus, aggregation, Duration.ofMillis(100));
        status = new StatusCoordinator(aggregation, broadcast);
        status.initialize();
    }

    @AfterEach
    void tearDown() {
        status.cleanup();
    }

    @Test
    void burstOfStateChangesCollapsesIntoOneRefresh() throws Exception {
        for (int i = 0; i < 10; i++) {
            bus.publish(Event.of(EventType.QUEUE_STATUS_CHANGED, "test", Map.of("queue_name", "q" + i)));
        }

        Await.until("one refresh", () -> aggregated.size() == 1);
        Thread.sleep(300);
        assertEquals(1, aggregated.size());
        assertEquals(1, collections.get());
        assertEquals(false, aggregated.get(0).data().get("force"));
    }

    @Test
    void forcedRequestStaysForcedWhenFollowedByUnforcedOnes() {
        status.forceRefresh();
        bus.publish(Event.of(EventType.AGENT_REGISTERED, "test", Map.of("agent_id", "a")));

        Await.until("one refresh", () -> aggregated.size() == 1);
        assertEquals(true, aggregated.get(0).data().get("force"));
    }

    @Test
    void refreshNowPublishesImmediately() {
        status.refreshNow();

        assertEquals(1, aggregated.size());
        Event event = aggregated.get(0);
        assertEquals(EventType.STATUS_AGGREGATED, event.type());
        assertEquals(status.lastSnapshot().hash(), event.dataString("hash"));
        assertEquals("healthy", event.dataString("status"));
    }

    @Test
    void systemStatusIsFreshButNotPublished() {
        StatusSnapshot snapshot = status.getSystemStatus();

        assertTrue(snapshot.isHealthy());
        assertTrue(aggregated.isEmpty());
        assertNull(status.lastSnapshot());
    }

    @Test
    void unrelatedEventsDoNotTriggerRefresh() throws Exception {
        bus.publish(Event.of(EventType.TASK_CREATED, "test"));
        Thread.sleep(300);
        assertTrue(aggregated.isEmpty());
    }
}
