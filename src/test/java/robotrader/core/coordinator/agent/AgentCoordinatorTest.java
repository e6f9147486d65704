package robotrader.core.coordinator.agent;

import robotrader.core.events.Event;
import robotrader.core.events.EventBus;
import robotrader.core.events.EventType;
import robotrader.core.model.AgentProfile;
import robotrader.core.model.AgentRole;
import robotrader.core.store.Database;
import robotrader.core.store.JdbcAgentRepository;
import robotrader.core.support.MutableClock;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentCoordinatorTest {

    private static Database db;

    private MutableClock clock;
    private EventBus bus;
    private List<Event> events;
    private AgentCoordinator agents;

    @BeforeAll
    static void setupDb() {
        db = new Database("jdbc:h2:mem:test-agent-coord;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 2);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setUp() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM agents");
            conn.commit();
        }
        clock = MutableClock.startingAt("2026-03-02T10:00:00Z");
        bus = new EventBus();
        events = new ArrayList<>();
        bus.subscribe(EventType.AGENT_REGISTERED, events::add);
        bus.subscribe(EventType.AGENT_STATUS_CHANGED, events::add);

        JdbcAgentRepository repository = new JdbcAgentRepository(db);
        agents = new AgentCoordinator(
                new AgentRegistrationCoordinator(repository, bus, clock),
                new AgentActivityCoordinator(repository, bus, clock));
        agents.initialize();
    }

    @AfterEach
    void tearDown() {
        agents.cleanup();
    }

    @Test
    void registrationPublishesEventOnce() {
        AgentProfile profile = AgentProfile.of("ta-1", AgentRole.TECHNICAL_ANALYST, List.of("rsi"));

        assertTrue(agents.registerAgent(profile));
        assertFalse(agents.registerAgent(profile));

        assertEquals(1, events.size());
        assertEquals("ta-1", events.get(0).dataString("agent_id"));
        assertEquals("TECHNICAL_ANALYST", events.get(0).dataString("role"));
        assertEquals(List.of("rsi"), events.get(0).data().get("capabilities"));
        assertThrows(IllegalArgumentException.class, () -> agents.registerAgent(null));
    }

    @Test
    void availabilityFollowsActiveFlag() {
        agents.registerAgent(AgentProfile.of("risk-1", AgentRole.RISK_MANAGER, List.of()));
        agents.registerAgent(AgentProfile.of("risk-2", AgentRole.RISK_MANAGER, List.of()));

        assertTrue(agents.setAgentActive("risk-2", false));
        assertFalse(agents.setAgentActive("risk-2", false));
        assertFalse(agents.setAgentActive("ghost", true));

        assertEquals(List.of("risk-1"), agents.getAvailableAgents(AgentRole.RISK_MANAGER));
        assertTrue(agents.getAvailableAgents(AgentRole.STRATEGY_AGENT).isEmpty());
        assertEquals(2, agents.getAgents().size());
        assertEquals(false, events.get(events.size() - 1).data().get("active"));
    }

    @Test
    void receivedMessagesAreCountedAndTouchTheSender() {
        agents.registerAgent(AgentProfile.of("mon-1", AgentRole.MARKET_MONITOR, List.of()));
        clock.advance(Duration.ofMinutes(5));

        bus.publish(Event.of(EventType.AGENT_MESSAGE_RECEIVED, "test", Map.of("agent_id", "mon-1")));
        bus.publish(Event.of(EventType.AGENT_MESSAGE_RECEIVED, "test", Map.of("agent_id", "mon-1")));
        bus.publish(Event.of(EventType.AGENT_MESSAGE_RECEIVED, "test", Map.of("agent_id", "stranger")));

        assertEquals(2, agents.messageCount("mon-1"));
        assertEquals(1, agents.messageCount("stranger"));
        assertEquals(0, agents.messageCount("nobody"));
        assertEquals(clock.instant(), agents.getAgent("mon-1").orElseThrow().lastActiveAt());
    }
}
