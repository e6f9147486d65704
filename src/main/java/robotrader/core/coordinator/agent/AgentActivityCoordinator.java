package robotrader.core.coordinator.agent;

import robotrader.core.coordinator.Coordinator;
import robotrader.core.coordinator.SubscriptionScope;
import robotrader.core.events.Event;
import robotrader.core.events.EventBus;
import robotrader.core.events.EventType;
import robotrader.core.repository.AgentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks agent activity from delivered messages: stamps the sender's
 * last activity time and counts messages per agent.
 */
public class AgentActivityCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(AgentActivityCoordinator.class);

    static final String NAME = "agent_activity_coordinator";

    private final AgentRepository agentRepository;
    private final Clock clock;
    private final SubscriptionScope subscriptions;
    private final Map<String, AtomicLong> messageCounts = new ConcurrentHashMap<>();
    private volatile boolean initialized;

    public AgentActivityCoordinator(AgentRepository agentRepository, EventBus eventBus, Clock clock) {
        this.agentRepository = agentRepository;
        this.clock = clock;
        this.subscriptions = new SubscriptionScope(eventBus, NAME);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        subscriptions.subscribe(EventType.AGENT_MESSAGE_RECEIVED, this::onMessageReceived);
        initialized = true;
    }

    @Override
    public synchronized void cleanup() {
        subscriptions.close();
        initialized = false;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    public long messageCount(String agentId) {
        AtomicLong count = messageCounts.get(agentId);
        return count == null ? 0 : count.get();
    }

    public Map<String, Long> messageCounts() {
        Map<String, Long> counts = new TreeMap<>();
        messageCounts.forEach((agent, count) -> counts.put(agent, count.get()));
        return counts;
    }

    private void onMessageReceived(Event event) {
        String agentId = event.dataString("agent_id");
        if (agentId == null) {
            return;
        }
        messageCounts.computeIfAbsent(agentId, id -> new AtomicLong()).incrementAndGet();
        if (!agentRepository.touch(agentId, clock.instant())) {
            log.debug("Message from unregistered agent {}", agentId);
        }
    }
}
