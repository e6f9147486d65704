package robotrader.core.coordinator.agent;

import robotrader.core.coordinator.Coordinator;
import robotrader.core.events.Event;
import robotrader.core.events.EventBus;
import robotrader.core.events.EventType;
import robotrader.core.model.AgentProfile;
import robotrader.core.model.AgentRole;
import robotrader.core.repository.AgentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registers agents and tracks whether they are available.
 */
public class AgentRegistrationCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistrationCoordinator.class);

    static final String NAME = "agent_registration_coordinator";

    private final AgentRepository agentRepository;
    private final EventBus eventBus;
    private final Clock clock;
    private volatile boolean initialized;

    public AgentRegistrationCoordinator(AgentRepository agentRepository, EventBus eventBus, Clock clock) {
        this.agentRepository = agentRepository;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void initialize() {
        initialized = true;
    }

    @Override
    public void cleanup() {
        initialized = false;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    /**
     * @return false if an agent with the same ID is already registered
     */
    public boolean register(AgentProfile profile) {
        if (profile == null) {
            throw new IllegalArgumentException("profile is required");
        }
        if (!agentRepository.register(profile, clock.instant())) {
            log.warn("Agent {} already registered", profile.agentId());
            return false;
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agent_id", profile.agentId());
        data.put("role", profile.role().name());
        data.put("capabilities", profile.capabilities());
        eventBus.publish(Event.of(EventType.AGENT_REGISTERED, NAME, data));
        log.info("Registered agent {} ({})", profile.agentId(), profile.role());
        return true;
    }

    /**
     * @return true if the agent exists and its availability changed
     */
    public boolean setActive(String agentId, boolean active) {
        if (!agentRepository.updateActive(agentId, active, clock.instant())) {
            return false;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agent_id", agentId);
        data.put("active", active);
        eventBus.publish(Event.of(EventType.AGENT_STATUS_CHANGED, NAME, data));
        log.info("Agent {} is now {}", agentId, active ? "active" : "inactive");
        return true;
    }

    public Optional<AgentProfile> find(String agentId) {
        return agentRepository.findById(agentId);
    }

    public List<AgentProfile> findAll() {
        return agentRepository.findAll();
    }

    /** IDs of active agents with the given role. */
    public List<String> availableAgents(AgentRole role) {
        return agentRepository.findActiveByRole(role).stream()
                .map(AgentProfile::agentId)
                .toList();
    }
}
