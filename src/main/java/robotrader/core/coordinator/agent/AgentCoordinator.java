package robotrader.core.coordinator.agent;

import robotrader.core.coordinator.Coordinator;
import robotrader.core.model.AgentProfile;
import robotrader.core.model.AgentRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Entry point of the agent domain.
 */
public class AgentCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(AgentCoordinator.class);

    static final String NAME = "agent_coordinator";

    private final AgentRegistrationCoordinator registration;
    private final AgentActivityCoordinator activity;
    private volatile boolean initialized;

    public AgentCoordinator(AgentRegistrationCoordinator registration, AgentActivityCoordinator activity) {
        this.registration = registration;
        this.activity = activity;
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
        registration.initialize();
        activity.initialize();
        initialized = true;
        log.info("Agent coordinator initialized");
    }

    @Override
    public synchronized void cleanup() {
        activity.cleanup();
        registration.cleanup();
        initialized = false;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    public boolean registerAgent(AgentProfile profile) {
        return registration.register(profile);
    }

    public boolean setAgentActive(String agentId, boolean active) {
        return registration.setActive(agentId, active);
    }

    public Optional<AgentProfile> getAgent(String agentId) {
        return registration.find(agentId);
    }

    public List<AgentProfile> getAgents() {
        return registration.findAll();
    }

    public List<String> getAvailableAgents(AgentRole role) {
        return registration.availableAgents(role);
    }

    public long messageCount(String agentId) {
        return activity.messageCount(agentId);
    }
}
