package robotrader.core.repository;

import robotrader.core.model.AgentProfile;
import robotrader.core.model.AgentRole;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of registered agents.
 */
public interface AgentRepository {

    /**
     * Insert an agent.
     *
     * @return false if an agent with the same ID already exists
     */
    boolean register(AgentProfile profile, Instant registeredAt);

    Optional<AgentProfile> findById(String agentId);

    List<AgentProfile> findAll();

    List<AgentProfile> findActiveByRole(AgentRole role);

    /**
     * @return true if the agent exists and its flag changed
     */
    boolean updateActive(String agentId, boolean active, Instant at);

    /**
     * Record activity without changing the active flag.
     */
    boolean touch(String agentId, Instant at);
}
