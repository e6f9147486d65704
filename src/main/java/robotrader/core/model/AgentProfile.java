package robotrader.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A registered agent and its availability.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentProfile(
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("role") AgentRole role,
        @JsonProperty("capabilities") List<String> capabilities,
        @JsonProperty("active") boolean active,
        @JsonProperty("registered_at") Instant registeredAt,
        @JsonProperty("last_active_at") Instant lastActiveAt) {

    public AgentProfile {
        Objects.requireNonNull(agentId, "agentId is required");
        Objects.requireNonNull(role, "role is required");
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    public static AgentProfile of(String agentId, AgentRole role, List<String> capabilities) {
        return new AgentProfile(agentId, role, capabilities, true, null, null);
    }
}
