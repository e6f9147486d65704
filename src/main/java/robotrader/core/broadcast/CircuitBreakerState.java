package robotrader.core.broadcast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Point-in-time view of a {@link CircuitBreaker}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CircuitBreakerState(
        @JsonProperty("phase") CircuitPhase phase,
        @JsonProperty("consecutive_failures") int consecutiveFailures,
        @JsonProperty("consecutive_successes") int consecutiveSuccesses,
        @JsonProperty("opened_at") Instant openedAt,
        @JsonProperty("trips") long trips) {

    public boolean isOpen() {
        return phase == CircuitPhase.OPEN;
    }
}
