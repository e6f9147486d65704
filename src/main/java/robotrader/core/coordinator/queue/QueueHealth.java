package robotrader.core.coordinator.queue;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Result of a queue domain health check.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueueHealth(
        @JsonProperty("healthy") boolean healthy,
        @JsonProperty("total_queues") int totalQueues,
        @JsonProperty("running_queues") int runningQueues,
        @JsonProperty("degraded_queues") List<String> degradedQueues,
        @JsonProperty("error") String error,
        @JsonProperty("checked_at") Instant checkedAt) {

    public static QueueHealth failed(String error) {
        return new QueueHealth(false, 0, 0, List.of(), error, Instant.now());
    }
}
