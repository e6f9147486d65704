package robotrader.core.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("running_queues") Integer runningQueues,
        @JsonProperty("pending_tasks") Integer pendingTasks,
        @JsonProperty("running_tasks") Integer runningTasks,
        @JsonProperty("broadcast_circuit") String broadcastCircuit) {

    public static HealthResponse healthy(String uptime, String version, int runningQueues, int pendingTasks,
            int runningTasks, String broadcastCircuit) {
        return new HealthResponse("healthy", "ok", uptime, version, runningQueues, pendingTasks, runningTasks,
                broadcastCircuit);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null);
    }
}
