package robotrader.core.scheduler;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Liveness view of one queue worker.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerStatus(
        @JsonProperty("queue_name") String queueName,
        @JsonProperty("running") boolean running,
        @JsonProperty("current_task_id") String currentTaskId,
        @JsonProperty("current_task_type") String currentTaskType,
        @JsonProperty("current_task_started_at") Instant currentTaskStartedAt,
        @JsonProperty("executed") long executed,
        @JsonProperty("failed") long failed,
        @JsonProperty("store_errors") long storeErrors) {
}
