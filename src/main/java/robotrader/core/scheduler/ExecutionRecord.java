package robotrader.core.scheduler;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One entry of a queue worker's execution history.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionRecord(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("task_type") String taskType,
        @JsonProperty("outcome") ExecutionOutcome outcome,
        @JsonProperty("duration_ms") long durationMs,
        @JsonProperty("finished_at") Instant finishedAt,
        @JsonProperty("error") String error) {
}
