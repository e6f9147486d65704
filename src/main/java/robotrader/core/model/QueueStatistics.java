package robotrader.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Totals across all queues.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueueStatistics(
        @JsonProperty("queue_count") int queueCount,
        @JsonProperty("pending") int pending,
        @JsonProperty("running") int running,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("success_rate") double successRate,
        @JsonProperty("average_duration_ms") Long averageDurationMs,
        @JsonProperty("busiest_queue") String busiestQueue,
        @JsonProperty("degraded_queues") int degradedQueues) {
}
