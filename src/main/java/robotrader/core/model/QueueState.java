package robotrader.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Point-in-time state of one queue, computed from persisted task rows.
 * Never stored. Completed and failed counts cover the statistics window.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueueState(
        @JsonProperty("name") String name,
        @JsonProperty("status") QueueStatus status,
        @JsonProperty("pending_count") int pendingCount,
        @JsonProperty("running_count") int runningCount,
        @JsonProperty("completed_count") int completedCount,
        @JsonProperty("failed_count") int failedCount,
        @JsonProperty("success_rate") double successRate,
        @JsonProperty("average_duration_ms") Long averageDurationMs,
        @JsonProperty("current_task_id") String currentTaskId,
        @JsonProperty("current_task_type") String currentTaskType,
        @JsonProperty("current_task_started_at") Instant currentTaskStartedAt,
        @JsonProperty("last_activity_at") Instant lastActivityAt) {

    /** Success rate below which a queue with failures is DEGRADED. */
    public static final double DEGRADED_SUCCESS_RATE = 50.0;

    /**
     * Build a state from raw counts, deriving success rate and status.
     */
    public static QueueState of(String name, int pending, int running, int completed, int failed,
            Long averageDurationMs, Task current, Instant lastActivityAt) {
        double successRate = successRate(completed, failed);
        return new QueueState(
                name,
                deriveStatus(pending, running, failed, successRate),
                pending,
                running,
                completed,
                failed,
                successRate,
                averageDurationMs,
                current != null ? current.taskId() : null,
                current != null ? current.taskType() : null,
                current != null ? current.startedAt() : null,
                lastActivityAt);
    }

    public static QueueState empty(String name) {
        return of(name, 0, 0, 0, 0, null, null, null);
    }

    static double successRate(int completed, int failed) {
        int finished = completed + failed;
        if (finished == 0) {
            return 100.0;
        }
        return Math.round(completed * 10000.0 / finished) / 100.0;
    }

    static QueueStatus deriveStatus(int pending, int running, int failed, double successRate) {
        if (failed > 0 && successRate < DEGRADED_SUCCESS_RATE) {
            return QueueStatus.DEGRADED;
        }
        if (running > 0 || pending > 0) {
            return QueueStatus.RUNNING;
        }
        return QueueStatus.IDLE;
    }

    public boolean isBusy() {
        return runningCount > 0;
    }
}
