package robotrader.core.scheduler;

import robotrader.core.error.OrchestrationException;
import robotrader.core.events.Event;
import robotrader.core.events.EventType;
import robotrader.core.model.Task;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the task lifecycle events emitted by the scheduler and the reaper.
 */
final class TaskEvents {

    static final String SOURCE = "queue_scheduler";

    private TaskEvents() {
    }

    static Event created(Task task) {
        Map<String, Object> data = base(task);
        data.put("max_retries", task.maxRetries());
        return Event.of(EventType.TASK_CREATED, SOURCE, data);
    }

    static Event started(Task task) {
        Map<String, Object> data = base(task);
        data.put("started_at", String.valueOf(task.startedAt()));
        return Event.of(EventType.TASK_STARTED, SOURCE, data);
    }

    static Event completed(Task task, long durationMs, Map<String, Object> result) {
        Map<String, Object> data = base(task);
        data.put("duration_ms", durationMs);
        data.put("result", result == null ? Map.of() : result);
        return Event.of(EventType.TASK_COMPLETED, SOURCE, data);
    }

    static Event failed(Task task, OrchestrationException error, boolean willRetry, long retryDelayMs,
            Long durationMs) {
        Map<String, Object> data = base(task);
        data.put("error", error.getMessage());
        data.put("error_type", error.errorType());
        data.put("will_retry", willRetry);
        data.put("retry_delay_ms", retryDelayMs);
        if (durationMs != null) {
            data.put("duration_ms", durationMs);
        }
        return Event.of(EventType.TASK_FAILED, SOURCE, data);
    }

    static Event cancelled(Task task, String reason) {
        Map<String, Object> data = base(task);
        data.put("reason", reason);
        return Event.of(EventType.TASK_CANCELLED, SOURCE, data);
    }

    private static Map<String, Object> base(Task task) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("task_id", task.taskId());
        data.put("queue_name", task.queueName());
        data.put("task_type", task.taskType());
        data.put("priority", task.priority());
        data.put("retry_count", task.retryCount());
        return data;
    }
}
