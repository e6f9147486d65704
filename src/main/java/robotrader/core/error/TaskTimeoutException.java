package robotrader.core.error;

import java.time.Duration;

/**
 * A task exceeded its execution timeout, or was found stalled in RUNNING.
 */
public class TaskTimeoutException extends OrchestrationException {

    public TaskTimeoutException(String taskId, Duration timeout) {
        super("Task " + taskId + " timed out after " + timeout.toMillis() + "ms");
    }

    public TaskTimeoutException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    @Override
    public String errorType() {
        return "timeout_error";
    }
}
