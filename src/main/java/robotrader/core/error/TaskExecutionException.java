package robotrader.core.error;

/**
 * Failure raised by a domain executor while running a task.
 */
public class TaskExecutionException extends OrchestrationException {

    public TaskExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    @Override
    public String errorType() {
        return "execution_error";
    }
}
