package robotrader.core.error;

/**
 * Base type for failures raised by the orchestration core.
 * Subclasses decide whether the failed operation may be retried.
 */
public abstract class OrchestrationException extends RuntimeException {

    protected OrchestrationException(String message) {
        super(message);
    }

    protected OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether a task that failed with this exception may be attempted again.
     */
    public abstract boolean isRetryable();

    /**
     * Short name used in events and logs (e.g. "execution_error").
     */
    public abstract String errorType();
}
