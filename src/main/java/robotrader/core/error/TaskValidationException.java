package robotrader.core.error;

/**
 * A task that can never succeed: malformed payload, unknown task type,
 * or an executor rejecting its input. Always terminal.
 */
public class TaskValidationException extends OrchestrationException {

    public TaskValidationException(String message) {
        super(message);
    }

    public TaskValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }

    @Override
    public String errorType() {
        return "validation_error";
    }
}
