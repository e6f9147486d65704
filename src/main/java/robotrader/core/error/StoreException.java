package robotrader.core.error;

/**
 * The persistent store could not be reached or rejected a statement.
 */
public class StoreException extends OrchestrationException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    @Override
    public String errorType() {
        return "store_error";
    }
}
