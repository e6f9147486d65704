package robotrader.core.error;

/**
 * A broadcast could not be delivered through the transport.
 * Never fatal: the broadcast circuit breaker absorbs it.
 */
public class BroadcastException extends OrchestrationException {

    public BroadcastException(String message) {
        super(message);
    }

    public BroadcastException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    @Override
    public String errorType() {
        return "broadcast_error";
    }
}
