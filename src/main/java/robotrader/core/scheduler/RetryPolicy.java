package robotrader.core.scheduler;

/**
 * Strategy for computing the delay before a failed task is attempted again.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param attempt the retry about to be scheduled (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempt);
}
