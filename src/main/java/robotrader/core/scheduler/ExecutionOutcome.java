package robotrader.core.scheduler;

/**
 * How one execution attempt ended.
 */
public enum ExecutionOutcome {
    COMPLETED,
    RETRY_SCHEDULED,
    FAILED,
    CANCELLED
}
