package robotrader.core.model;

/**
 * Lifecycle status of a queued task.
 */
public enum TaskStatus {
    /** Waiting in its queue */
    PENDING,
    /** Being executed by the queue worker */
    RUNNING,
    /** Finished successfully */
    COMPLETED,
    /** Failed with no retries left, or failed validation */
    FAILED,
    /** Cancelled before completion */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
