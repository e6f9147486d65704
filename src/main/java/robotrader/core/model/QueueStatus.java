package robotrader.core.model;

/**
 * Derived health of a queue.
 */
public enum QueueStatus {
    /** Nothing pending or running */
    IDLE,
    /** Has pending or running work */
    RUNNING,
    /** Recent failures outweigh recent successes */
    DEGRADED
}
