package robotrader.core.broadcast;

public enum CircuitPhase {
    /** Sends pass through. */
    CLOSED,
    /** Sends are short-circuited until the cool-down expires. */
    OPEN,
    /** One trial send at a time decides between CLOSED and OPEN. */
    HALF_OPEN
}
