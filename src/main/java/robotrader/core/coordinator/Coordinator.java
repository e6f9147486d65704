package robotrader.core.coordinator;

/**
 * Lifecycle capability shared by every coordinator.
 * <p>
 * Coordinators talk to other domains only through the event bus; an
 * orchestrating coordinator calls its own sub-coordinators directly.
 */
public interface Coordinator {

    /** Stable name used in logs and as event source. */
    String name();

    /** Subscribe to events and acquire resources. Called once, before use. */
    void initialize();

    /** Release subscriptions and resources. Safe to call more than once. */
    void cleanup();

    boolean isInitialized();
}
