package robotrader.core.coordinator.status;

import robotrader.core.coordinator.Coordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the status domain.
 */
public class StatusCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(StatusCoordinator.class);

    static final String NAME = "status_coordinator";

    private final StatusAggregationCoordinator aggregation;
    private final StatusBroadcastCoordinator broadcast;
    private volatile boolean initialized;

    public StatusCoordinator(StatusAggregationCoordinator aggregation, StatusBroadcastCoordinator broadcast) {
        this.aggregation = aggregation;
        this.broadcast = broadcast;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        aggregation.initialize();
        broadcast.initialize();
        initialized = true;
        log.info("Status coordinator initialized");
    }

    @Override
    public synchronized void cleanup() {
        broadcast.cleanup();
        aggregation.cleanup();
        initialized = false;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    /** Fresh snapshot, not published. */
    public StatusSnapshot getSystemStatus() {
        return aggregation.aggregate();
    }

    /** Latest published snapshot, or null before the first refresh. */
    public StatusSnapshot lastSnapshot() {
        return broadcast.lastSnapshot();
    }

    /** Periodic refresh: publishes, but an unchanged snapshot is not re-sent. */
    public void refreshNow() {
        broadcast.refreshNow(false);
    }

    /** Publish a snapshot that is sent even if unchanged (e.g. a new observer connected). */
    public void forceRefresh() {
        broadcast.requestRefresh(true);
    }

    public void requestRefresh() {
        broadcast.requestRefresh(false);
    }

    public StatusAggregationCoordinator aggregation() {
        return aggregation;
    }
}
