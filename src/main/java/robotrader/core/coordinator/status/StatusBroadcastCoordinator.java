package robotrader.core.coordinator.status;

import robotrader.core.coordinator.Coordinator;
import robotrader.core.coordinator.SubscriptionScope;
import robotrader.core.events.Event;
import robotrader.core.events.EventBus;
import robotrader.core.events.EventType;
import robotrader.core.util.Debouncer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns state-change events into fresh status snapshots.
 * <p>
 * Bursts of changes are debounced into one aggregation, run off the
 * publishing thread. Each snapshot is published as STATUS_AGGREGATED with its
 * hash and a {@code force} flag; the broadcast domain decides whether to send.
 */
public class StatusBroadcastCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(StatusBroadcastCoordinator.class);

    static final String NAME = "status_broadcast_coordinator";

    private static final List<EventType> STATE_CHANGES = List.of(
            EventType.QUEUE_STATUS_CHANGED,
            EventType.AGENT_REGISTERED,
            EventType.AGENT_STATUS_CHANGED,
            EventType.BROADCAST_CIRCUIT_CHANGED);

    private final EventBus eventBus;
    private final StatusAggregationCoordinator aggregation;
    private final Duration debounce;
    private final SubscriptionScope subscriptions;
    private final AtomicBoolean forcePending = new AtomicBoolean();

    private Debouncer debouncer;
    private volatile StatusSnapshot lastSnapshot;
    private volatile boolean initialized;

    public StatusBroadcastCoordinator(EventBus eventBus, StatusAggregationCoordinator aggregation,
            Duration debounce) {
        this.eventBus = eventBus;
        this.aggregation = aggregation;
        this.debounce = debounce;
        this.subscriptions = new SubscriptionScope(eventBus, NAME);
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
        debouncer = new Debouncer("status-refresh", debounce.toMillis());
        for (EventType type : STATE_CHANGES) {
            subscriptions.subscribe(type, this::onStateChange);
        }
        initialized = true;
    }

    @Override
    public synchronized void cleanup() {
        subscriptions.close();
        if (debouncer != null) {
            debouncer.close();
            debouncer = null;
        }
        initialized = false;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Schedule a debounced refresh. A forced request stays forced even if
     * unforced requests arrive before it runs.
     */
    public synchronized void requestRefresh(boolean force) {
        if (force) {
            forcePending.set(true);
        }
        if (debouncer != null) {
            debouncer.submit(() -> refreshNow(false));
        }
    }

    /**
     * Aggregate now and publish the snapshot.
     *
     * @param force ask the broadcast domain to send even an unchanged snapshot
     */
    public StatusSnapshot refreshNow(boolean force) {
        boolean forced = forcePending.getAndSet(false) || force;
        StatusSnapshot snapshot = aggregation.aggregate();
        lastSnapshot = snapshot;

        Map<String, Object> data = snapshot.toData();
        data.put("force", forced);
        eventBus.publish(Event.of(EventType.STATUS_AGGREGATED, NAME, data));
        log.debug("Status aggregated: {} ({})", snapshot.status(), snapshot.hash());
        return snapshot;
    }

    public StatusSnapshot lastSnapshot() {
        return lastSnapshot;
    }

    private void onStateChange(Event event) {
        requestRefresh(false);
    }
}
