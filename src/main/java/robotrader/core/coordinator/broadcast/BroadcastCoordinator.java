package robotrader.core.coordinator.broadcast;

import robotrader.core.broadcast.BroadcastMessage;
import robotrader.core.broadcast.BroadcastTransport;
import robotrader.core.broadcast.CircuitBreakerState;
import robotrader.core.coordinator.Coordinator;
import robotrader.core.coordinator.SubscriptionScope;
import robotrader.core.events.Event;
import robotrader.core.events.EventBus;
import robotrader.core.events.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Pushes aggregated status snapshots and ad-hoc messages to observers.
 * <p>
 * Listens for STATUS_AGGREGATED; the returned futures of {@link #broadcast}
 * must not be joined from an event handler.
 */
public class BroadcastCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(BroadcastCoordinator.class);

    static final String NAME = "broadcast_coordinator";

    private final BroadcastHealthCoordinator health;
    private final BroadcastExecutionCoordinator execution;
    private final SubscriptionScope subscriptions;
    private volatile boolean initialized;

    public BroadcastCoordinator(EventBus eventBus, BroadcastHealthCoordinator health,
            BroadcastExecutionCoordinator execution) {
        this.health = health;
        this.execution = execution;
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
        health.initialize();
        execution.initialize();
        subscriptions.subscribe(EventType.STATUS_AGGREGATED, this::onStatusAggregated);
        initialized = true;
        log.info("Broadcast coordinator initialized");
    }

    @Override
    public synchronized void cleanup() {
        subscriptions.close();
        execution.cleanup();
        health.cleanup();
        initialized = false;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    public void setTransport(BroadcastTransport transport) {
        execution.setTransport(transport);
    }

    /**
     * Send an ad-hoc message through the circuit breaker.
     *
     * @throws IllegalArgumentException if the type is blank
     */
    public CompletableFuture<Boolean> broadcast(String type, Map<String, Object> data) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("message type is required");
        }
        return execution.send(BroadcastMessage.of(type, data));
    }

    public Map<String, Object> getHealthMetrics() {
        return health.healthMetrics();
    }

    public boolean isCircuitOpen() {
        return health.isCircuitOpen();
    }

    public CircuitBreakerState circuitState() {
        return health.circuitState();
    }

    public void resetCircuit() {
        health.resetCircuit();
    }

    public String lastSentHash() {
        return execution.lastSentHash();
    }

    private void onStatusAggregated(Event event) {
        Map<String, Object> data = new LinkedHashMap<>(event.data());
        boolean force = Boolean.TRUE.equals(data.remove("force"));
        String hash = event.dataString("hash");
        execution.submitStatus(BroadcastMessage.of(BroadcastMessage.SYSTEM_STATUS_UPDATE, data), hash, force);
    }
}
