package robotrader.core.coordinator.broadcast;

import robotrader.core.broadcast.BroadcastMetrics;
import robotrader.core.broadcast.CircuitBreaker;
import robotrader.core.broadcast.CircuitBreakerState;
import robotrader.core.broadcast.CircuitPhase;
import robotrader.core.broadcast.ErrorSeverity;
import robotrader.core.config.CoordinatorConfig;
import robotrader.core.coordinator.Coordinator;
import robotrader.core.events.Event;
import robotrader.core.events.EventBus;
import robotrader.core.events.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Guards the broadcast transport with a circuit breaker and keeps delivery metrics.
 * Every phase change is published as BROADCAST_CIRCUIT_CHANGED.
 */
public class BroadcastHealthCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(BroadcastHealthCoordinator.class);

    static final String NAME = "broadcast_health_coordinator";

    private final EventBus eventBus;
    private final CircuitBreaker circuitBreaker;
    private final BroadcastMetrics metrics = new BroadcastMetrics();
    private volatile boolean initialized;

    public BroadcastHealthCoordinator(EventBus eventBus, CoordinatorConfig config, Clock clock) {
        this.eventBus = eventBus;
        this.circuitBreaker = new CircuitBreaker("broadcast",
                config.broadcastFailureThreshold(),
                config.broadcastSuccessThreshold(),
                config.broadcastRecoveryTimeout(),
                clock);
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
        circuitBreaker.setListener(this::publishTransition);
        initialized = true;
    }

    @Override
    public synchronized void cleanup() {
        circuitBreaker.setListener(null);
        initialized = false;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Ask the breaker for one send attempt. A refusal is counted as short-circuited.
     */
    public boolean tryAcquire() {
        if (circuitBreaker.tryAcquire()) {
            return true;
        }
        metrics.recordShortCircuit();
        log.debug("Broadcast short-circuited, circuit is {}", circuitBreaker.phase());
        return false;
    }

    public void recordSuccess(long sendTimeMs) {
        metrics.recordSuccess(sendTimeMs);
        circuitBreaker.recordSuccess();
    }

    public ErrorSeverity recordFailure(Throwable error) {
        ErrorSeverity severity = ErrorSeverity.classify(error);
        metrics.recordFailure(error, severity);
        circuitBreaker.recordFailure();

        String message = error == null ? "unknown error" : error.getMessage();
        switch (severity) {
            case CRITICAL, HIGH -> log.error("Broadcast failed ({}): {}", severity, message);
            case MEDIUM -> log.warn("Broadcast failed ({}): {}", severity, message);
            default -> log.debug("Broadcast failed ({}): {}", severity, message);
        }
        return severity;
    }

    public Map<String, Object> healthMetrics() {
        CircuitBreakerState state = circuitBreaker.state();
        Map<String, Object> map = new LinkedHashMap<>(metrics.toMap());
        map.put("circuit_state", state.phase());
        map.put("circuit_trips", state.trips());
        map.put("consecutive_failures", state.consecutiveFailures());
        return map;
    }

    public CircuitBreakerState circuitState() {
        return circuitBreaker.state();
    }

    public boolean isCircuitOpen() {
        return circuitBreaker.phase() == CircuitPhase.OPEN;
    }

    public void resetCircuit() {
        circuitBreaker.reset();
    }

    public BroadcastMetrics metrics() {
        return metrics;
    }

    private void publishTransition(CircuitPhase from, CircuitPhase to, CircuitBreakerState state) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("from", from.name());
        data.put("to", to.name());
        data.put("consecutive_failures", state.consecutiveFailures());
        data.put("trips", state.trips());
        eventBus.publish(Event.of(EventType.BROADCAST_CIRCUIT_CHANGED, NAME, data));
    }
}
