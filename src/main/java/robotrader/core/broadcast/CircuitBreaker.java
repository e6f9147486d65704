package robotrader.core.broadcast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Consecutive-failure circuit breaker.
 * <p>
 * CLOSED until {@code failureThreshold} consecutive failures, then OPEN: every
 * attempt is refused without touching the transport. Once {@code recoveryTimeout}
 * has passed a single trial is admitted (HALF_OPEN). {@code successThreshold}
 * consecutive successful trials close the circuit; any failed trial opens it
 * again with a fresh cool-down.
 * <p>
 * Usage: call {@link #tryAcquire()} before each attempt and report the outcome
 * with {@link #recordSuccess()} or {@link #recordFailure()}.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    /** Notified after each phase change, outside the breaker's lock. */
    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(CircuitPhase from, CircuitPhase to, CircuitBreakerState state);
    }

    private final String name;
    private final int failureThreshold;
    private final int successThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private volatile TransitionListener listener = (from, to, state) -> {
    };

    private CircuitPhase phase = CircuitPhase.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private Instant openedAt;
    private boolean trialInFlight;
    private long trips;

    public CircuitBreaker(String name, int failureThreshold, int successThreshold, Duration recoveryTimeout,
            Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + failureThreshold);
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1, got: " + successThreshold);
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must be >= 0");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.successThreshold = successThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    public void setListener(TransitionListener listener) {
        this.listener = listener != null ? listener : (from, to, state) -> {
        };
    }

    /**
     * Ask permission for one attempt.
     *
     * @return false if the attempt must be short-circuited
     */
    public boolean tryAcquire() {
        Transition transition = null;
        boolean permitted = false;
        synchronized (this) {
            switch (phase) {
                case CLOSED -> permitted = true;
                case OPEN -> {
                    if (clock.instant().isBefore(openedAt.plus(recoveryTimeout))) {
                        permitted = false;
                    } else {
                        transition = moveTo(CircuitPhase.HALF_OPEN);
                        trialInFlight = true;
                        permitted = true;
                    }
                }
                case HALF_OPEN -> {
                    permitted = !trialInFlight;
                    trialInFlight = true;
                }
                default -> throw new IllegalStateException("Unknown phase: " + phase);
            }
        }
        notifyListener(transition);
        return permitted;
    }

    public void recordSuccess() {
        Transition transition = null;
        synchronized (this) {
            consecutiveFailures = 0;
            if (phase == CircuitPhase.HALF_OPEN) {
                trialInFlight = false;
                consecutiveSuccesses++;
                if (consecutiveSuccesses >= successThreshold) {
                    transition = moveTo(CircuitPhase.CLOSED);
                }
            }
        }
        notifyListener(transition);
    }

    public void recordFailure() {
        Transition transition = null;
        synchronized (this) {
            consecutiveSuccesses = 0;
            switch (phase) {
                case CLOSED -> {
                    consecutiveFailures++;
                    if (consecutiveFailures >= failureThreshold) {
                        transition = open();
                    }
                }
                case HALF_OPEN -> {
                    trialInFlight = false;
                    consecutiveFailures++;
                    transition = open();
                }
                case OPEN -> consecutiveFailures++;
                default -> throw new IllegalStateException("Unknown phase: " + phase);
            }
        }
        notifyListener(transition);
    }

    /** Force the circuit back to CLOSED. */
    public void reset() {
        Transition transition;
        synchronized (this) {
            consecutiveFailures = 0;
            transition = phase == CircuitPhase.CLOSED ? null : moveTo(CircuitPhase.CLOSED);
        }
        notifyListener(transition);
    }

    public synchronized CircuitBreakerState state() {
        return snapshot();
    }

    public synchronized CircuitPhase phase() {
        return phase;
    }

    public String name() {
        return name;
    }

    // ==================== Internals (hold the lock) ====================

    private Transition open() {
        openedAt = clock.instant();
        trips++;
        return moveTo(CircuitPhase.OPEN);
    }

    private Transition moveTo(CircuitPhase next) {
        CircuitPhase previous = phase;
        phase = next;
        consecutiveSuccesses = 0;
        if (next == CircuitPhase.CLOSED) {
            consecutiveFailures = 0;
            openedAt = null;
            trialInFlight = false;
        }
        return new Transition(previous, next, snapshot());
    }

    private CircuitBreakerState snapshot() {
        return new CircuitBreakerState(phase, consecutiveFailures, consecutiveSuccesses, openedAt, trips);
    }

    private void notifyListener(Transition transition) {
        if (transition == null) {
            return;
        }
        if (transition.to() == CircuitPhase.OPEN) {
            log.warn("Circuit '{}' {} -> OPEN after {} consecutive failures",
                    name, transition.from(), transition.state().consecutiveFailures());
        } else {
            log.info("Circuit '{}' {} -> {}", name, transition.from(), transition.to());
        }
        try {
            listener.onTransition(transition.from(), transition.to(), transition.state());
        } catch (RuntimeException e) {
            log.warn("Circuit '{}' transition listener failed: {}", name, e.getMessage());
        }
    }

    private record Transition(CircuitPhase from, CircuitPhase to, CircuitBreakerState state) {
    }
}
