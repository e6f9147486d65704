package robotrader.core.broadcast;

import robotrader.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;
    private List<String> transitions;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-02T10:00:00Z");
        breaker = new CircuitBreaker("test", 5, 3, Duration.ofSeconds(60), clock);
        transitions = new ArrayList<>();
        breaker.setListener((from, to, state) -> transitions.add(from + "->" + to));
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            assertTrue(breaker.tryAcquire());
            breaker.recordFailure();
        }
    }

    @Test
    void opensAfterConsecutiveFailures() {
        fail(4);
        assertEquals(CircuitPhase.CLOSED, breaker.phase());

        fail(1);
        assertEquals(CircuitPhase.OPEN, breaker.phase());
        assertEquals(1, breaker.state().trips());
        assertEquals(List.of("CLOSED->OPEN"), transitions);
    }

    @Test
    void successResetsTheFailureCount() {
        fail(4);
        breaker.tryAcquire();
        breaker.recordSuccess();
        fail(4);

        assertEquals(CircuitPhase.CLOSED, breaker.phase());
        assertEquals(4, breaker.state().consecutiveFailures());
    }

    @Test
    void refusesAttemptsUntilRecoveryTimeoutPasses() {
        fail(5);

        clock.advance(Duration.ofSeconds(59));
        assertFalse(breaker.tryAcquire());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(breaker.tryAcquire());
        assertEquals(CircuitPhase.HALF_OPEN, breaker.phase());
    }

    @Test
    void halfOpenAdmitsOneTrialAtATime() {
        fail(5);
        clock.advance(Duration.ofSeconds(60));

        assertTrue(breaker.tryAcquire());
        assertFalse(breaker.tryAcquire(), "second concurrent trial");
        breaker.recordSuccess();
        assertTrue(breaker.tryAcquire());
    }

    @Test
    void closesAfterEnoughTrialSuccesses() {
        fail(5);
        clock.advance(Duration.ofSeconds(61));

        for (int i = 0; i < 3; i++) {
            assertTrue(breaker.tryAcquire());
            breaker.recordSuccess();
        }

        assertEquals(CircuitPhase.CLOSED, breaker.phase());
        assertEquals(List.of("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED"), transitions);
    }

    @Test
    void trialFailureReopensAndRestartsTheCooldown() {
        fail(5);
        clock.advance(Duration.ofSeconds(60));
        assertTrue(breaker.tryAcquire());
        breaker.recordFailure();

        assertEquals(CircuitPhase.OPEN, breaker.phase());
        assertEquals(2, breaker.state().trips());
        clock.advance(Duration.ofSeconds(30));
        assertFalse(breaker.tryAcquire());
    }

    @Test
    void resetClosesImmediately() {
        fail(5);
        breaker.reset();

        assertEquals(CircuitPhase.CLOSED, breaker.phase());
        assertTrue(breaker.tryAcquire());
        assertEquals(0, breaker.state().consecutiveFailures());
    }

    @Test
    void listenerFailureDoesNotBreakTheBreaker() {
        breaker.setListener((from, to, state) -> {
            throw new IllegalStateException("listener down");
        });
        fail(5);
        assertEquals(CircuitPhase.OPEN, breaker.phase());
    }

    @Test
    void rejectsInvalidThresholds() {
        assertThrows(IllegalArgumentException.class,
                () -> new CircuitBreaker("bad", 0, 1, Duration.ofSeconds(1), clock));
        assertThrows(IllegalArgumentException.class,
                () -> new CircuitBreaker("bad", 1, 0, Duration.ofSeconds(1), clock));
    }
}
