package robotrader.core.events;

import java.time.Instant;
import java.util.List;

/**
 * Durable record of published events and failed deliveries.
 */
public interface EventJournal {

    /** Journal that records nothing. */
    EventJournal NOOP = new EventJournal() {
        @Override
        public void append(Event event) {
        }

        @Override
        public void markProcessed(String eventId) {
        }

        @Override
        public void deadLetter(Event event, String handler, Throwable error) {
        }

        @Override
        public List<Event> findBetween(Instant from, Instant to) {
            return List.of();
        }

        @Override
        public List<Event> findPending(int limit) {
            return List.of();
        }

        @Override
        public List<DeadLetter> findDeadLetters(int limit) {
            return List.of();
        }

        @Override
        public int countDeadLetters() {
            return 0;
        }
    };

    /**
     * Store a newly published event with status PENDING.
     */
    void append(Event event);

    /**
     * Mark an event as delivered to all handlers.
     */
    void markProcessed(String eventId);

    /**
     * Record that a handler failed on an event.
     *
     * @param handler owner name of the failing subscription
     */
    void deadLetter(Event event, String handler, Throwable error);

    /**
     * Events published within [from, to), oldest first.
     */
    List<Event> findBetween(Instant from, Instant to);

    /**
     * Events that were appended but never marked processed.
     */
    List<Event> findPending(int limit);

    /**
     * Most recent failed deliveries, newest first.
     */
    List<DeadLetter> findDeadLetters(int limit);

    int countDeadLetters();
}
