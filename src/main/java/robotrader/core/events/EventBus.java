package robotrader.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Typed publish/subscribe hub.
 * <p>
 * Handlers for a type are invoked synchronously, in registration order, on the
 * publishing thread. {@link #publish} returns once every handler has run. A
 * failing handler is logged and recorded in the journal; it never affects the
 * remaining handlers or the publisher.
 * <p>
 * Publishes are serialized, so every subscriber observes the same global order.
 * The lock is re-entrant: a handler may publish, and the nested event is fully
 * delivered before the outer delivery continues.
 */
public final class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Handler lists keyed by type. The map itself is never mutated after construction. */
    private final Map<EventType, CopyOnWriteArrayList<Subscription>> subscriptions;
    private final EventJournal journal;
    private final ReentrantLock publishLock = new ReentrantLock();

    private final AtomicLong published = new AtomicLong();
    private final AtomicLong handlerFailures = new AtomicLong();

    public EventBus() {
        this(EventJournal.NOOP);
    }

    public EventBus(EventJournal journal) {
        this.journal = journal;
        EnumMap<EventType, CopyOnWriteArrayList<Subscription>> table = new EnumMap<>(EventType.class);
        for (EventType type : EventType.values()) {
            table.put(type, new CopyOnWriteArrayList<>());
        }
        this.subscriptions = Collections.unmodifiableMap(table);
    }

    /**
     * Subscribe a handler to one event type.
     *
     * @param type    event type to receive
     * @param owner   name of the subscribing component (for logs and dead letters)
     * @param handler callback
     * @return handle used to unsubscribe
     */
    public Subscription subscribe(EventType type, String owner, EventHandler handler) {
        Subscription subscription = new Subscription(this, type, owner, handler);
        subscriptions.get(type).add(subscription);
        log.debug("{} subscribed to {}", owner, type);
        return subscription;
    }

    public Subscription subscribe(EventType type, EventHandler handler) {
        return subscribe(type, "anonymous", handler);
    }

    /**
     * Remove a subscription. Unknown or already removed handles are ignored.
     */
    public void unsubscribe(Subscription subscription) {
        if (subscription == null) {
            return;
        }
        if (subscriptions.get(subscription.type()).remove(subscription)) {
            log.debug("{} unsubscribed from {}", subscription.owner(), subscription.type());
        }
    }

    /**
     * Deliver an event to every current subscriber of its type.
     */
    public void publish(Event event) {
        publishLock.lock();
        try {
            published.incrementAndGet();
            appendToJournal(event);
            deliver(event);
            markProcessed(event);
        } finally {
            publishLock.unlock();
        }
    }

    /**
     * Re-deliver journaled events published within [from, to) to the current
     * subscribers. Replayed events are not journaled again.
     *
     * @return number of events replayed
     */
    public int replay(Instant from, Instant to) {
        List<Event> events = journal.findBetween(from, to);
        publishLock.lock();
        try {
            for (Event event : events) {
                deliver(event);
                markProcessed(event);
            }
        } finally {
            publishLock.unlock();
        }
        log.info("Replayed {} events between {} and {}", events.size(), from, to);
        return events.size();
    }

    private void deliver(Event event) {
        // Snapshot: concurrent subscribe/unsubscribe does not affect this delivery
        Object[] snapshot = subscriptions.get(event.type()).toArray();
        if (snapshot.length == 0) {
            log.trace("No subscribers for {}", event.type());
            return;
        }
        for (Object entry : snapshot) {
            deliverSafely((Subscription) entry, event);
        }
    }

    private void deliverSafely(Subscription subscription, Event event) {
        try {
            subscription.handler().handle(event);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            handlerFailures.incrementAndGet();
            log.error("Event handler {} failed on {} ({})",
                    subscription.owner(), event.type().wireName(), event.id(), e);
            try {
                journal.deadLetter(event, subscription.owner(), e);
            } catch (RuntimeException journalError) {
                log.warn("Could not record dead letter for event {}: {}", event.id(), journalError.getMessage());
            }
        }
    }

    private void appendToJournal(Event event) {
        try {
            journal.append(event);
        } catch (RuntimeException e) {
            log.warn("Could not journal event {} ({}): {}", event.id(), event.type(), e.getMessage());
        }
    }

    private void markProcessed(Event event) {
        try {
            journal.markProcessed(event.id());
        } catch (RuntimeException e) {
            log.warn("Could not mark event {} processed: {}", event.id(), e.getMessage());
        }
    }

    public int subscriberCount(EventType type) {
        return subscriptions.get(type).size();
    }

    public int totalSubscriptions() {
        int total = 0;
        for (List<Subscription> list : subscriptions.values()) {
            total += list.size();
        }
        return total;
    }

    public long publishedCount() {
        return published.get();
    }

    public long handlerFailureCount() {
        return handlerFailures.get();
    }

    public EventJournal journal() {
        return journal;
    }
}
