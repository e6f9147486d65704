package robotrader.core.events;

import java.util.Objects;
import java.util.UUID;

/**
 * Handle returned by {@link EventBus#subscribe}. Closing it unsubscribes;
 * closing twice is harmless.
 */
public final class Subscription implements AutoCloseable {

    private final String id = UUID.randomUUID().toString();
    private final EventType type;
    private final String owner;
    private final EventHandler handler;
    private final EventBus bus;

    Subscription(EventBus bus, EventType type, String owner, EventHandler handler) {
        this.bus = bus;
        this.type = Objects.requireNonNull(type, "type");
        this.owner = owner;
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    public String id() {
        return id;
    }

    public EventType type() {
        return type;
    }

    /** Name of the component that subscribed, used in logs and dead letters. */
    public String owner() {
        return owner;
    }

    EventHandler handler() {
        return handler;
    }

    public void unsubscribe() {
        bus.unsubscribe(this);
    }

    @Override
    public void close() {
        unsubscribe();
    }

    @Override
    public String toString() {
        return "Subscription{type=" + type + ", owner='" + owner + "'}";
    }
}
