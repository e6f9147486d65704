package robotrader.core.coordinator;

import robotrader.core.events.EventBus;
import robotrader.core.events.EventHandler;
import robotrader.core.events.EventType;
import robotrader.core.events.Subscription;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Subscriptions owned by one coordinator, released together on cleanup.
 */
public final class SubscriptionScope implements AutoCloseable {

    private final EventBus eventBus;
    private final String owner;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    public SubscriptionScope(EventBus eventBus, String owner) {
        this.eventBus = eventBus;
        this.owner = owner;
    }

    public Subscription subscribe(EventType type, EventHandler handler) {
        Subscription subscription = eventBus.subscribe(type, owner, handler);
        subscriptions.add(subscription);
        return subscription;
    }

    public int size() {
        return subscriptions.size();
    }

    @Override
    public void close() {
        for (Subscription subscription : subscriptions) {
            subscription.unsubscribe();
        }
        subscriptions.clear();
    }
}
