package robotrader.core.coordinator.queue;

import robotrader.core.coordinator.Coordinator;
import robotrader.core.coordinator.SubscriptionScope;
import robotrader.core.events.Event;
import robotrader.core.events.EventBus;
import robotrader.core.events.EventType;
import robotrader.core.model.Task;
import robotrader.core.scheduler.QueueScheduler;
import robotrader.core.scheduler.TaskRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reacts to task and queue events:
 * - republishes them as QUEUE_STATUS_CHANGED for the affected queue
 * - fires registered {@link EventTrigger}s, enqueuing follow-up tasks
 */
public class QueueEventCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(QueueEventCoordinator.class);

    static final String NAME = "queue_event_coordinator";

    /** Maximum nesting of trigger firings on one thread. */
    static final int MAX_TRIGGER_DEPTH = 4;

    private static final List<EventType> QUEUE_EVENTS = List.of(
            EventType.TASK_CREATED,
            EventType.TASK_STARTED,
            EventType.TASK_COMPLETED,
            EventType.TASK_FAILED,
            EventType.TASK_CANCELLED,
            EventType.QUEUE_STARTED,
            EventType.QUEUE_STOPPED);

    private final EventBus eventBus;
    private final QueueScheduler scheduler;
    private final SubscriptionScope subscriptions;
    private final Map<String, EventTrigger> triggers = new ConcurrentHashMap<>();
    private final ThreadLocal<Integer> triggerDepth = ThreadLocal.withInitial(() -> 0);
    private volatile boolean initialized;

    public QueueEventCoordinator(EventBus eventBus, QueueScheduler scheduler) {
        this.eventBus = eventBus;
        this.scheduler = scheduler;
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
        for (EventType type : QUEUE_EVENTS) {
            subscriptions.subscribe(type, this::onQueueEvent);
        }
        for (EventType type : EventType.values()) {
            if (type != EventType.QUEUE_STATUS_CHANGED) {
                subscriptions.subscribe(type, this::fireTriggers);
            }
        }
        initialized = true;
        log.info("Queue event coordinator initialized with {} triggers", triggers.size());
    }

    @Override
    public synchronized void cleanup() {
        subscriptions.close();
        initialized = false;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    // ==================== Triggers ====================

    /**
     * @throws IllegalArgumentException if the trigger feeds its own source queue,
     *                                  targets an unknown queue or reuses a name
     */
    public void registerTrigger(EventTrigger trigger) {
        if (trigger.isSelfFeeding()) {
            throw new IllegalArgumentException("Trigger " + trigger.name()
                    + " would feed its own source queue: " + trigger.sourceQueue());
        }
        if (!scheduler.hasQueue(trigger.targetQueue())) {
            throw new IllegalArgumentException("Unknown target queue: " + trigger.targetQueue());
        }
        if (triggers.putIfAbsent(trigger.name(), trigger) != null) {
            throw new IllegalArgumentException("Trigger already registered: " + trigger.name());
        }
        log.info("Registered trigger {}: {} -> {} ({})",
                trigger.name(), trigger.eventType().wireName(), trigger.targetQueue(), trigger.taskType());
    }

    public boolean unregisterTrigger(String name) {
        return triggers.remove(name) != null;
    }

    public List<EventTrigger> triggers() {
        List<EventTrigger> list = new ArrayList<>(triggers.values());
        list.sort(Comparator.comparing(EventTrigger::name));
        return list;
    }

    /**
     * Run the triggers matching an event.
     *
     * @return tasks created
     */
    public List<Task> fireTriggers(Event event) {
        List<EventTrigger> matching = new ArrayList<>();
        for (EventTrigger trigger : triggers.values()) {
            if (trigger.matches(event)) {
                matching.add(trigger);
            }
        }
        if (matching.isEmpty()) {
            return List.of();
        }
        matching.sort(Comparator.comparingInt(EventTrigger::priority).thenComparing(EventTrigger::name));

        // TASK_CREATED triggers re-enter here synchronously through enqueue
        int depth = triggerDepth.get();
        if (depth >= MAX_TRIGGER_DEPTH) {
            log.warn("Trigger chain for event {} ({}) exceeded depth {}, skipping {} triggers",
                    event.id(), event.type().wireName(), MAX_TRIGGER_DEPTH, matching.size());
            return List.of();
        }
        triggerDepth.set(depth + 1);
        try {
            return enqueueFor(matching, event);
        } finally {
            if (depth == 0) {
                triggerDepth.remove();
            } else {
                triggerDepth.set(depth);
            }
        }
    }

    private List<Task> enqueueFor(List<EventTrigger> matching, Event event) {
        List<Task> created = new ArrayList<>();
        for (EventTrigger trigger : matching) {
            try {
                Task task = scheduler.enqueue(new TaskRequest(trigger.targetQueue(), trigger.taskType(),
                        buildPayload(trigger, event), trigger.priority(), null));
                created.add(task);
                log.info("Trigger {} created task {} on queue '{}'",
                        trigger.name(), task.taskId(), trigger.targetQueue());
            } catch (RuntimeException e) {
                log.error("Trigger {} failed for event {}", trigger.name(), event.id(), e);
            }
        }
        return created;
    }

    private static Map<String, Object> buildPayload(EventTrigger trigger, Event event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("triggered_by", trigger.name());
        payload.put("event_id", event.id());
        payload.put("event_type", event.type().wireName());
        if (trigger.sourceQueue() != null) {
            payload.put("source_queue", trigger.sourceQueue());
        }
        payload.put("event_data", event.data());
        if (event.type() == EventType.TASK_COMPLETED) {
            payload.put("completed_task_id", event.data().get("task_id"));
            payload.put("completed_task_type", event.data().get("task_type"));
            payload.put("duration_ms", event.data().get("duration_ms"));
        }
        return payload;
    }

    // ==================== Status changes ====================

    private void onQueueEvent(Event event) {
        String queueName = event.dataString("queue_name");
        if (queueName == null) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("queue_name", queueName);
        data.put("trigger", event.type().wireName());
        if (event.data().containsKey("task_id")) {
            data.put("task_id", event.data().get("task_id"));
        }
        eventBus.publish(Event.of(EventType.QUEUE_STATUS_CHANGED, NAME, data));
    }
}
