package robotrader.core.coordinator.queue;

import robotrader.core.events.Event;
import robotrader.core.events.EventType;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Rule that turns a published event into a new task.
 * <p>
 * Condition values are matched against the event data: a list means "one of",
 * {@code ">x"} / {@code "<x"} compare numerically, {@code "all"} matches any value,
 * anything else must be equal.
 *
 * @param name        unique trigger name
 * @param eventType   event that fires the trigger
 * @param sourceQueue only events whose {@code queue_name} matches, or null for any
 * @param targetQueue queue receiving the new task
 * @param taskType    type of the new task
 * @param priority    priority of the new task (1 = most urgent)
 * @param condition   extra constraints on the event data; may be empty
 */
public record EventTrigger(
        String name,
        EventType eventType,
        String sourceQueue,
        String targetQueue,
        String taskType,
        int priority,
        Map<String, Object> condition) {

    public EventTrigger {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(eventType, "eventType is required");
        Objects.requireNonNull(targetQueue, "targetQueue is required");
        Objects.requireNonNull(taskType, "taskType is required");
        condition = condition == null ? Map.of() : Map.copyOf(condition);
    }

    public static EventTrigger on(String name, EventType eventType, String sourceQueue, String targetQueue,
            String taskType) {
        return new EventTrigger(name, eventType, sourceQueue, targetQueue, taskType, 5, Map.of());
    }

    public EventTrigger withPriority(int priority) {
        return new EventTrigger(name, eventType, sourceQueue, targetQueue, taskType, priority, condition);
    }

    public EventTrigger withCondition(Map<String, Object> condition) {
        return new EventTrigger(name, eventType, sourceQueue, targetQueue, taskType, priority, condition);
    }

    /** A trigger feeding its own queue would re-fire on its own tasks. */
    public boolean isSelfFeeding() {
        return sourceQueue != null && sourceQueue.equals(targetQueue);
    }

    public boolean matches(Event event) {
        if (event.type() != eventType) {
            return false;
        }
        Map<String, Object> data = event.data();
        if (sourceQueue != null && !sourceQueue.equals(data.get("queue_name"))) {
            return false;
        }
        // Never react to a task this trigger would create itself
        if (targetQueue.equals(data.get("queue_name")) && taskType.equals(data.get("task_type"))) {
            return false;
        }
        for (Map.Entry<String, Object> entry : condition.entrySet()) {
            if (!data.containsKey(entry.getKey()) || !matchesValue(entry.getValue(), data.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesValue(Object expected, Object actual) {
        if (expected instanceof Collection<?> options) {
            return options.contains(actual);
        }
        if (expected instanceof String text) {
            if ("all".equals(text)) {
                return true;
            }
            if (text.startsWith(">") || text.startsWith("<")) {
                if (!(actual instanceof Number number)) {
                    return false;
                }
                double threshold;
                try {
                    threshold = Double.parseDouble(text.substring(1).trim());
                } catch (NumberFormatException e) {
                    return false;
                }
                return text.startsWith(">")
                        ? number.doubleValue() > threshold
                        : number.doubleValue() < threshold;
            }
        }
        return Objects.equals(expected, actual);
    }
}
