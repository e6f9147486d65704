package robotrader.core.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of event types carried by the {@link EventBus}.
 * Each type has a dotted wire name used in persisted and serialized events.
 */
public enum EventType {

    TASK_CREATED("task.created"),
    TASK_STARTED("task.started"),
    TASK_COMPLETED("task.completed"),
    TASK_FAILED("task.failed"),
    TASK_CANCELLED("task.cancelled"),

    QUEUE_STARTED("queue.started"),
    QUEUE_STOPPED("queue.stopped"),
    QUEUE_STATUS_CHANGED("queue.status_changed"),

    STATUS_AGGREGATED("status.aggregated"),
    BROADCAST_CIRCUIT_CHANGED("broadcast.circuit_changed"),

    AGENT_REGISTERED("agent.registered"),
    AGENT_STATUS_CHANGED("agent.status_changed"),
    AGENT_MESSAGE_SENT("agent.message_sent"),
    AGENT_MESSAGE_RECEIVED("agent.message_received"),

    SYSTEM_ERROR("system.error");

    private static final Map<String, EventType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(EventType::wireName, Function.identity()));

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a wire name back to its type.
     *
     * @throws IllegalArgumentException if the name is not a known type
     */
    @JsonCreator
    public static EventType fromWireName(String wireName) {
        EventType type = BY_WIRE_NAME.get(wireName);
        if (type == null) {
            throw new IllegalArgumentException("Unknown event type: " + wireName);
        }
        return type;
    }
}
