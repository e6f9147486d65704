package robotrader.core.events;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable notification delivered through the {@link EventBus}.
 * Wire shape: {id, type, source, timestamp, data}.
 */
public record Event(
        @JsonProperty("id") String id,
        @JsonProperty("type") EventType type,
        @JsonProperty("source") String source,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("data") Map<String, Object> data) {

    public Event {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static Event of(EventType type, String source, Map<String, Object> data) {
        return new Event(UUID.randomUUID().toString(), type, source, Instant.now(), data);
    }

    public static Event of(EventType type, String source) {
        return of(type, source, Map.of());
    }

    /** String value of a data entry, or null if absent. */
    public String dataString(String key) {
        Object value = data.get(key);
        return value == null ? null : value.toString();
    }
}
