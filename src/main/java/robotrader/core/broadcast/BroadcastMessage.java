package robotrader.core.broadcast;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Message pushed to observers. Wire shape: {type, data, timestamp}.
 */
public record BroadcastMessage(
        @JsonProperty("type") String type,
        @JsonProperty("data") Map<String, Object> data,
        @JsonProperty("timestamp") Instant timestamp) {

    /** Type of the periodic / change-driven system snapshot. */
    public static final String SYSTEM_STATUS_UPDATE = "system_status_update";

    public BroadcastMessage {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static BroadcastMessage of(String type, Map<String, Object> data) {
        return new BroadcastMessage(type, data, Instant.now());
    }
}
