package robotrader.core.events;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A failed delivery of an event to one handler.
 */
public record DeadLetter(
        @JsonProperty("event_id") String eventId,
        @JsonProperty("event_type") EventType eventType,
        @JsonProperty("handler") String handler,
        @JsonProperty("error") String error,
        @JsonProperty("failed_at") Instant failedAt) {
}
