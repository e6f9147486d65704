package robotrader.core.coordinator.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Message between agents.
 *
 * @param correlationId for a response, the {@code messageId} of the request it answers
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentMessage(
        @JsonProperty("message_id") String messageId,
        @JsonProperty("message_type") MessageType messageType,
        @JsonProperty("sender") String sender,
        @JsonProperty("recipient") String recipient,
        @JsonProperty("content") Map<String, Object> content,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("correlation_id") String correlationId) {

    public AgentMessage {
        Objects.requireNonNull(messageId, "messageId is required");
        Objects.requireNonNull(messageType, "messageType is required");
        Objects.requireNonNull(sender, "sender is required");
        content = content == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(content));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static AgentMessage of(MessageType type, String sender, String recipient, Map<String, Object> content) {
        return new AgentMessage(UUID.randomUUID().toString(), type, sender, recipient, content, Instant.now(), null);
    }

    /** Response addressed back to the sender of this message. */
    public AgentMessage replyTo(MessageType type, String responder, Map<String, Object> content) {
        return new AgentMessage(UUID.randomUUID().toString(), type, responder, sender, content, Instant.now(),
                messageId);
    }
}
