package robotrader.core.coordinator.message;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of messages exchanged between agents.
 */
public enum MessageType {
    ANALYSIS_REQUEST,
    ANALYSIS_RESPONSE,
    DECISION_PROPOSAL,
    VOTE,
    ERROR_REPORT,
    STATUS_UPDATE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
