package robotrader.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of one branch of a fan-out status or state query.
 * A failed branch is kept as a placeholder carrying its error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComponentStatus(
        @JsonProperty("name") String name,
        @JsonProperty("healthy") boolean healthy,
        @JsonProperty("data") Object data,
        @JsonProperty("error") String error) {

    public static ComponentStatus ok(String name, Object data) {
        return new ComponentStatus(name, true, data, null);
    }

    public static ComponentStatus degraded(String name, String error) {
        return new ComponentStatus(name, false, null, error != null ? error : "unknown error");
    }
}
