package robotrader.core.coordinator.status;

import com.fasterxml.jackson.annotation.JsonProperty;
import robotrader.core.model.ComponentStatus;
import robotrader.core.util.JsonCodec;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated system status at one instant.
 *
 * @param status     {@code healthy} if every component is healthy, else {@code degraded}
 * @param components per-source results, in registration order
 * @param hash       SHA-256 of the canonical JSON of the components
 * @param timestamp  when the snapshot was taken (not part of the hash)
 */
public record StatusSnapshot(
        @JsonProperty("status") String status,
        @JsonProperty("components") Map<String, ComponentStatus> components,
        @JsonProperty("hash") String hash,
        @JsonProperty("timestamp") Instant timestamp) {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    public StatusSnapshot {
        components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
    }

    public static StatusSnapshot of(Map<String, ComponentStatus> components, Instant timestamp) {
        boolean healthy = components.values().stream().allMatch(ComponentStatus::healthy);
        return new StatusSnapshot(healthy ? HEALTHY : DEGRADED, components, hash(components), timestamp);
    }

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }

    /**
     * Content hash of a component map. Key order does not matter.
     */
    public static String hash(Map<String, ComponentStatus> components) {
        String canonical = JsonCodec.toCanonicalJson(components);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Event / broadcast payload form. */
    public Map<String, Object> toData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", status);
        data.put("components", components);
        data.put("hash", hash);
        data.put("timestamp", timestamp.toString());
        return data;
    }
}
