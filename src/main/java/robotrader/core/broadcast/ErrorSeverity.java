package robotrader.core.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;

/**
 * How serious a broadcast failure is, for logs and metrics.
 */
public enum ErrorSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    private static final List<String> NETWORK_KEYWORDS = List.of("connection", "network", "timeout", "timed out");
    private static final List<String> CLIENT_KEYWORDS = List.of("client", "websocket", "closed");
    private static final List<String> SYSTEM_KEYWORDS = List.of("memory", "disk", "system");

    /**
     * Classify a failure by its type first, then by keywords in its message.
     */
    public static ErrorSeverity classify(Throwable error) {
        if (error == null) {
            return MEDIUM;
        }
        if (error instanceof Error) {
            return CRITICAL;
        }
        if (error instanceof InterruptedException || error instanceof CancellationException) {
            return LOW;
        }
        if (error instanceof JsonProcessingException) {
            return HIGH;
        }

        String text = (error.getClass().getSimpleName() + " " + error.getMessage()).toLowerCase(Locale.ROOT);
        if (containsAny(text, NETWORK_KEYWORDS)) {
            return HIGH;
        }
        if (containsAny(text, CLIENT_KEYWORDS)) {
            return MEDIUM;
        }
        if (containsAny(text, SYSTEM_KEYWORDS)) {
            return CRITICAL;
        }
        return MEDIUM;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
