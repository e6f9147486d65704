package robotrader.core.broadcast;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for broadcast attempts. Thread-safe.
 */
public class BroadcastMetrics {

    static final int SEND_TIME_WINDOW = 100;

    private final AtomicLong total = new AtomicLong();
    private final AtomicLong successful = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong shortCircuited = new AtomicLong();
    private final AtomicLong skippedUnchanged = new AtomicLong();

    private final Deque<Long> sendTimesMs = new ArrayDeque<>();

    private volatile String lastError;
    private volatile ErrorSeverity lastErrorSeverity;
    private volatile Instant lastSuccessAt;
    private volatile Instant lastFailureAt;

    public void recordSuccess(long sendTimeMs) {
        total.incrementAndGet();
        successful.incrementAndGet();
        lastSuccessAt = Instant.now();
        synchronized (sendTimesMs) {
            sendTimesMs.addLast(sendTimeMs);
            if (sendTimesMs.size() > SEND_TIME_WINDOW) {
                sendTimesMs.removeFirst();
            }
        }
    }

    public void recordFailure(Throwable error, ErrorSeverity severity) {
        total.incrementAndGet();
        failed.incrementAndGet();
        lastError = error == null ? null : String.valueOf(error.getMessage());
        lastErrorSeverity = severity;
        lastFailureAt = Instant.now();
    }

    public void recordShortCircuit() {
        total.incrementAndGet();
        shortCircuited.incrementAndGet();
    }

    public void recordSkippedUnchanged() {
        skippedUnchanged.incrementAndGet();
    }

    public long total() {
        return total.get();
    }

    public long successful() {
        return successful.get();
    }

    public long failed() {
        return failed.get();
    }

    public long shortCircuited() {
        return shortCircuited.get();
    }

    public long skippedUnchanged() {
        return skippedUnchanged.get();
    }

    public String lastError() {
        return lastError;
    }

    public ErrorSeverity lastErrorSeverity() {
        return lastErrorSeverity;
    }

    /** Mean of the last {@value #SEND_TIME_WINDOW} successful send times, or 0. */
    public double averageSendTimeMs() {
        synchronized (sendTimesMs) {
            if (sendTimesMs.isEmpty()) {
                return 0.0;
            }
            long sum = 0;
            for (long value : sendTimesMs) {
                sum += value;
            }
            return (double) sum / sendTimesMs.size();
        }
    }

    /** Percentage of attempts (short-circuits included) that were delivered. */
    public double successRate() {
        long attempts = total.get();
        return attempts == 0 ? 100.0 : successful.get() * 100.0 / attempts;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_broadcasts", total.get());
        map.put("successful_broadcasts", successful.get());
        map.put("failed_broadcasts", failed.get());
        map.put("short_circuited", shortCircuited.get());
        map.put("skipped_unchanged", skippedUnchanged.get());
        map.put("success_rate", Math.round(successRate() * 100.0) / 100.0);
        map.put("average_send_time_ms", Math.round(averageSendTimeMs() * 100.0) / 100.0);
        map.put("last_error", lastError);
        map.put("last_error_severity", lastErrorSeverity);
        map.put("last_success_at", lastSuccessAt);
        map.put("last_failure_at", lastFailureAt);
        return map;
    }
}
