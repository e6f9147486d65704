package robotrader.core.scheduler;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with optional jitter.
 *
 * <p>Delay formula: {@code baseDelay * multiplier^(attempt-1)}, capped at {@code maxDelay}.
 * With jitter the result is scaled by a random factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {

    public static final double DEFAULT_MULTIPLIER = 2.0;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double multiplier;
    private final boolean jitter;

    /**
     * @param baseDelayMs base delay for the first retry (milliseconds)
     * @param maxDelayMs  maximum delay cap (milliseconds)
     */
    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
        this(baseDelayMs, maxDelayMs, DEFAULT_MULTIPLIER, true);
    }

    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, double multiplier, boolean jitter) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.multiplier = multiplier;
        this.jitter = jitter;
    }

    @Override
    public long computeDelayMs(int attempt) {
        if (attempt <= 0) {
            return 0L;
        }
        double exponential = baseDelayMs * Math.pow(multiplier, attempt - 1);
        long capped = exponential >= maxDelayMs ? maxDelayMs : (long) exponential;
        if (!jitter) {
            return capped;
        }
        double factor = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
        return Math.min(maxDelayMs, Math.max(0L, (long) (capped * factor)));
    }
}
