package com.omniva.dbnotify.engine.valvetrain;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Exponential backoff with full jitter.
 * <p>
 * {@code delay(n) = random in [0, min(maxDelay, baseDelay * 2^n))}
 */
public class ReconnectBackoff {

    // 2^62 already exceeds any sane ceiling
    private static final int MAX_SHIFT = 62;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final LongUnaryOperator jitter;

    public ReconnectBackoff(ReconnectOptions options) {
        this(options.baseDelayMs(), options.maxDelayMs(),
                bound -> ThreadLocalRandom.current().nextLong(bound));
    }

    /**
     * @param jitter maps an exclusive upper bound to a value in {@code [0, bound)}
     */
    public ReconnectBackoff(long baseDelayMs, long maxDelayMs, LongUnaryOperator jitter) {
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitter = jitter;
    }

    /**
     * Upper bound (exclusive) of the delay window for a 0-indexed attempt
     */
    public long ceilingFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0: " + attempt);
        }
        int shift = Math.min(attempt, MAX_SHIFT);
        long factor = 1L << shift;
        if (baseDelayMs > maxDelayMs / factor) {
            return maxDelayMs;
        }
        return Math.min(maxDelayMs, baseDelayMs * factor);
    }

    public long delayFor(int attempt) {
        long ceiling = ceilingFor(attempt);
        long delay = jitter.applyAsLong(ceiling);
        if (delay < 0 || delay >= ceiling) {
            throw new IllegalStateException("Jitter returned " + delay + " outside [0, " + ceiling + ")");
        }
        return delay;
    }
}
