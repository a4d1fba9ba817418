package com.omniva.dbnotify.engine.valvetrain;

/**
 * Reconnection settings.
 *
 * @param enabled     whether dropped connections are re-established automatically
 * @param baseDelayMs base delay of attempt 0
 * @param maxDelayMs  ceiling of the backoff window
 * @param maxAttempts consecutive failed attempts before giving up, negative for unbounded
 */
public record ReconnectOptions(boolean enabled, long baseDelayMs, long maxDelayMs, int maxAttempts) {

    public static final long DEFAULT_BASE_DELAY_MS = 1_000;
    public static final long DEFAULT_MAX_DELAY_MS = 30_000;
    public static final int UNBOUNDED = -1;

    public ReconnectOptions {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs (" + maxDelayMs + ") must be >= baseDelayMs (" + baseDelayMs + ")");
        }
    }

    public static ReconnectOptions defaults() {
        return new ReconnectOptions(true, DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS, UNBOUNDED);
    }

    public boolean isUnbounded() {
        return maxAttempts < 0;
    }

    public boolean isExhausted(int failedAttempts) {
        return !isUnbounded() && failedAttempts >= maxAttempts;
    }
}
