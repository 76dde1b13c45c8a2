package com.campus.messaging.infrastructure;

import java.time.Duration;

/**
 * Exponential reconnect delay: {@code base * 2^attempt}, capped at {@code maxDelay},
 * for at most {@code maxAttempts} connection attempts per cycle.
 */
public class BackoffPolicy {

    private static final int MAX_SHIFT = 30;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;

    public BackoffPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts) {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("Base delay must be zero or positive");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Max delay must be at least the base delay");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("At least one attempt is required");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(10), 5);
    }

    /**
     * Delay to wait after failed attempt {@code attempt} (0-based) before the next one.
     */
    public Duration delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt must not be negative: " + attempt);
        }
        long baseMillis = baseDelay.toMillis();
        long capMillis = maxDelay.toMillis();
        int shift = Math.min(attempt, MAX_SHIFT);

        // cap before multiplying so the product cannot overflow
        if (baseMillis > 0 && baseMillis > (capMillis >> shift)) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(baseMillis << shift, capMillis));
    }

    public boolean allowsAttempt(int attempt) {
        return attempt >= 0 && attempt < maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    @Override
    public String toString() {
        return "BackoffPolicy{base=" + baseDelay.toMillis() + "ms, cap=" + maxDelay.toMillis()
            + "ms, maxAttempts=" + maxAttempts + "}";
    }
}
