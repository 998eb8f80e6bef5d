package com.faasrt.config;

import java.time.Duration;

/**
 * Pacing after failed reads from the store.
 *
 * <p>The delay after the n-th consecutive failure is
 * {@code pollInterval * backoffCoefficient^(n-1)}, capped at {@code maxInterval}.
 * The delay is never shorter than the poll interval. A successful read resets the count.
 *
 * @param maxConsecutiveFailures failures tolerated before giving up; {@code 0} retries forever
 * @param backoffCoefficient     growth factor, {@code 1.0} keeps the poll interval
 * @param maxInterval            upper bound of a grown delay
 */
public record StoreRetryPolicy(int maxConsecutiveFailures,
                               double backoffCoefficient,
                               Duration maxInterval) {

    /** Retry forever at the poll interval. */
    public static final StoreRetryPolicy UNBOUNDED = new StoreRetryPolicy(0, 1.0, Duration.ofMinutes(5));

    public StoreRetryPolicy {
        if (maxConsecutiveFailures < 0) {
            throw new IllegalArgumentException("maxConsecutiveFailures must be >= 0");
        }
        if (backoffCoefficient < 1.0) {
            throw new IllegalArgumentException("backoffCoefficient must be >= 1.0");
        }
        if (maxInterval == null || maxInterval.isNegative() || maxInterval.isZero()) {
            throw new IllegalArgumentException("maxInterval must be positive");
        }
    }

    public boolean isExhausted(int consecutiveFailures) {
        return maxConsecutiveFailures > 0 && consecutiveFailures > maxConsecutiveFailures;
    }

    public Duration delayAfter(int consecutiveFailures, Duration pollInterval) {
        if (consecutiveFailures <= 1 || backoffCoefficient == 1.0) {
            return pollInterval;
        }
        Duration cap = max(pollInterval, maxInterval);
        double millis = pollInterval.toMillis() * Math.pow(backoffCoefficient, consecutiveFailures - 1);
        if (millis >= cap.toMillis()) {
            return cap;
        }
        return Duration.ofMillis((long) millis);
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
