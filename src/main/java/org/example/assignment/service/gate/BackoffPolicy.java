package org.example.assignment.service.gate;

import java.time.Duration;

/**
 * Exponential backoff: {@code min(baseDelay * multiplier^retryIndex, maxDelay)}.
 */
public record BackoffPolicy(
        Duration baseDelay,
        double multiplier,
        Duration maxDelay
) {

    public BackoffPolicy {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be zero or positive");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be at least baseDelay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    public static BackoffPolicy of(long baseDelayMs, double multiplier, long maxDelayMs) {
        return new BackoffPolicy(Duration.ofMillis(baseDelayMs), multiplier, Duration.ofMillis(maxDelayMs));
    }

    /**
     * @param retryIndex zero for the delay before the first retry
     */
    public Duration delayFor(int retryIndex) {
        double scaled = baseDelay.toMillis() * Math.pow(multiplier, Math.max(0, retryIndex));
        long capped = (long) Math.min(scaled, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }
}
