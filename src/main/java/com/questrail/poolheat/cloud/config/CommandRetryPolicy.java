package com.questrail.poolheat.cloud.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff for commands whose send fails with a retryable error.
 *
 * <p>{@code maxAttempts} counts every send, the first one included. Attempt
 * {@code n} (1-based) that fails waits {@link #backoffAfter(int)} before
 * attempt {@code n + 1}.</p>
 */
public record CommandRetryPolicy(
        int maxAttempts,
        Duration initialBackoff,
        double multiplier,
        Duration maxBackoff
) {
    public CommandRetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be non-negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
    }

    /**
     * 3 attempts, 1s initial backoff doubling up to 10s.
     */
    public static CommandRetryPolicy defaults() {
        return new CommandRetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10));
    }

    /**
     * Delay to wait after failed attempt {@code attempt} (1-based).
     */
    public Duration backoffAfter(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        double nanos = initialBackoff.toNanos() * Math.pow(multiplier, attempt - 1);
        if (nanos >= maxBackoff.toNanos()) {
            return maxBackoff;
        }
        return Duration.ofNanos((long) nanos);
    }
}
