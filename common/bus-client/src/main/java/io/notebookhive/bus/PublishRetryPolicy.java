package io.notebookhive.bus;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff between publish attempts, capped at {@code maxBackoff}.
 */
public record PublishRetryPolicy(int maxAttempts,
                                 Duration initialBackoff,
                                 double multiplier,
                                 Duration maxBackoff) {

    public PublishRetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff");
        maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
        multiplier = multiplier < 1.0 ? 1.0 : multiplier;
    }

    public static PublishRetryPolicy noRetry() {
        return new PublishRetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    public Duration backoffAfter(int failedAttempt) {
        double factor = Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        double millis = initialBackoff.toMillis() * factor;
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }
}
