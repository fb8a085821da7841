package com.example.taskqueue.broker;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed-interval retry budget for the broker probe. No exponential growth, so the worst-case
 * wait is always {@code maxAttempts * interval}.
 */
public record ReadinessPolicy(int maxAttempts, Duration interval) {

    public ReadinessPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max attempts must be at least 1 but was " + maxAttempts);
        }
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must not be negative");
        }
    }

    public static ReadinessPolicy immediate(int maxAttempts) {
        return new ReadinessPolicy(maxAttempts, Duration.ZERO);
    }
}
