package com.example.taskqueue.topology;

import java.util.Objects;

/**
 * One priority tier. Every tier dead-letters into the topology's single {@link DeadLetterSpec}.
 */
public record QueueSpec(
        String name,
        int maxPriority,
        int ttlMillis,
        int maxLength,
        String routingKey,
        OverflowPolicy overflowPolicy
) {
    public static final int MAX_PRIORITY_CEILING = 255;

    public QueueSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("queue name must not be blank");
        }
        if (maxPriority < 1 || maxPriority > MAX_PRIORITY_CEILING) {
            throw new IllegalArgumentException(
                    "queue " + name + ": max priority must be in [1, 255] but was " + maxPriority);
        }
        if (ttlMillis <= 0) {
            throw new IllegalArgumentException("queue " + name + ": ttl must be positive but was " + ttlMillis);
        }
        if (maxLength <= 0) {
            throw new IllegalArgumentException("queue " + name + ": max length must be positive but was " + maxLength);
        }
        if (routingKey == null || routingKey.isBlank()) {
            throw new IllegalArgumentException("queue " + name + ": routing key must not be blank");
        }
        Objects.requireNonNull(overflowPolicy, "overflow policy");
    }

    public QueueSpec(String name, int maxPriority, int ttlMillis, int maxLength, String routingKey) {
        this(name, maxPriority, ttlMillis, maxLength, routingKey, OverflowPolicy.REJECT_PUBLISH);
    }
}
