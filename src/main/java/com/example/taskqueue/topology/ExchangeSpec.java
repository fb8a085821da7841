package com.example.taskqueue.topology;

import java.util.Objects;

public record ExchangeSpec(
        String name,
        ExchangeKind kind,
        boolean durable
) {
    public ExchangeSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("exchange name must not be blank");
        }
        Objects.requireNonNull(kind, "exchange kind");
    }

    public static ExchangeSpec durableTopic(String name) {
        return new ExchangeSpec(name, ExchangeKind.TOPIC, true);
    }

    public static ExchangeSpec durableDirect(String name) {
        return new ExchangeSpec(name, ExchangeKind.DIRECT, true);
    }
}
