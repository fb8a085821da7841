package com.example.taskqueue.topology;

import org.springframework.amqp.core.ExchangeTypes;

public enum ExchangeKind {
    TOPIC(ExchangeTypes.TOPIC),
    DIRECT(ExchangeTypes.DIRECT);

    private final String amqpType;

    ExchangeKind(String amqpType) {
        this.amqpType = amqpType;
    }

    public String amqpType() {
        return amqpType;
    }
}
