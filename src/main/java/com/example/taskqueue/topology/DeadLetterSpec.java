package com.example.taskqueue.topology;

public record DeadLetterSpec(
        String queueName,
        String exchangeName,
        String routingKey
) {
    public DeadLetterSpec {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("dead-letter queue name must not be blank");
        }
        if (exchangeName == null || exchangeName.isBlank()) {
            throw new IllegalArgumentException("dead-letter exchange name must not be blank");
        }
        if (routingKey == null || routingKey.isBlank()) {
            throw new IllegalArgumentException("dead-letter routing key must not be blank");
        }
    }

    public BindingSpec binding() {
        return new BindingSpec(exchangeName, queueName, routingKey);
    }
}
