package com.example.taskqueue.topology;

public record BindingSpec(
        String exchangeName,
        String queueName,
        String routingKey
) {
    public String describe() {
        return exchangeName + " -> " + queueName + " [" + routingKey + "]";
    }
}
