package com.example.taskqueue.broker;

import com.example.taskqueue.topology.BindingSpec;
import com.example.taskqueue.topology.ExchangeSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class RabbitAdminBrokerOperations implements BrokerOperations {

    private final AmqpAdmin amqpAdmin;

    @Override
    public void declareExchange(ExchangeSpec spec) {
        Exchange exchange = new ExchangeBuilder(spec.name(), spec.kind().amqpType())
                .durable(spec.durable())
                .build();
        amqpAdmin.declareExchange(exchange);
    }

    @Override
    public void declareDurableQueue(String name, Map<String, Object> arguments) {
        Queue queue = QueueBuilder.durable(name)
                .withArguments(arguments)
                .build();
        amqpAdmin.declareQueue(queue);
    }

    @Override
    public void bind(BindingSpec spec) {
        amqpAdmin.declareBinding(new Binding(
                spec.queueName(),
                Binding.DestinationType.QUEUE,
                spec.exchangeName(),
                spec.routingKey(),
                null));
    }

    @Override
    public boolean queueExists(String name) {
        // RabbitAdmin answers with a passive declare and returns null when the queue is missing
        return amqpAdmin.getQueueProperties(name) != null;
    }
}
