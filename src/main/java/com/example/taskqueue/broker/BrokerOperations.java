package com.example.taskqueue.broker;

import com.example.taskqueue.topology.BindingSpec;
import com.example.taskqueue.topology.ExchangeSpec;

import java.util.Map;

/**
 * Request/response calls the provisioner and verifier make against the broker.
 *
 * <p>Every call blocks until the broker acknowledges. Failures surface as
 * {@link org.springframework.amqp.AmqpException}; an
 * {@link org.springframework.amqp.AmqpConnectException} means the connection itself is gone.
 */
public interface BrokerOperations {

    void declareExchange(ExchangeSpec exchange);

    void declareDurableQueue(String name, Map<String, Object> arguments);

    void bind(BindingSpec binding);

    /** Passive lookup, never creates the queue. */
    boolean queueExists(String name);
}
