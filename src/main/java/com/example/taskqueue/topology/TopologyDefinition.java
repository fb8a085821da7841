package com.example.taskqueue.topology;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable declarative model of everything the provisioner creates on the broker.
 *
 * <p>Validated once on construction, so an inconsistent definition fails the
 * process before the first broker call:
 * <ul>
 *     <li>exchange names are unique</li>
 *     <li>queue names are unique and differ from the dead-letter queue</li>
 *     <li>the dead-letter exchange and both routing targets are declared exchanges</li>
 * </ul>
 */
public record TopologyDefinition(
        List<ExchangeSpec> exchanges,
        List<QueueSpec> queues,
        DeadLetterSpec deadLetter,
        RoutingClassifier routing
) {
    public TopologyDefinition {
        Objects.requireNonNull(deadLetter, "dead letter");
        Objects.requireNonNull(routing, "routing");
        exchanges = List.copyOf(exchanges);
        queues = List.copyOf(queues);

        Set<String> exchangeNames = new HashSet<>();
        for (ExchangeSpec exchange : exchanges) {
            if (!exchangeNames.add(exchange.name())) {
                throw new IllegalArgumentException("duplicate exchange: " + exchange.name());
            }
        }

        Set<String> queueNames = new HashSet<>();
        queueNames.add(deadLetter.queueName());
        for (QueueSpec queue : queues) {
            if (!queueNames.add(queue.name())) {
                throw new IllegalArgumentException("duplicate queue: " + queue.name());
            }
        }

        requireExchange(exchangeNames, deadLetter.exchangeName(), "dead-letter");
        requireExchange(exchangeNames, routing.priorityExchange(), "priority");
        requireExchange(exchangeNames, routing.anomalyExchange(), "anomaly");
    }

    private static void requireExchange(Set<String> declared, String name, String role) {
        if (!declared.contains(name)) {
            throw new IllegalArgumentException(role + " exchange is not declared: " + name);
        }
    }

    public Optional<ExchangeSpec> exchange(String name) {
        return exchanges.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    public QueueArguments argumentsFor(QueueSpec queue) {
        return QueueArguments.of(queue, deadLetter);
    }

    public String targetExchange(QueueSpec queue) {
        return routing.classify(queue.name());
    }

    public BindingSpec bindingFor(QueueSpec queue) {
        return new BindingSpec(targetExchange(queue), queue.name(), queue.routingKey());
    }

    /** Dead-letter binding first, then one per priority queue in declaration order. */
    public List<BindingSpec> bindings() {
        List<BindingSpec> bindings = new ArrayList<>(queues.size() + 1);
        bindings.add(deadLetter.binding());
        queues.forEach(q -> bindings.add(bindingFor(q)));
        return bindings;
    }

    /** Priority queues in declaration order, followed by the dead-letter queue. */
    public List<String> queueNames() {
        List<String> names = new ArrayList<>(queues.size() + 1);
        queues.forEach(q -> names.add(q.name()));
        names.add(deadLetter.queueName());
        return names;
    }
}
