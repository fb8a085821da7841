package com.example.taskqueue.service;

import com.example.taskqueue.broker.BrokerOperations;
import com.example.taskqueue.metrics.ProvisioningMetrics;
import com.example.taskqueue.topology.BindingSpec;
import com.example.taskqueue.topology.DeadLetterSpec;
import com.example.taskqueue.topology.ExchangeSpec;
import com.example.taskqueue.topology.QueueSpec;
import com.example.taskqueue.topology.TopologyDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies a {@link TopologyDefinition} to the broker in four ordered steps:
 * exchanges, dead-letter queue with its binding, priority queues, priority bindings.
 *
 * <p>A failing resource is recorded and the run moves on to the next one. Only a lost
 * connection ({@link AmqpConnectException}) ends the run early.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TopologyProvisioner {

    private final BrokerOperations broker;
    private final ProvisioningMetrics metrics;

    public ProvisionReport provision(TopologyDefinition topology) {
        long startNs = System.nanoTime();
        List<ResourceOutcome> outcomes = new ArrayList<>();
        String abortReason = null;

        log.info("event=provision_start exchanges={} queues={}",
                topology.exchanges().size(), topology.queues().size());

        try {
            declareExchanges(topology, outcomes);
            declareDeadLetterQueue(topology, outcomes);
            declarePriorityQueues(topology, outcomes);
            bindPriorityQueues(topology, outcomes);
        } catch (AmqpConnectException e) {
            abortReason = reason(e);
            log.error("event=provision_aborted attempted={} error={}", outcomes.size(), abortReason);
        } finally {
            metrics.recordProvisionDurationNs(System.nanoTime() - startNs);
        }

        ProvisionReport report = new ProvisionReport(outcomes, abortReason);
        log.info("event=provision_done succeeded={} failed={} aborted={}",
                report.successCount(), report.failures().size(), report.aborted());
        return report;
    }

    private void declareExchanges(TopologyDefinition topology, List<ResourceOutcome> outcomes) {
        for (ExchangeSpec exchange : topology.exchanges()) {
            attempt(outcomes, ResourceKind.EXCHANGE, exchange.name(), () -> broker.declareExchange(exchange));
        }
    }

    private void declareDeadLetterQueue(TopologyDefinition topology, List<ResourceOutcome> outcomes) {
        DeadLetterSpec deadLetter = topology.deadLetter();
        attempt(outcomes, ResourceKind.QUEUE, deadLetter.queueName(),
                () -> broker.declareDurableQueue(deadLetter.queueName(), Map.of()));
        bind(outcomes, deadLetter.binding());
    }

    private void declarePriorityQueues(TopologyDefinition topology, List<ResourceOutcome> outcomes) {
        for (QueueSpec queue : topology.queues()) {
            Map<String, Object> arguments = topology.argumentsFor(queue).values();
            attempt(outcomes, ResourceKind.QUEUE, queue.name(),
                    () -> broker.declareDurableQueue(queue.name(), arguments));
        }
    }

    private void bindPriorityQueues(TopologyDefinition topology, List<ResourceOutcome> outcomes) {
        for (QueueSpec queue : topology.queues()) {
            bind(outcomes, topology.bindingFor(queue));
        }
    }

    private void bind(List<ResourceOutcome> outcomes, BindingSpec binding) {
        if (!succeeded(outcomes, ResourceKind.QUEUE, binding.queueName())) {
            record(outcomes, ResourceOutcome.failure(ResourceKind.BINDING, binding.queueName(),
                    "queue not declared: " + binding.queueName()));
            return;
        }
        if (!succeeded(outcomes, ResourceKind.EXCHANGE, binding.exchangeName())) {
            record(outcomes, ResourceOutcome.failure(ResourceKind.BINDING, binding.queueName(),
                    "exchange not declared: " + binding.exchangeName()));
            return;
        }
        attempt(outcomes, ResourceKind.BINDING, binding.queueName(), () -> broker.bind(binding));
    }

    private void attempt(List<ResourceOutcome> outcomes, ResourceKind kind, String name, Runnable call) {
        try {
            call.run();
            record(outcomes, ResourceOutcome.success(kind, name));
        } catch (AmqpConnectException e) {
            throw e;
        } catch (RuntimeException e) {
            record(outcomes, ResourceOutcome.failure(kind, name, reason(e)));
        }
    }

    private void record(List<ResourceOutcome> outcomes, ResourceOutcome outcome) {
        outcomes.add(outcome);
        metrics.recordOutcome(outcome.kind(), outcome.success());

        String kind = outcome.kind().name().toLowerCase();
        if (outcome.success()) {
            log.info("event={}_declared name={}", kind, outcome.name());
        } else {
            log.error("event={}_failed name={} reason={}", kind, outcome.name(), outcome.reason());
        }
    }

    private static boolean succeeded(List<ResourceOutcome> outcomes, ResourceKind kind, String name) {
        return outcomes.stream().anyMatch(o -> o.kind() == kind && o.name().equals(name) && o.success());
    }

    static String reason(Throwable e) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
