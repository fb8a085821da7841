package com.example.taskqueue.config;

import com.example.taskqueue.topology.ExchangeKind;
import com.example.taskqueue.topology.ExchangeSpec;
import com.example.taskqueue.topology.QueueSpec;
import com.example.taskqueue.topology.TopologyDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PriorityTopologyConfig Tests")
class PriorityTopologyConfigTest {

    private final TopologyDefinition topology = new PriorityTopologyConfig().priorityTopology();

    @Test
    @DisplayName("exchanges → priority topic, anomaly and dlq direct, all durable")
    void shouldDefineExchanges() {
        assertThat(topology.exchanges()).containsExactly(
                new ExchangeSpec("priority-exchange", ExchangeKind.TOPIC, true),
                new ExchangeSpec("anomaly-exchange", ExchangeKind.DIRECT, true),
                new ExchangeSpec("dlq-exchange", ExchangeKind.DIRECT, true));
    }

    @Test
    @DisplayName("six tiers → published priority, ttl, length, routing key and exchange")
    void shouldDefineQueueTiers() {
        assertThat(topology.queues())
                .extracting(QueueSpec::name, QueueSpec::maxPriority, QueueSpec::ttlMillis,
                        QueueSpec::maxLength, QueueSpec::routingKey, topology::targetExchange)
                .containsExactly(
                        tuple("critical-priority-queue", 255, 60000, 1000, "priority.critical", "priority-exchange"),
                        tuple("high-priority-queue", 200, 300000, 5000, "priority.high", "priority-exchange"),
                        tuple("normal-priority-queue", 100, 600000, 10000, "priority.normal", "priority-exchange"),
                        tuple("low-priority-queue", 50, 1800000, 20000, "priority.low", "priority-exchange"),
                        tuple("batch-queue", 10, 3600000, 50000, "priority.batch", "priority-exchange"),
                        tuple("anomaly-queue", 150, 300000, 2000, "anomaly.detected", "anomaly-exchange"));
    }

    @Test
    @DisplayName("every tier dead-letters to dlq-exchange under 'failed'")
    void shouldDeadLetterEveryTier() {
        assertThat(topology.deadLetter().queueName()).isEqualTo("dlq-queue");
        topology.queues().forEach(q -> assertThat(topology.argumentsFor(q).values())
                .containsEntry("x-dead-letter-exchange", "dlq-exchange")
                .containsEntry("x-dead-letter-routing-key", "failed")
                .containsEntry("x-overflow", "reject-publish")
                .hasSize(6));
    }
}
