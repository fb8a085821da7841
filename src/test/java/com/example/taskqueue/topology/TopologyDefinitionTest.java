package com.example.taskqueue.topology;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TopologyDefinition Tests")
class TopologyDefinitionTest {

    private static final List<ExchangeSpec> EXCHANGES = List.of(
            ExchangeSpec.durableTopic("priority-exchange"),
            ExchangeSpec.durableDirect("anomaly-exchange"),
            ExchangeSpec.durableDirect("dlq-exchange"));
    private static final DeadLetterSpec DEAD_LETTER = new DeadLetterSpec("dlq-queue", "dlq-exchange", "failed");
    private static final RoutingClassifier ROUTING = new RoutingClassifier("priority-exchange", "anomaly-exchange");

    private static TopologyDefinition topology(List<ExchangeSpec> exchanges, List<QueueSpec> queues) {
        return new TopologyDefinition(exchanges, queues, DEAD_LETTER, ROUTING);
    }

    @Test
    @DisplayName("bindings → dead-letter first, then one per queue on its classified exchange")
    void shouldDeriveBindings() {
        TopologyDefinition topology = topology(EXCHANGES, List.of(
                new QueueSpec("normal-priority-queue", 100, 600_000, 10_000, "priority.normal"),
                new QueueSpec("anomaly-queue", 150, 300_000, 2_000, "anomaly.detected")));

        assertThat(topology.bindings()).containsExactly(
                new BindingSpec("dlq-exchange", "dlq-queue", "failed"),
                new BindingSpec("priority-exchange", "normal-priority-queue", "priority.normal"),
                new BindingSpec("anomaly-exchange", "anomaly-queue", "anomaly.detected"));
        assertThat(topology.queueNames()).containsExactly("normal-priority-queue", "anomaly-queue", "dlq-queue");
    }

    @Test
    @DisplayName("duplicate exchange name → rejected")
    void shouldRejectDuplicateExchange() {
        List<ExchangeSpec> exchanges = List.of(
                ExchangeSpec.durableTopic("priority-exchange"),
                ExchangeSpec.durableDirect("priority-exchange"),
                ExchangeSpec.durableDirect("anomaly-exchange"),
                ExchangeSpec.durableDirect("dlq-exchange"));

        assertThatThrownBy(() -> topology(exchanges, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate exchange");
    }

    @Test
    @DisplayName("duplicate queue name → rejected")
    void shouldRejectDuplicateQueue() {
        QueueSpec queue = new QueueSpec("batch-queue", 10, 3_600_000, 50_000, "priority.batch");

        assertThatThrownBy(() -> topology(EXCHANGES, List.of(queue, queue)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate queue: batch-queue");
    }

    @Test
    @DisplayName("queue named like the dead-letter queue → rejected")
    void shouldRejectQueueShadowingDeadLetter() {
        QueueSpec queue = new QueueSpec("dlq-queue", 10, 1_000, 10, "priority.batch");

        assertThatThrownBy(() -> topology(EXCHANGES, List.of(queue)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate queue: dlq-queue");
    }

    @Test
    @DisplayName("dead-letter exchange not declared → rejected")
    void shouldRejectUndeclaredDeadLetterExchange() {
        List<ExchangeSpec> exchanges = EXCHANGES.subList(0, 2);

        assertThatThrownBy(() -> topology(exchanges, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dead-letter exchange is not declared");
    }

    @Test
    @DisplayName("priority outside [1, 255], non-positive ttl or length → rejected")
    void shouldValidateQueueRanges() {
        assertThatThrownBy(() -> new QueueSpec("q", 0, 1_000, 10, "k")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new QueueSpec("q", 256, 1_000, 10, "k")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new QueueSpec("q", 1, 0, 10, "k")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new QueueSpec("q", 1, 1_000, -1, "k")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new QueueSpec("q", 1, 1_000, 10, " ")).isInstanceOf(IllegalArgumentException.class);
        assertThatCode(() -> new QueueSpec("q", 255, 1, 1, "k")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("definition lists are copies the caller cannot change")
    void shouldCopyLists() {
        TopologyDefinition topology = topology(EXCHANGES, List.of());

        assertThatThrownBy(() -> topology.exchanges().add(ExchangeSpec.durableDirect("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
