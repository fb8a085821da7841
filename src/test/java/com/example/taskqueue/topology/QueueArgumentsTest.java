package com.example.taskqueue.topology;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("QueueArguments Tests")
class QueueArgumentsTest {

    private static final DeadLetterSpec DEAD_LETTER = new DeadLetterSpec("dlq-queue", "dlq-exchange", "failed");

    @Test
    @DisplayName("derived arguments → exactly the six x- keys with the queue's values")
    void shouldDeriveSixArguments() {
        QueueSpec queue = new QueueSpec("high-priority-queue", 200, 300_000, 5_000, "priority.high");

        QueueArguments args = QueueArguments.of(queue, DEAD_LETTER);

        assertThat(args.values()).containsExactly(
                entry("x-max-priority", 200),
                entry("x-message-ttl", 300_000),
                entry("x-max-length", 5_000),
                entry("x-dead-letter-exchange", "dlq-exchange"),
                entry("x-dead-letter-routing-key", "failed"),
                entry("x-overflow", "reject-publish"));
    }

    @Test
    @DisplayName("deriving twice from the same QueueSpec → equal mappings")
    void shouldDeriveIdentically() {
        QueueSpec queue = new QueueSpec("batch-queue", 10, 3_600_000, 50_000, "priority.batch");

        assertThat(QueueArguments.of(queue, DEAD_LETTER)).isEqualTo(QueueArguments.of(queue, DEAD_LETTER));
    }

    @Test
    @DisplayName("derived mapping cannot be modified")
    void shouldBeImmutable() {
        QueueArguments args = QueueArguments.of(
                new QueueSpec("low-priority-queue", 50, 1_800_000, 20_000, "priority.low"), DEAD_LETTER);

        assertThatThrownBy(() -> args.values().put("x-queue-mode", "lazy"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
