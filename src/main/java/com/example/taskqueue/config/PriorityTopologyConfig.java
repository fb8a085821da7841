package com.example.taskqueue.config;

import com.example.taskqueue.broker.Sleeper;
import com.example.taskqueue.topology.DeadLetterSpec;
import com.example.taskqueue.topology.ExchangeSpec;
import com.example.taskqueue.topology.QueueSpec;
import com.example.taskqueue.topology.RoutingClassifier;
import com.example.taskqueue.topology.TopologyDefinition;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * The fixed topology producers and consumers of the task queue depend on.
 * Names and values are part of the contract with those services; change them together.
 */
@Configuration
public class PriorityTopologyConfig {

    public static final String PRIORITY_EXCHANGE = "priority-exchange";
    public static final String ANOMALY_EXCHANGE = "anomaly-exchange";
    public static final String DLQ_EXCHANGE = "dlq-exchange";

    public static final String CRITICAL_QUEUE = "critical-priority-queue";
    public static final String HIGH_QUEUE = "high-priority-queue";
    public static final String NORMAL_QUEUE = "normal-priority-queue";
    public static final String LOW_QUEUE = "low-priority-queue";
    public static final String BATCH_QUEUE = "batch-queue";
    public static final String ANOMALY_QUEUE = "anomaly-queue";
    public static final String DLQ_QUEUE = "dlq-queue";

    public static final String CRITICAL_KEY = "priority.critical";
    public static final String HIGH_KEY = "priority.high";
    public static final String NORMAL_KEY = "priority.normal";
    public static final String LOW_KEY = "priority.low";
    public static final String BATCH_KEY = "priority.batch";
    public static final String ANOMALY_KEY = "anomaly.detected";
    public static final String DLQ_KEY = "failed";

    @Bean
    public TopologyDefinition priorityTopology() {
        return new TopologyDefinition(
                List.of(
                        ExchangeSpec.durableTopic(PRIORITY_EXCHANGE),
                        ExchangeSpec.durableDirect(ANOMALY_EXCHANGE),
                        ExchangeSpec.durableDirect(DLQ_EXCHANGE)),
                List.of(
                        new QueueSpec(CRITICAL_QUEUE, 255, 60_000, 1_000, CRITICAL_KEY),     // 1 min
                        new QueueSpec(HIGH_QUEUE, 200, 300_000, 5_000, HIGH_KEY),            // 5 min
                        new QueueSpec(NORMAL_QUEUE, 100, 600_000, 10_000, NORMAL_KEY),       // 10 min
                        new QueueSpec(LOW_QUEUE, 50, 1_800_000, 20_000, LOW_KEY),            // 30 min
                        new QueueSpec(BATCH_QUEUE, 10, 3_600_000, 50_000, BATCH_KEY),        // 1 h
                        new QueueSpec(ANOMALY_QUEUE, 150, 300_000, 2_000, ANOMALY_KEY)),     // 5 min, kept small for review
                new DeadLetterSpec(DLQ_QUEUE, DLQ_EXCHANGE, DLQ_KEY),
                new RoutingClassifier(PRIORITY_EXCHANGE, ANOMALY_EXCHANGE));
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }
}
