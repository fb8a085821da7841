package com.example.taskqueue.metrics;

import com.example.taskqueue.service.ResourceKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class ProvisioningMetrics {

    private static final String METRIC_RESOURCE = "topology_resource_total";
    private static final String METRIC_READINESS_ATTEMPT = "topology_readiness_attempts_total";
    private static final String METRIC_QUEUE_ABSENT = "topology_queue_absent_total";
    private static final String METRIC_PROVISION_LATENCY = "topology_provision_seconds";

    private final MeterRegistry registry;

    private final Counter readinessAttemptCounter;
    private final Counter queueAbsentCounter;
    private final Timer provisionTimer;

    public ProvisioningMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.readinessAttemptCounter = createCounter(METRIC_READINESS_ATTEMPT, "broker connectivity probes issued");
        this.queueAbsentCounter = createCounter(METRIC_QUEUE_ABSENT, "queues missing after provisioning");
        this.provisionTimer = Timer.builder(METRIC_PROVISION_LATENCY).register(registry);
    }

    private Counter createCounter(String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }

    public void recordOutcome(ResourceKind kind, boolean success) {
        // tags vary per call, so the counter is looked up here
        Counter.builder(METRIC_RESOURCE)
                .tag("kind", kind.name().toLowerCase())
                .tag("status", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordReadinessAttempt() { readinessAttemptCounter.increment(); }

    public void recordQueueAbsent() { queueAbsentCounter.increment(); }

    public void recordProvisionDurationNs(long durationNs) {
        provisionTimer.record(durationNs, TimeUnit.NANOSECONDS);
    }
}
