package com.example.taskqueue.config;

import com.example.taskqueue.broker.ReadinessPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "topology.readiness")
public record ReadinessProperties(
        @DefaultValue("30") int maxAttempts,
        @DefaultValue("2s") Duration interval
) {
    public ReadinessPolicy policy() {
        return new ReadinessPolicy(maxAttempts, interval);
    }
}
