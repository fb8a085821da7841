package com.example.taskqueue.broker;

import com.example.taskqueue.metrics.ProvisioningMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.stereotype.Component;

/**
 * Blocks until the broker accepts a connection or the attempt budget runs out.
 * Nothing downstream may touch the broker unless this returned {@link ReadinessResult.Status#READY}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReadinessWaiter {

    private final ConnectionFactory connectionFactory;
    private final Sleeper sleeper;
    private final ProvisioningMetrics metrics;

    public ReadinessResult waitUntilReady(ReadinessPolicy policy) {
        String lastError = null;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            metrics.recordReadinessAttempt();

            try (Connection probe = connectionFactory.createConnection()) {
                log.info("event=broker_ready attempt={} host={}", attempt, connectionFactory.getHost());
                return ReadinessResult.ready(attempt);
            } catch (AmqpException e) {
                lastError = e.getMessage();
                log.warn("event=broker_waiting attempt={}/{} error={}", attempt, policy.maxAttempts(), lastError);
            }

            if (attempt < policy.maxAttempts()) {
                try {
                    sleeper.sleep(policy.interval());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.error("event=broker_wait_interrupted attempt={}", attempt);
                    return ReadinessResult.exhausted(attempt, "interrupted");
                }
            }
        }

        log.error("event=broker_unreachable attempts={} error={}", policy.maxAttempts(), lastError);
        return ReadinessResult.exhausted(policy.maxAttempts(), lastError);
    }
}
