package com.example.taskqueue.service;

import com.example.taskqueue.broker.BrokerOperations;
import com.example.taskqueue.metrics.ProvisioningMetrics;
import com.example.taskqueue.topology.TopologyDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only check that every priority queue and the dead-letter queue exist.
 * Missing queues are reported, never re-created.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TopologyVerifier {

    private final BrokerOperations broker;
    private final ProvisioningMetrics metrics;

    public VerificationReport verify(TopologyDefinition topology) {
        Map<String, VerificationStatus> statuses = new LinkedHashMap<>();
        for (String queueName : topology.queueNames()) {
            statuses.put(queueName, check(queueName));
        }
        VerificationReport report = new VerificationReport(statuses);
        log.info("event=verify_done present={} absent={}",
                statuses.size() - report.absent().size(), report.absent());
        return report;
    }

    private VerificationStatus check(String queueName) {
        boolean present;
        try {
            present = broker.queueExists(queueName);
        } catch (AmqpException e) {
            log.warn("event=verify_check_failed queue={} error={}", queueName, TopologyProvisioner.reason(e));
            present = false;
        }

        if (!present) {
            metrics.recordQueueAbsent();
            log.warn("event=queue_absent queue={}", queueName);
            return VerificationStatus.ABSENT;
        }
        return VerificationStatus.PRESENT;
    }
}
