package com.example.taskqueue.config;

import com.example.taskqueue.broker.ReadinessResult;
import com.example.taskqueue.broker.ReadinessWaiter;
import com.example.taskqueue.report.TopologyReporter;
import com.example.taskqueue.service.ProvisionReport;
import com.example.taskqueue.service.TopologyProvisioner;
import com.example.taskqueue.service.TopologyVerifier;
import com.example.taskqueue.service.VerificationReport;
import com.example.taskqueue.service.VerificationStatus;
import com.example.taskqueue.topology.TopologyDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One-shot startup pipeline: wait for the broker, provision, verify, print the summary.
 *
 * <p>Exit codes: 0 when the run completed (individual resource failures are only reported),
 * 1 when the broker never became reachable, 2 when the connection dropped mid-run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TopologySetupRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_UNREACHABLE = 1;
    static final int EXIT_CONNECTION_LOST = 2;

    private final TopologyDefinition topology;
    private final ReadinessProperties readinessProperties;
    private final ReadinessWaiter readinessWaiter;
    private final TopologyProvisioner provisioner;
    private final TopologyVerifier verifier;
    private final TopologyReporter reporter;

    private int exitCode;

    @Override
    public void run(String... args) {
        ReadinessResult readiness = readinessWaiter.waitUntilReady(readinessProperties.policy());
        if (!readiness.isReady()) {
            System.err.println("Broker unreachable after " + readiness.attempts() + " attempts: " + readiness.lastError());
            exitCode = EXIT_UNREACHABLE;
            return;
        }

        ProvisionReport provision = provisioner.provision(topology);
        VerificationReport verification;
        if (provision.aborted()) {
            log.warn("event=verify_skipped reason=connection_lost");
            verification = notVerified();
            exitCode = EXIT_CONNECTION_LOST;
        } else {
            verification = verifier.verify(topology);
        }

        System.out.println(reporter.summarize(topology, provision, verification));
    }

    private VerificationReport notVerified() {
        Map<String, VerificationStatus> statuses = new LinkedHashMap<>();
        topology.queueNames().forEach(name -> statuses.put(name, VerificationStatus.ABSENT));
        return new VerificationReport(statuses);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
