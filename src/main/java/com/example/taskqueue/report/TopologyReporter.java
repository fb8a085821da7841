package com.example.taskqueue.report;

import com.example.taskqueue.service.ProvisionReport;
import com.example.taskqueue.service.ResourceKind;
import com.example.taskqueue.service.ResourceOutcome;
import com.example.taskqueue.service.VerificationReport;
import com.example.taskqueue.topology.DeadLetterSpec;
import com.example.taskqueue.topology.ExchangeSpec;
import com.example.taskqueue.topology.QueueSpec;
import com.example.taskqueue.topology.TopologyDefinition;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Renders the operator-facing summary of a run. Pure formatting, no broker access.
 */
@Component
public class TopologyReporter {

    private static final String RULE = "=".repeat(60);

    public String summarize(TopologyDefinition topology, ProvisionReport provision, VerificationReport verification) {
        StringBuilder out = new StringBuilder();
        out.append("Priority Queue Topology").append('\n').append(RULE).append('\n');

        out.append("Exchanges").append('\n');
        for (ExchangeSpec exchange : topology.exchanges()) {
            Optional<ResourceOutcome> outcome = provision.find(ResourceKind.EXCHANGE, exchange.name());
            out.append("  ").append(mark(outcome)).append(' ').append(exchange.name())
                    .append(" (").append(exchange.kind().amqpType())
                    .append(exchange.durable() ? ", durable" : "").append(')')
                    .append(reasonSuffix(outcome)).append('\n');
        }

        DeadLetterSpec deadLetter = topology.deadLetter();
        out.append("Dead letter").append('\n');
        out.append("  ").append(status(provision, verification, deadLetter.queueName()))
                .append(' ').append(deadLetter.queueName())
                .append(" <- ").append(deadLetter.exchangeName())
                .append(" [").append(deadLetter.routingKey()).append(']').append('\n');
        appendFailures(out, provision, deadLetter.queueName(), "  ");

        out.append("Queues").append('\n');
        for (QueueSpec queue : topology.queues()) {
            out.append(queue.name()).append('\n');
            out.append("   Priority: ").append(queue.maxPriority()).append('/').append(QueueSpec.MAX_PRIORITY_CEILING).append('\n');
            out.append("   TTL: ").append(String.format(Locale.ROOT, "%.1fs", queue.ttlMillis() / 1000.0)).append('\n');
            out.append("   Max Length: ").append(queue.maxLength()).append('\n');
            out.append("   Routing: ").append(queue.routingKey()).append(" -> ").append(topology.targetExchange(queue)).append('\n');
            out.append("   Status: ").append(status(provision, verification, queue.name())).append('\n');
            appendFailures(out, provision, queue.name(), "   ");
        }

        out.append(RULE).append('\n');
        out.append(String.format(Locale.ROOT, "Resources: %d/%d succeeded, queues present: %d/%d",
                provision.successCount(), provision.outcomes().size(),
                verification.statuses().size() - verification.absent().size(), verification.statuses().size()));
        if (provision.aborted()) {
            out.append('\n').append("Run ended early: ").append(provision.abortReason());
        }
        return out.toString();
    }

    private static String status(ProvisionReport provision, VerificationReport verification, String queueName) {
        boolean pass = provision.succeeded(ResourceKind.QUEUE, queueName)
                && provision.succeeded(ResourceKind.BINDING, queueName)
                && verification.isPresent(queueName);
        return pass ? "PASS" : "FAIL";
    }

    private static void appendFailures(StringBuilder out, ProvisionReport provision, String queueName, String indent) {
        for (ResourceKind kind : new ResourceKind[]{ResourceKind.QUEUE, ResourceKind.BINDING}) {
            provision.find(kind, queueName)
                    .filter(o -> !o.success())
                    .ifPresent(o -> out.append(indent).append(kind.name().toLowerCase())
                            .append(" failed: ").append(o.reason()).append('\n'));
        }
    }

    private static String mark(Optional<ResourceOutcome> outcome) {
        return outcome.map(o -> o.success() ? "[OK]  " : "[FAIL]").orElse("[SKIP]");
    }

    private static String reasonSuffix(Optional<ResourceOutcome> outcome) {
        return outcome.filter(o -> !o.success()).map(o -> ": " + o.reason()).orElse("");
    }
}
