package com.example.taskqueue.topology;

/**
 * Picks the exchange a queue is bound to from its name alone.
 * Names containing {@value #ANOMALY_MARKER} (case-sensitive) go to the anomaly exchange, everything else to the priority exchange.
 */
public record RoutingClassifier(String priorityExchange, String anomalyExchange) {

    public static final String ANOMALY_MARKER = "anomaly";

    public RoutingClassifier {
        if (priorityExchange == null || priorityExchange.isBlank()
                || anomalyExchange == null || anomalyExchange.isBlank()) {
            throw new IllegalArgumentException("both target exchanges must be named");
        }
    }

    public String classify(String queueName) {
        return queueName.contains(ANOMALY_MARKER) ? anomalyExchange : priorityExchange;
    }
}
