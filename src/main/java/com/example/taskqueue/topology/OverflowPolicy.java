package com.example.taskqueue.topology;

/**
 * Broker behaviour once a queue reaches its max length.
 * Only reject-publish is used: publishers get an error instead of the oldest message being dropped.
 */
public enum OverflowPolicy {
    REJECT_PUBLISH("reject-publish");

    private final String value;

    OverflowPolicy(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
