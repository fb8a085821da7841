package com.example.taskqueue.topology;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Broker-facing {@code x-} arguments of a priority queue.
 * Always exactly six entries, derived the same way on every run so re-declaration stays a no-op.
 */
public record QueueArguments(Map<String, Object> values) {

    public static final String MAX_PRIORITY = "x-max-priority";
    public static final String MESSAGE_TTL = "x-message-ttl";
    public static final String MAX_LENGTH = "x-max-length";
    public static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    public static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
    public static final String OVERFLOW = "x-overflow";

    public QueueArguments {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static QueueArguments of(QueueSpec queue, DeadLetterSpec deadLetter) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(MAX_PRIORITY, queue.maxPriority());
        args.put(MESSAGE_TTL, queue.ttlMillis());
        args.put(MAX_LENGTH, queue.maxLength());
        args.put(DEAD_LETTER_EXCHANGE, deadLetter.exchangeName());
        args.put(DEAD_LETTER_ROUTING_KEY, deadLetter.routingKey());
        args.put(OVERFLOW, queue.overflowPolicy().value());
        return new QueueArguments(args);
    }

    public Object get(String key) {
        return values.get(key);
    }
}
