package com.example.taskqueue.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record VerificationReport(Map<String, VerificationStatus> statuses) {

    public VerificationReport {
        statuses = Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
    }

    public VerificationStatus status(String queueName) {
        return statuses.getOrDefault(queueName, VerificationStatus.ABSENT);
    }

    public boolean isPresent(String queueName) {
        return status(queueName) == VerificationStatus.PRESENT;
    }

    public List<String> absent() {
        return statuses.entrySet().stream()
                .filter(e -> e.getValue() == VerificationStatus.ABSENT)
                .map(Map.Entry::getKey)
                .toList();
    }

    public boolean allPresent() {
        return absent().isEmpty();
    }
}
