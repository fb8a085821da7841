package com.example.taskqueue.service;

import java.util.List;
import java.util.Optional;

/**
 * Per-resource outcome of one provisioning run, in the order resources were attempted.
 * A non-null {@code abortReason} means the connection dropped and later resources were never attempted.
 */
public record ProvisionReport(List<ResourceOutcome> outcomes, String abortReason) {

    public ProvisionReport {
        outcomes = List.copyOf(outcomes);
    }

    public boolean aborted() {
        return abortReason != null;
    }

    public Optional<ResourceOutcome> find(ResourceKind kind, String name) {
        return outcomes.stream()
                .filter(o -> o.kind() == kind && o.name().equals(name))
                .findFirst();
    }

    public boolean succeeded(ResourceKind kind, String name) {
        return find(kind, name).map(ResourceOutcome::success).orElse(false);
    }

    public List<ResourceOutcome> ofKind(ResourceKind kind) {
        return outcomes.stream().filter(o -> o.kind() == kind).toList();
    }

    public List<ResourceOutcome> failures() {
        return outcomes.stream().filter(o -> !o.success()).toList();
    }

    public long successCount() {
        return outcomes.stream().filter(ResourceOutcome::success).count();
    }

    public boolean allSucceeded() {
        return !aborted() && failures().isEmpty();
    }
}
