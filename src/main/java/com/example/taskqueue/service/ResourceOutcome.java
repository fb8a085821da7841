package com.example.taskqueue.service;

public record ResourceOutcome(
        ResourceKind kind,
        String name,
        boolean success,
        String reason
) {
    public static ResourceOutcome success(ResourceKind kind, String name) {
        return new ResourceOutcome(kind, name, true, null);
    }

    public static ResourceOutcome failure(ResourceKind kind, String name, String reason) {
        return new ResourceOutcome(kind, name, false, reason);
    }
}
