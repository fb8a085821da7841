package com.example.taskqueue.broker;

public record ReadinessResult(Status status, int attempts, String lastError) {

    public enum Status {
        READY,
        CONNECTIVITY_EXHAUSTED
    }

    public static ReadinessResult ready(int attempts) {
        return new ReadinessResult(Status.READY, attempts, null);
    }

    public static ReadinessResult exhausted(int attempts, String lastError) {
        return new ReadinessResult(Status.CONNECTIVITY_EXHAUSTED, attempts, lastError);
    }

    public boolean isReady() {
        return status == Status.READY;
    }
}
