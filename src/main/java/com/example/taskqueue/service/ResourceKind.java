package com.example.taskqueue.service;

public enum ResourceKind {
    EXCHANGE,
    QUEUE,
    /** Keyed by the bound queue's name; every queue has exactly one binding. */
    BINDING
}
