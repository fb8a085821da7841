package com.example.taskqueue.service;

public enum VerificationStatus {
    PRESENT,
    ABSENT
}
