package com.skillflow.shared.model;

public enum ExecutionStatus {
    PENDING,
    APPROVED,
    DENIED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
