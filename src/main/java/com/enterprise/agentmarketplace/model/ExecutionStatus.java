package com.enterprise.agentmarketplace.model;

/**
 * Lifecycle state of a single agent execution
 */
public enum ExecutionStatus {
    PENDING,        // Created but not yet picked up by a worker
    RUNNING,        // Pipeline stages are being executed
    COMPLETED,      // All stages finished
    FAILED,         // Validation failed or a stage raised
    CANCELLED;      // Stopped by a caller or by a timeout

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
