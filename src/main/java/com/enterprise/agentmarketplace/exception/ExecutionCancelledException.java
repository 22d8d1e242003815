package com.enterprise.agentmarketplace.exception;

/**
 * Raised at a cancellation checkpoint once cancellation has been requested
 */
public class ExecutionCancelledException extends RuntimeException {

    private final String executionId;

    public ExecutionCancelledException(String executionId) {
        super("Execution cancelled: " + executionId);
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }
}
