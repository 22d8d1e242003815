package com.enterprise.agentmarketplace.exception;

/**
 * Exception thrown when an execution cannot be admitted, either because the
 * concurrency ceiling is reached or because the worker pool refused it.
 */
public class ExecutionRejectedException extends AgentExecutionException {

    public ExecutionRejectedException(String message) {
        super(message);
    }

    public ExecutionRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
