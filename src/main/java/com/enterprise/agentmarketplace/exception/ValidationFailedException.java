package com.enterprise.agentmarketplace.exception;

/**
 * Raised inside a pipeline run when the validate stage rejects the input
 */
public class ValidationFailedException extends AgentExecutionException {

    public static final String MESSAGE = "Input validation failed";

    public ValidationFailedException() {
        super(MESSAGE);
    }
}
