package com.enterprise.agentmarketplace.exception;

/**
 * Base exception for errors surfaced synchronously by the marketplace
 */
public class AgentExecutionException extends Exception {

    public AgentExecutionException(String message) {
        super(message);
    }

    public AgentExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
