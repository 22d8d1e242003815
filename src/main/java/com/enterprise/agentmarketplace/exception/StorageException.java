package com.enterprise.agentmarketplace.exception;

/**
 * Exception thrown when a result or evidence blob cannot be written
 */
public class StorageException extends AgentExecutionException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
