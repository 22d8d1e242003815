package com.enterprise.agentmarketplace.core;

import com.enterprise.agentmarketplace.model.AgentType;
import com.enterprise.agentmarketplace.model.ExecutionResult;

/**
 * Observer of execution lifecycle events.
 * Callbacks run outside the state store lock; exceptions they throw are logged and ignored.
 */
public interface ExecutionListener {

    /**
     * Called on the worker thread before the first pipeline stage runs
     */
    default void onExecutionStarted(String executionId, AgentType agentType) {
    }

    /**
     * Called once the terminal result of an execution has been published
     */
    default void onExecutionSettled(ExecutionResult result) {
    }
}
