package com.enterprise.agentmarketplace.agent;

import com.enterprise.agentmarketplace.exception.ExecutionCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared between the orchestrator and one pipeline run.
 * The pipeline driver checks it before every stage; agents with long-running stages
 * may check it themselves.
 */
public class CancellationToken {

    private final String executionId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public CancellationToken(String executionId) {
        this.executionId = executionId;
    }

    /**
     * Request cancellation. Returns true only for the first request.
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new ExecutionCancelledException(executionId);
        }
    }
}
