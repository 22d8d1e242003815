package com.enterprise.agentmarketplace.core;

import com.enterprise.agentmarketplace.agent.CancellationToken;
import com.enterprise.agentmarketplace.model.AgentType;
import com.enterprise.agentmarketplace.model.ExecutionResult;
import com.enterprise.agentmarketplace.model.ExecutionStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owned handle of one in-flight execution.
 * <p>
 * {@code termination} completes once the worker can no longer touch the run's outputs;
 * {@code settled} completes once the terminal result has been published to the store.
 */
final class ExecutionHandle {

    private final String executionId;
    private final AgentType agentType;
    private final Instant submittedAt;
    private final CancellationToken cancellationToken;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CompletableFuture<ExecutionResult> termination = new CompletableFuture<>();
    private final CompletableFuture<ExecutionStatus> settled = new CompletableFuture<>();

    private Future<?> future;
    private boolean interruptRequested;

    // guarded by the ExecutionStateStore lock
    private boolean cancelRequested;

    ExecutionHandle(String executionId, AgentType agentType) {
        this.executionId = executionId;
        this.agentType = agentType;
        this.submittedAt = Instant.now();
        this.cancellationToken = new CancellationToken(executionId);
    }

    String getExecutionId() { return executionId; }
    AgentType getAgentType() { return agentType; }
    Instant getSubmittedAt() { return submittedAt; }
    CancellationToken getCancellationToken() { return cancellationToken; }

    /**
     * Claim the run. Exactly one of the worker and a canceller wins.
     */
    boolean claim() {
        return started.compareAndSet(false, true);
    }

    synchronized void attach(Future<?> future) {
        this.future = future;
        if (interruptRequested) {
            future.cancel(true);
        }
    }

    synchronized void interrupt() {
        interruptRequested = true;
        if (future != null) {
            future.cancel(true);
        }
    }

    boolean isCancelRequested() {
        return cancelRequested;
    }

    void markCancelRequested() {
        this.cancelRequested = true;
    }

    void terminated(ExecutionResult partialOrFinal) {
        termination.complete(partialOrFinal);
    }

    /**
     * Run {@code action} once the worker has stopped, immediately if it already has.
     */
    void whenTerminated(Runnable action) {
        termination.thenRun(action);
    }

    boolean hasTerminated() {
        return termination.isDone();
    }

    /**
     * Wait for the worker to stop. Returns null if it did not stop in time or produced nothing.
     */
    ExecutionResult awaitTermination(Duration timeout) throws InterruptedException {
        try {
            return termination.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return null;
        } catch (ExecutionException e) {
            // termination is never completed exceptionally
            throw new IllegalStateException(e.getCause());
        }
    }

    void settle(ExecutionStatus status) {
        settled.complete(status);
    }

    ExecutionStatus awaitSettled() throws InterruptedException {
        try {
            return settled.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException(e.getCause());
        }
    }

    ExecutionStatus awaitSettled(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return settled.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException(e.getCause());
        }
    }

    boolean isSettled() {
        return settled.isDone();
    }
}
