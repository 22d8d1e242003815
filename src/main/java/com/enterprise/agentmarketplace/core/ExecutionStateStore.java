package com.enterprise.agentmarketplace.core;

import com.enterprise.agentmarketplace.model.ExecutionResult;
import com.enterprise.agentmarketplace.model.ExecutionStatus;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Table of in-flight handles and terminal results keyed by execution id.
 * Every read and write goes through one lock; results are replaced, never mutated.
 */
class ExecutionStateStore {

    private final Lock lock = new ReentrantLock();
    private final Map<String, ExecutionHandle> inFlight = new HashMap<>();
    private final Map<String, ExecutionResult> results = new LinkedHashMap<>();

    void register(ExecutionHandle handle) {
        lock.lock();
        try {
            if (inFlight.containsKey(handle.getExecutionId()) || results.containsKey(handle.getExecutionId())) {
                throw new IllegalStateException("Execution id already tracked: " + handle.getExecutionId());
            }
            inFlight.put(handle.getExecutionId(), handle);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop a handle whose worker was never scheduled
     */
    void discard(ExecutionHandle handle) {
        lock.lock();
        try {
            inFlight.remove(handle.getExecutionId(), handle);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Publish the worker's result. Returns false when a canceller owns the outcome instead.
     */
    boolean complete(ExecutionHandle handle, ExecutionResult result) {
        lock.lock();
        try {
            if (handle.isCancelRequested() || inFlight.get(handle.getExecutionId()) != handle) {
                return false;
            }
            results.put(handle.getExecutionId(), result);
            inFlight.remove(handle.getExecutionId());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hand the outcome of a still in-flight execution to the caller.
     * Returns false if it already completed or another caller is cancelling it.
     */
    boolean claimCancellation(ExecutionHandle handle) {
        lock.lock();
        try {
            if (handle.isCancelRequested() || inFlight.get(handle.getExecutionId()) != handle) {
                return false;
            }
            handle.markCancelRequested();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store the cancelled result, keeping whatever the run produced before it stopped
     */
    ExecutionResult finishCancelled(ExecutionHandle handle, ExecutionResult partial) {
        ExecutionResult cancelled = partial != null
            ? partial.withStatus(ExecutionStatus.CANCELLED)
            : ExecutionResult.minimal(handle.getExecutionId(), handle.getAgentType(),
                                      ExecutionStatus.CANCELLED, handle.getSubmittedAt());
        lock.lock();
        try {
            results.put(handle.getExecutionId(), cancelled);
            inFlight.remove(handle.getExecutionId(), handle);
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    Optional<ExecutionHandle> inFlight(String executionId) {
        lock.lock();
        try {
            return Optional.ofNullable(inFlight.get(executionId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * RUNNING while tracked as in-flight, else the stored terminal status
     */
    Optional<ExecutionStatus> status(String executionId) {
        lock.lock();
        try {
            if (inFlight.containsKey(executionId)) {
                return Optional.of(ExecutionStatus.RUNNING);
            }
            ExecutionResult result = results.get(executionId);
            return result != null ? Optional.of(result.getStatus()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    Optional<ExecutionResult> result(String executionId) {
        lock.lock();
        try {
            return Optional.ofNullable(results.get(executionId));
        } finally {
            lock.unlock();
        }
    }

    List<ExecutionResult> listResults() {
        lock.lock();
        try {
            return new ArrayList<>(results.values());
        } finally {
            lock.unlock();
        }
    }

    int activeCount() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    List<String> runningIds() {
        lock.lock();
        try {
            return new ArrayList<>(inFlight.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forget remaining in-flight handles. Terminal results are kept.
     */
    void clearInFlight() {
        lock.lock();
        try {
            inFlight.clear();
        } finally {
            lock.unlock();
        }
    }
}
