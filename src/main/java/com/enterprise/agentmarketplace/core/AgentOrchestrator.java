package com.enterprise.agentmarketplace.core;

import com.enterprise.agentmarketplace.exception.AgentExecutionException;
import com.enterprise.agentmarketplace.exception.UnknownAgentTypeException;
import com.enterprise.agentmarketplace.model.AgentInput;
import com.enterprise.agentmarketplace.model.AgentMetadata;
import com.enterprise.agentmarketplace.model.AgentType;
import com.enterprise.agentmarketplace.model.BatchRequest;
import com.enterprise.agentmarketplace.model.ExecutionResult;
import com.enterprise.agentmarketplace.model.ExecutionStatus;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main interface for running testing agents.
 * Every operation is safe to call from concurrent request handlers.
 */
public interface AgentOrchestrator {

    /**
     * Launch one pipeline run in the background and return its new execution id.
     *
     * @throws UnknownAgentTypeException if no agent is registered for the type
     * @throws com.enterprise.agentmarketplace.exception.ExecutionRejectedException
     *         if the concurrency ceiling is reached or the worker pool is saturated
     * @throws IllegalStateException after {@link #shutdown()}
     */
    String startExecution(AgentType agentType, AgentInput input, Map<String, Object> config)
        throws AgentExecutionException;

    default String startExecution(AgentType agentType, AgentInput input) throws AgentExecutionException {
        return startExecution(agentType, input, Map.of());
    }

    /**
     * Launch a batch. Parallel batches are admitted as a whole and return once every item
     * is launched; sequential batches wait for each item before starting the next and stop
     * at the first FAILED item unless {@code continueOnFailure} is set.
     *
     * @throws com.enterprise.agentmarketplace.exception.ExecutionRejectedException
     *         if a parallel batch does not fit under the concurrency ceiling; nothing is left running
     *
     * @return execution ids of the launched items keyed by agent type, in launch order
     */
    Map<AgentType, String> startBatch(BatchRequest batch) throws AgentExecutionException, InterruptedException;

    /**
     * Wait for an execution to reach a terminal state
     */
    Optional<ExecutionStatus> awaitCompletion(String executionId) throws InterruptedException;

    /**
     * Wait at most {@code timeout}; an execution still running afterwards is cancelled
     */
    Optional<ExecutionStatus> awaitCompletion(String executionId, Duration timeout) throws InterruptedException;

    /**
     * Cancel a running execution and wait for its worker to stop.
     *
     * @return true if the execution was in flight, false if it is unknown or already terminal
     */
    boolean cancel(String executionId) throws InterruptedException;

    /**
     * RUNNING while in flight, the terminal status afterwards, empty for unknown ids
     */
    Optional<ExecutionStatus> status(String executionId);

    Optional<ExecutionResult> result(String executionId);

    /**
     * Terminal results held in memory
     */
    List<ExecutionResult> listResults();

    /**
     * Number of executions still in flight
     */
    int activeCount();

    List<AgentMetadata> listAgents();

    Optional<AgentMetadata> agentMetadata(AgentType agentType);

    void addListener(ExecutionListener listener);

    OrchestratorStatistics getStatistics();

    boolean isRunning();

    /**
     * Cancel every running execution and stop the worker pool. Terminal results are kept.
     */
    void shutdown();
}
