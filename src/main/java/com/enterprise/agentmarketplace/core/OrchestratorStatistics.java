package com.enterprise.agentmarketplace.core;

import com.enterprise.agentmarketplace.model.AgentType;

import java.time.Instant;
import java.util.Map;

/**
 * Statistics about the orchestrator
 */
public interface OrchestratorStatistics {

    /**
     * Total number of executions admitted
     */
    long getTotalSubmitted();

    long getTotalCompleted();

    long getTotalFailed();

    long getTotalCancelled();

    /**
     * Executions refused by admission control or by a saturated pool
     */
    long getTotalRejected();

    /**
     * Executions currently in flight
     */
    int getActiveExecutions();

    /**
     * Average wall-clock duration of settled executions in milliseconds
     */
    double getAverageExecutionTimeMs();

    long getUptimeMs();

    Instant getStartedAt();

    /**
     * Admitted execution counts by agent type
     */
    Map<AgentType, Long> getExecutionCountsByType();

    int getQueueSize();

    int getActiveThreadCount();
}
