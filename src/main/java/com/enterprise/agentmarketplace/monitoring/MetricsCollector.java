package com.enterprise.agentmarketplace.monitoring;

import com.enterprise.agentmarketplace.core.AgentOrchestrator;
import com.enterprise.agentmarketplace.core.ExecutionListener;
import com.enterprise.agentmarketplace.model.AgentType;
import com.enterprise.agentmarketplace.model.ExecutionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Collects and exposes metrics for agent executions.
 * Registered with the orchestrator as an {@link ExecutionListener}.
 */
public class MetricsCollector implements ExecutionListener {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> agentTypeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<AgentType, Timer> agentTypeTimers = new ConcurrentHashMap<>();

    private final Counter executionsStarted;
    private final Counter executionsCompleted;
    private final Counter executionsFailed;
    private final Counter executionsCancelled;
    private final Counter testsPassed;
    private final Counter testsFailed;
    private final Counter testsErrored;

    private final Timer executionTime;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.executionsStarted = Counter.builder("agentmarketplace.executions.started")
            .description("Total number of executions whose pipeline started")
            .register(meterRegistry);

        this.executionsCompleted = Counter.builder("agentmarketplace.executions.completed")
            .description("Total number of executions completed")
            .register(meterRegistry);

        this.executionsFailed = Counter.builder("agentmarketplace.executions.failed")
            .description("Total number of executions that failed")
            .register(meterRegistry);

        this.executionsCancelled = Counter.builder("agentmarketplace.executions.cancelled")
            .description("Total number of executions cancelled or timed out")
            .register(meterRegistry);

        this.testsPassed = Counter.builder("agentmarketplace.tests.passed")
            .description("Test cases passed across all executions")
            .register(meterRegistry);

        this.testsFailed = Counter.builder("agentmarketplace.tests.failed")
            .description("Test cases failed across all executions")
            .register(meterRegistry);

        this.testsErrored = Counter.builder("agentmarketplace.tests.errored")
            .description("Test cases that raised an error across all executions")
            .register(meterRegistry);

        this.executionTime = Timer.builder("agentmarketplace.execution.time")
            .description("Execution wall-clock time")
            .register(meterRegistry);

        logger.info("MetricsCollector initialized");
    }

    /**
     * Expose the orchestrator's in-flight count as a gauge
     */
    public void bindActiveExecutions(AgentOrchestrator orchestrator) {
        Gauge.builder("agentmarketplace.executions.active", orchestrator, AgentOrchestrator::activeCount)
            .description("Number of executions currently running")
            .register(meterRegistry);
    }

    @Override
    public void onExecutionStarted(String executionId, AgentType agentType) {
        executionsStarted.increment();
        getAgentTypeCounter(agentType, "started").increment();

        logger.debug("Recorded execution start: {}", executionId);
    }

    @Override
    public void onExecutionSettled(ExecutionResult result) {
        switch (result.getStatus()) {
            case COMPLETED:
                executionsCompleted.increment();
                break;
            case FAILED:
                executionsFailed.increment();
                break;
            case CANCELLED:
                executionsCancelled.increment();
                break;
            default:
                break;
        }
        getAgentTypeCounter(result.getAgentType(), result.getStatus().name().toLowerCase()).increment();

        testsPassed.increment(result.getPassedTests());
        testsFailed.increment(result.getFailedTests());
        testsErrored.increment(result.getErrorTests());

        if (result.getDuration() != null) {
            executionTime.record(result.getDuration().toMillis(), TimeUnit.MILLISECONDS);
            getAgentTypeTimer(result.getAgentType()).record(result.getDuration().toMillis(), TimeUnit.MILLISECONDS);
        }

        logger.debug("Recorded execution {} settled as {}", result.getExecutionId(), result.getStatus());
    }

    private Counter getAgentTypeCounter(AgentType agentType, String status) {
        String key = agentType.getId() + "." + status;
        return agentTypeCounters.computeIfAbsent(key, k ->
            Counter.builder("agentmarketplace.agent.executions")
                .tag("agent", agentType.getId())
                .tag("status", status)
                .description("Execution count by agent type and status")
                .register(meterRegistry)
        );
    }

    private Timer getAgentTypeTimer(AgentType agentType) {
        return agentTypeTimers.computeIfAbsent(agentType, k ->
            Timer.builder("agentmarketplace.agent.execution.time")
                .tag("agent", agentType.getId())
                .description("Execution time by agent type")
                .register(meterRegistry)
        );
    }

    /**
     * Get all metrics as a map
     */
    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new ConcurrentHashMap<>();

        metrics.put("executions.started", executionsStarted.count());
        metrics.put("executions.completed", executionsCompleted.count());
        metrics.put("executions.failed", executionsFailed.count());
        metrics.put("executions.cancelled", executionsCancelled.count());
        metrics.put("tests.passed", testsPassed.count());
        metrics.put("tests.failed", testsFailed.count());
        metrics.put("tests.errored", testsErrored.count());

        metrics.put("execution.time.mean", executionTime.mean(TimeUnit.MILLISECONDS));
        metrics.put("execution.time.max", executionTime.max(TimeUnit.MILLISECONDS));

        return metrics;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
