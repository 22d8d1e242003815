package com.enterprise.agentmarketplace.monitoring;

import com.enterprise.agentmarketplace.core.AgentOrchestrator;
import com.enterprise.agentmarketplace.core.OrchestratorStatistics;
import com.enterprise.agentmarketplace.storage.ResultStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Health checker for the agent marketplace
 */
public class HealthChecker {

    private static final Logger logger = LoggerFactory.getLogger(HealthChecker.class);

    private static final double MIN_SUCCESS_RATE = 80.0;
    private static final double MAX_MEMORY_USAGE = 90.0;

    private final AgentOrchestrator orchestrator;
    private final ResultStorage storage;
    private final int maxConcurrentExecutions;

    /**
     * @param storage may be null when result storage is disabled
     */
    public HealthChecker(AgentOrchestrator orchestrator, ResultStorage storage, int maxConcurrentExecutions) {
        this.orchestrator = orchestrator;
        this.storage = storage;
        this.maxConcurrentExecutions = maxConcurrentExecutions;
    }

    /**
     * Perform a comprehensive health check
     */
    public CompletableFuture<HealthStatus> performHealthCheck() {
        return CompletableFuture.supplyAsync(this::check);
    }

    /**
     * Run all checks on the calling thread
     */
    public HealthStatus check() {
        HealthStatus.Builder builder = HealthStatus.builder();

        checkOrchestratorStatus(builder);
        checkExecutions(builder);
        checkStorage(builder);
        checkSystemResources(builder);

        HealthStatus status = builder.build();
        if (!status.isHealthy()) {
            logger.warn("Health check failed: {}", status.failedChecks());
        }
        return status;
    }

    private void checkOrchestratorStatus(HealthStatus.Builder builder) {
        boolean running = orchestrator.isRunning();
        builder.addCheck("orchestrator.running", running,
            running ? "Orchestrator is running" : "Orchestrator is shut down");

        int agents = orchestrator.listAgents().size();
        builder.addCheck("orchestrator.agents", agents > 0,
            String.format("Registered agents: %d", agents));
    }

    private void checkExecutions(HealthStatus.Builder builder) {
        try {
            OrchestratorStatistics stats = orchestrator.getStatistics();

            int active = stats.getActiveExecutions();
            builder.addCheck("executions.capacity", active <= maxConcurrentExecutions,
                String.format("Active executions: %d of %d", active, maxConcurrentExecutions));

            long settled = stats.getTotalCompleted() + stats.getTotalFailed();
            if (settled > 0) {
                double successRate = (double) stats.getTotalCompleted() / settled * 100;
                builder.addCheck("executions.success_rate", successRate >= MIN_SUCCESS_RATE,
                    String.format("Execution success rate: %.2f%% (%d/%d)",
                        successRate, stats.getTotalCompleted(), settled));
            }

        } catch (RuntimeException e) {
            builder.addCheck("executions.status", false, "Error checking executions: " + e.getMessage());
        }
    }

    private void checkStorage(HealthStatus.Builder builder) {
        if (storage == null) {
            return;
        }
        try {
            int stored = storage.getStatistics().getTotalExecutions();
            builder.addCheck("storage.available", true, String.format("Stored results: %d", stored));
        } catch (RuntimeException e) {
            builder.addCheck("storage.available", false, "Error reading result storage: " + e.getMessage());
        }
    }

    private void checkSystemResources(HealthStatus.Builder builder) {
        Runtime runtime = Runtime.getRuntime();
        long totalMemory = runtime.totalMemory();
        long usedMemory = totalMemory - runtime.freeMemory();
        double memoryUsagePercent = (double) usedMemory / totalMemory * 100;

        builder.addCheck("system.memory", memoryUsagePercent < MAX_MEMORY_USAGE,
            String.format("Memory usage: %.2f%% (%d/%d MB)",
                memoryUsagePercent, usedMemory / 1024 / 1024, totalMemory / 1024 / 1024));
    }

    /**
     * Health status result
     */
    public static class HealthStatus {
        private final boolean healthy;
        private final Map<String, CheckResult> checks;
        private final Instant timestamp;

        private HealthStatus(boolean healthy, Map<String, CheckResult> checks, Instant timestamp) {
            this.healthy = healthy;
            this.checks = checks;
            this.timestamp = timestamp;
        }

        public boolean isHealthy() { return healthy; }
        public Map<String, CheckResult> getChecks() { return checks; }
        public Instant getTimestamp() { return timestamp; }

        String failedChecks() {
            StringBuilder failed = new StringBuilder();
            checks.forEach((name, check) -> {
                if (!check.isPassed()) {
                    failed.append(name).append(" (").append(check.getMessage()).append(") ");
                }
            });
            return failed.toString().trim();
        }

        public static class CheckResult {
            private final boolean passed;
            private final String message;

            public CheckResult(boolean passed, String message) {
                this.passed = passed;
                this.message = message;
            }

            public boolean isPassed() { return passed; }
            public String getMessage() { return message; }
        }

        public static class Builder {
            private final Map<String, CheckResult> checks = new ConcurrentHashMap<>();

            public Builder addCheck(String name, boolean passed, String message) {
                checks.put(name, new CheckResult(passed, message));
                return this;
            }

            public HealthStatus build() {
                boolean healthy = checks.values().stream().allMatch(CheckResult::isPassed);
                return new HealthStatus(healthy, checks, Instant.now());
            }
        }

        public static Builder builder() {
            return new Builder();
        }
    }
}
