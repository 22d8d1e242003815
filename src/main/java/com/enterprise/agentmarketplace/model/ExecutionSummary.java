package com.enterprise.agentmarketplace.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Condensed, read-only view of an execution result
 */
public class ExecutionSummary {

    private final String executionId;
    private final AgentType agentType;
    private final ExecutionStatus status;
    private final Instant startTime;
    private final Instant endTime;
    private final Duration duration;
    private final int totalTests;
    private final int passedTests;
    private final int failedTests;
    private final int skippedTests;
    private final int errorTests;
    private final double passRate;
    private final int totalRootCauses;
    private final int totalRecommendations;
    private final int totalEvidenceFiles;

    private ExecutionSummary(ExecutionResult result) {
        this.executionId = result.getExecutionId();
        this.agentType = result.getAgentType();
        this.status = result.getStatus();
        this.startTime = result.getStartTime();
        this.endTime = result.getEndTime();
        this.duration = result.getDuration();
        this.totalTests = result.getTotalTests();
        this.passedTests = result.getPassedTests();
        this.failedTests = result.getFailedTests();
        this.skippedTests = result.getSkippedTests();
        this.errorTests = result.getErrorTests();
        this.passRate = totalTests > 0 ? (double) passedTests / totalTests * 100 : 0.0;
        this.totalRootCauses = result.getRootCauseAnalyses().size();
        this.totalRecommendations = result.getRecommendations().size();
        this.totalEvidenceFiles = result.getEvidences().size();
    }

    public static ExecutionSummary of(ExecutionResult result) {
        return new ExecutionSummary(result);
    }

    public String getExecutionId() { return executionId; }
    public AgentType getAgentType() { return agentType; }
    public ExecutionStatus getStatus() { return status; }
    public Instant getStartTime() { return startTime; }
    public Instant getEndTime() { return endTime; }
    public Duration getDuration() { return duration; }
    public int getTotalTests() { return totalTests; }
    public int getPassedTests() { return passedTests; }
    public int getFailedTests() { return failedTests; }
    public int getSkippedTests() { return skippedTests; }
    public int getErrorTests() { return errorTests; }

    /**
     * Percentage of passed tests, 0 when nothing ran
     */
    public double getPassRate() { return passRate; }
    public int getTotalRootCauses() { return totalRootCauses; }
    public int getTotalRecommendations() { return totalRecommendations; }
    public int getTotalEvidenceFiles() { return totalEvidenceFiles; }

    @Override
    public String toString() {
        return String.format("%s [%s] %s: %d/%d passed (%.1f%%)",
            executionId, agentType.getId(), status, passedTests, totalTests, passRate);
    }
}
