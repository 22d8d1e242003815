package com.enterprise.agentmarketplace.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate produced by one pipeline run.
 * Instances are immutable; a run accumulates its outputs in a {@link Builder}
 * and publishes the built result once it reaches a terminal state.
 */
public class ExecutionResult {

    private final String executionId;
    private final AgentType agentType;
    private final ExecutionStatus status;
    private final Instant startTime;
    private final Instant endTime;
    private final Duration duration;

    private final List<Map<String, Object>> testScripts;
    private final Map<String, Object> testData;
    private final List<TestCase> testCases;
    private final List<TestEvidence> evidences;

    private final int totalTests;
    private final int passedTests;
    private final int failedTests;
    private final int skippedTests;
    private final int errorTests;

    private final List<RootCauseAnalysis> rootCauseAnalyses;
    private final List<Recommendation> recommendations;

    private final List<String> logs;
    private final String errorMessage;
    private final Map<String, Object> metrics;

    @JsonCreator
    public ExecutionResult(@JsonProperty("executionId") String executionId,
                           @JsonProperty("agentType") AgentType agentType,
                           @JsonProperty("status") ExecutionStatus status,
                           @JsonProperty("startTime") Instant startTime,
                           @JsonProperty("endTime") Instant endTime,
                           @JsonProperty("duration") Duration duration,
                           @JsonProperty("testScripts") List<Map<String, Object>> testScripts,
                           @JsonProperty("testData") Map<String, Object> testData,
                           @JsonProperty("testCases") List<TestCase> testCases,
                           @JsonProperty("evidences") List<TestEvidence> evidences,
                           @JsonProperty("totalTests") int totalTests,
                           @JsonProperty("passedTests") int passedTests,
                           @JsonProperty("failedTests") int failedTests,
                           @JsonProperty("skippedTests") int skippedTests,
                           @JsonProperty("errorTests") int errorTests,
                           @JsonProperty("rootCauseAnalyses") List<RootCauseAnalysis> rootCauseAnalyses,
                           @JsonProperty("recommendations") List<Recommendation> recommendations,
                           @JsonProperty("logs") List<String> logs,
                           @JsonProperty("errorMessage") String errorMessage,
                           @JsonProperty("metrics") Map<String, Object> metrics) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.agentType = Objects.requireNonNull(agentType, "Agent type cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
        this.endTime = endTime;
        this.duration = duration;
        this.testScripts = unmodifiable(testScripts);
        this.testData = testData != null ? Collections.unmodifiableMap(new LinkedHashMap<>(testData)) : null;
        this.testCases = unmodifiable(testCases);
        this.evidences = unmodifiable(evidences);
        this.totalTests = totalTests;
        this.passedTests = passedTests;
        this.failedTests = failedTests;
        this.skippedTests = skippedTests;
        this.errorTests = errorTests;
        this.rootCauseAnalyses = unmodifiable(rootCauseAnalyses);
        this.recommendations = unmodifiable(recommendations);
        this.logs = unmodifiable(logs);
        this.errorMessage = errorMessage;
        this.metrics = metrics != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metrics)) : Map.of();
    }

    public String getExecutionId() { return executionId; }
    public AgentType getAgentType() { return agentType; }
    public ExecutionStatus getStatus() { return status; }
    public Instant getStartTime() { return startTime; }
    public Instant getEndTime() { return endTime; }
    public Duration getDuration() { return duration; }
    public List<Map<String, Object>> getTestScripts() { return testScripts; }
    public Map<String, Object> getTestData() { return testData; }
    public List<TestCase> getTestCases() { return testCases; }
    public List<TestEvidence> getEvidences() { return evidences; }
    public int getTotalTests() { return totalTests; }
    public int getPassedTests() { return passedTests; }
    public int getFailedTests() { return failedTests; }
    public int getSkippedTests() { return skippedTests; }
    public int getErrorTests() { return errorTests; }
    public List<RootCauseAnalysis> getRootCauseAnalyses() { return rootCauseAnalyses; }
    public List<Recommendation> getRecommendations() { return recommendations; }
    public List<String> getLogs() { return logs; }
    public String getErrorMessage() { return errorMessage; }
    public Map<String, Object> getMetrics() { return metrics; }

    /**
     * Copy of this result carrying a different status
     */
    public ExecutionResult withStatus(ExecutionStatus newStatus) {
        return new ExecutionResult(executionId, agentType, newStatus, startTime, endTime, duration,
                                   testScripts, testData, testCases, evidences,
                                   totalTests, passedTests, failedTests, skippedTests, errorTests,
                                   rootCauseAnalyses, recommendations, logs, errorMessage, metrics);
    }

    /**
     * Result for an execution that never produced outputs of its own,
     * e.g. one cancelled before its worker picked it up.
     */
    public static ExecutionResult minimal(String executionId, AgentType agentType,
                                          ExecutionStatus status, Instant startTime) {
        Instant now = Instant.now();
        Instant start = startTime != null && !startTime.isAfter(now) ? startTime : now;
        return builder(executionId, agentType, start)
            .status(status)
            .endTime(now)
            .build();
    }

    private static <T> List<T> unmodifiable(List<T> source) {
        return source != null ? Collections.unmodifiableList(new ArrayList<>(source)) : List.of();
    }

    @Override
    public String toString() {
        return "ExecutionResult{" +
                "executionId='" + executionId + '\'' +
                ", agentType=" + agentType +
                ", status=" + status +
                ", total=" + totalTests +
                ", passed=" + passedTests +
                ", failed=" + failedTests +
                ", errorMessage='" + errorMessage + '\'' +
                '}';
    }

    /**
     * Mutable accumulator used by a single pipeline run
     */
    public static class Builder {
        private final String executionId;
        private final AgentType agentType;
        private final Instant startTime;
        private ExecutionStatus status = ExecutionStatus.PENDING;
        private Instant endTime;
        private List<Map<String, Object>> testScripts = new ArrayList<>();
        private Map<String, Object> testData;
        private List<TestCase> testCases = new ArrayList<>();
        private List<TestEvidence> evidences = new ArrayList<>();
        private int passedTests;
        private int failedTests;
        private int skippedTests;
        private int errorTests;
        private List<RootCauseAnalysis> rootCauseAnalyses = new ArrayList<>();
        private List<Recommendation> recommendations = new ArrayList<>();
        private List<String> logs = new ArrayList<>();
        private String errorMessage;
        private Map<String, Object> metrics = new LinkedHashMap<>();

        private Builder(String executionId, AgentType agentType, Instant startTime) {
            this.executionId = executionId;
            this.agentType = agentType;
            this.startTime = startTime;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public ExecutionStatus getStatus() {
            return status;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder testScripts(List<Map<String, Object>> testScripts) {
            this.testScripts = testScripts != null ? testScripts : new ArrayList<>();
            return this;
        }

        public Builder testData(Map<String, Object> testData) {
            this.testData = testData;
            return this;
        }

        /**
         * Record the executed test cases and derive the outcome counters from them
         */
        public Builder testCases(List<TestCase> testCases) {
            this.testCases = testCases != null ? testCases : new ArrayList<>();
            passedTests = 0;
            failedTests = 0;
            skippedTests = 0;
            errorTests = 0;
            for (TestCase testCase : this.testCases) {
                if (testCase.getOutcome() == null) {
                    // counted in neither bucket; see build()
                    continue;
                }
                switch (testCase.getOutcome()) {
                    case PASSED: passedTests++; break;
                    case FAILED: failedTests++; break;
                    case SKIPPED: skippedTests++; break;
                    case ERROR: errorTests++; break;
                    default: break;
                }
            }
            return this;
        }

        public int getFailedTests() {
            return failedTests;
        }

        public int getErrorTests() {
            return errorTests;
        }

        public Builder evidences(List<TestEvidence> evidences) {
            this.evidences = evidences != null ? evidences : new ArrayList<>();
            return this;
        }

        public Builder rootCauseAnalyses(List<RootCauseAnalysis> rootCauseAnalyses) {
            this.rootCauseAnalyses = rootCauseAnalyses != null ? rootCauseAnalyses : new ArrayList<>();
            return this;
        }

        public Builder recommendations(List<Recommendation> recommendations) {
            this.recommendations = recommendations != null ? recommendations : new ArrayList<>();
            return this;
        }

        public Builder logs(List<String> logs) {
            this.logs = logs != null ? logs : new ArrayList<>();
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder metric(String name, Object value) {
            this.metrics.put(name, value);
            return this;
        }

        public ExecutionResult build() {
            Duration duration = endTime != null ? Duration.between(startTime, endTime) : null;
            // Test cases without an outcome are excluded so that total always equals the sum of the buckets
            int total = passedTests + failedTests + skippedTests + errorTests;
            return new ExecutionResult(executionId, agentType, status, startTime, endTime, duration,
                                       testScripts, testData, testCases, evidences,
                                       total, passedTests, failedTests, skippedTests, errorTests,
                                       rootCauseAnalyses, recommendations, logs, errorMessage, metrics);
        }
    }

    public static Builder builder(String executionId, AgentType agentType, Instant startTime) {
        return new Builder(executionId, agentType, startTime);
    }
}
