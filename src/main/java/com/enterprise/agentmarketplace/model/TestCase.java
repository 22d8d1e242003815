package com.enterprise.agentmarketplace.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A single test case produced by the execute stage of a pipeline
 */
public class TestCase {

    private final String id;
    private final String name;
    private final String description;
    private final String testType;
    private final List<String> steps;
    private final String expectedResult;
    private final String actualResult;
    private final TestOutcome outcome;
    private final Double executionTimeSeconds;
    private final String errorMessage;
    private final List<String> evidenceFiles;

    @JsonCreator
    public TestCase(@JsonProperty("id") String id,
                    @JsonProperty("name") String name,
                    @JsonProperty("description") String description,
                    @JsonProperty("testType") String testType,
                    @JsonProperty("steps") List<String> steps,
                    @JsonProperty("expectedResult") String expectedResult,
                    @JsonProperty("actualResult") String actualResult,
                    @JsonProperty("outcome") TestOutcome outcome,
                    @JsonProperty("executionTimeSeconds") Double executionTimeSeconds,
                    @JsonProperty("errorMessage") String errorMessage,
                    @JsonProperty("evidenceFiles") List<String> evidenceFiles) {
        this.id = Objects.requireNonNull(id, "Test case ID cannot be null");
        this.name = Objects.requireNonNull(name, "Test case name cannot be null");
        this.description = description;
        this.testType = testType;
        this.steps = steps != null ? List.copyOf(steps) : List.of();
        this.expectedResult = expectedResult;
        this.actualResult = actualResult;
        this.outcome = outcome;
        this.executionTimeSeconds = executionTimeSeconds;
        this.errorMessage = errorMessage;
        this.evidenceFiles = evidenceFiles != null ? List.copyOf(evidenceFiles) : List.of();
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getTestType() { return testType; }
    public List<String> getSteps() { return steps; }
    public String getExpectedResult() { return expectedResult; }
    public String getActualResult() { return actualResult; }

    /**
     * Outcome of the test case, null when the case was never run
     */
    public TestOutcome getOutcome() { return outcome; }
    public Double getExecutionTimeSeconds() { return executionTimeSeconds; }
    public String getErrorMessage() { return errorMessage; }
    public List<String> getEvidenceFiles() { return evidenceFiles; }

    public boolean hasOutcome(TestOutcome expected) {
        return outcome == expected;
    }

    /**
     * Builder for creating TestCase instances
     */
    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String name;
        private String description;
        private String testType;
        private List<String> steps;
        private String expectedResult;
        private String actualResult;
        private TestOutcome outcome;
        private Double executionTimeSeconds;
        private String errorMessage;
        private List<String> evidenceFiles;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder testType(String testType) {
            this.testType = testType;
            return this;
        }

        public Builder steps(List<String> steps) {
            this.steps = steps;
            return this;
        }

        public Builder expectedResult(String expectedResult) {
            this.expectedResult = expectedResult;
            return this;
        }

        public Builder actualResult(String actualResult) {
            this.actualResult = actualResult;
            return this;
        }

        public Builder outcome(TestOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder executionTimeSeconds(double executionTimeSeconds) {
            this.executionTimeSeconds = executionTimeSeconds;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder evidenceFiles(List<String> evidenceFiles) {
            this.evidenceFiles = evidenceFiles;
            return this;
        }

        public TestCase build() {
            if (name == null) {
                throw new IllegalArgumentException("Test case name is required");
            }
            return new TestCase(id, name, description, testType, steps, expectedResult,
                                actualResult, outcome, executionTimeSeconds, errorMessage, evidenceFiles);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
