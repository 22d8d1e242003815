package com.enterprise.agentmarketplace.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionResultTest {

    private static final Instant START = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    void testCountersFollowTestCaseOutcomes() {
        ExecutionResult result = ExecutionResult.builder("exec-1", AgentType.UNIT_TESTING, START)
            .status(ExecutionStatus.COMPLETED)
            .testCases(List.of(
                testCase(TestOutcome.PASSED), testCase(TestOutcome.PASSED), testCase(TestOutcome.FAILED),
                testCase(TestOutcome.SKIPPED), testCase(TestOutcome.ERROR), testCase(null)))
            .build();

        assertEquals(2, result.getPassedTests());
        assertEquals(1, result.getFailedTests());
        assertEquals(1, result.getSkippedTests());
        assertEquals(1, result.getErrorTests());
        assertEquals(5, result.getTotalTests());
        assertEquals(6, result.getTestCases().size());
    }

    @Test
    void testDurationDerivedFromEndTime() {
        ExecutionResult running = ExecutionResult.builder("exec-1", AgentType.LOAD_TESTING, START)
            .status(ExecutionStatus.RUNNING)
            .build();
        ExecutionResult finished = ExecutionResult.builder("exec-1", AgentType.LOAD_TESTING, START)
            .status(ExecutionStatus.COMPLETED)
            .endTime(START.plusSeconds(90))
            .build();

        assertNull(running.getDuration());
        assertEquals(Duration.ofSeconds(90), finished.getDuration());
    }

    @Test
    void testResultIsImmutable() {
        List<TestCase> testCases = new ArrayList<>(List.of(testCase(TestOutcome.PASSED)));
        ExecutionResult result = ExecutionResult.builder("exec-1", AgentType.UNIT_TESTING, START)
            .status(ExecutionStatus.COMPLETED)
            .testCases(testCases)
            .build();

        testCases.add(testCase(TestOutcome.FAILED));

        assertEquals(1, result.getTestCases().size());
        assertThrows(UnsupportedOperationException.class, () -> result.getTestCases().add(testCase(TestOutcome.PASSED)));
        assertThrows(UnsupportedOperationException.class, () -> result.getMetrics().put("x", 1));
    }

    @Test
    void testWithStatusKeepsOutputs() {
        ExecutionResult result = ExecutionResult.builder("exec-1", AgentType.UNIT_TESTING, START)
            .status(ExecutionStatus.RUNNING)
            .testCases(List.of(testCase(TestOutcome.PASSED)))
            .logs(List.of("started"))
            .build();

        ExecutionResult cancelled = result.withStatus(ExecutionStatus.CANCELLED);

        assertEquals(ExecutionStatus.CANCELLED, cancelled.getStatus());
        assertEquals(1, cancelled.getPassedTests());
        assertEquals(List.of("started"), cancelled.getLogs());
        assertEquals(ExecutionStatus.RUNNING, result.getStatus());
    }

    @Test
    void testMinimalResultHasNoOutputs() {
        ExecutionResult result = ExecutionResult.minimal("exec-1", AgentType.STRESS_TESTING,
                                                         ExecutionStatus.CANCELLED, START);

        assertEquals(ExecutionStatus.CANCELLED, result.getStatus());
        assertEquals(0, result.getTotalTests());
        assertTrue(result.getTestCases().isEmpty());
        assertNotNull(result.getEndTime());
        assertFalse(result.getDuration().isNegative());
    }

    @Test
    void testSummaryPassRate() {
        ExecutionResult result = ExecutionResult.builder("exec-1", AgentType.UNIT_TESTING, START)
            .status(ExecutionStatus.COMPLETED)
            .testCases(List.of(testCase(TestOutcome.PASSED), testCase(TestOutcome.PASSED),
                               testCase(TestOutcome.PASSED), testCase(TestOutcome.FAILED)))
            .build();

        ExecutionSummary summary = ExecutionSummary.of(result);

        assertEquals(75.0, summary.getPassRate(), 0.001);
        assertEquals(4, summary.getTotalTests());
        assertEquals(0.0, ExecutionSummary.of(ExecutionResult.minimal("exec-2", AgentType.UNIT_TESTING,
            ExecutionStatus.FAILED, START)).getPassRate(), 0.001);
    }

    @Test
    void testTerminalStatuses() {
        assertFalse(ExecutionStatus.RUNNING.isTerminal());
        assertTrue(ExecutionStatus.COMPLETED.isTerminal());
        assertTrue(ExecutionStatus.FAILED.isTerminal());
        assertTrue(ExecutionStatus.CANCELLED.isTerminal());
        assertEquals(AgentType.LOAD_TESTING, AgentType.fromId("load_testing"));
        assertThrows(IllegalArgumentException.class, () -> AgentType.fromId("chaos_testing"));
    }

    private static TestCase testCase(TestOutcome outcome) {
        return TestCase.builder().name("case").outcome(outcome).build();
    }
}
