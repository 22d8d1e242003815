package com.enterprise.agentmarketplace.monitoring;

import com.enterprise.agentmarketplace.model.AgentType;
import com.enterprise.agentmarketplace.model.ExecutionResult;
import com.enterprise.agentmarketplace.model.ExecutionStatus;
import com.enterprise.agentmarketplace.model.TestCase;
import com.enterprise.agentmarketplace.model.TestOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsCollectorTest {

    private SimpleMeterRegistry registry;
    private MetricsCollector collector;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        collector = new MetricsCollector(registry);
    }

    @Test
    void testCountsExecutionsByOutcome() {
        collector.onExecutionStarted("exec-1", AgentType.UNIT_TESTING);
        collector.onExecutionStarted("exec-2", AgentType.UNIT_TESTING);
        collector.onExecutionSettled(result("exec-1", ExecutionStatus.COMPLETED, TestOutcome.PASSED, TestOutcome.FAILED));
        collector.onExecutionSettled(result("exec-2", ExecutionStatus.FAILED));
        collector.onExecutionSettled(result("exec-3", ExecutionStatus.CANCELLED));

        Map<String, Object> metrics = collector.getMetrics();

        assertEquals(2.0, metrics.get("executions.started"));
        assertEquals(1.0, metrics.get("executions.completed"));
        assertEquals(1.0, metrics.get("executions.failed"));
        assertEquals(1.0, metrics.get("executions.cancelled"));
        assertEquals(1.0, metrics.get("tests.passed"));
        assertEquals(1.0, metrics.get("tests.failed"));
        assertEquals(0.0, metrics.get("tests.errored"));
    }

    @Test
    void testPerAgentCountersAreTagged() {
        collector.onExecutionSettled(result("exec-1", ExecutionStatus.COMPLETED));
        collector.onExecutionSettled(result("exec-2", ExecutionStatus.COMPLETED));

        double count = registry.get("agentmarketplace.agent.executions")
            .tag("agent", "unit_testing")
            .tag("status", "completed")
            .counter()
            .count();

        assertEquals(2.0, count);
    }

    @Test
    void testExecutionTimeIsRecorded() {
        collector.onExecutionSettled(result("exec-1", ExecutionStatus.COMPLETED));

        assertEquals(1, registry.get("agentmarketplace.execution.time").timer().count());
        assertEquals(2000.0, (Double) collector.getMetrics().get("execution.time.max"), 0.001);
    }

    private static ExecutionResult result(String executionId, ExecutionStatus status, TestOutcome... outcomes) {
        Instant start = Instant.parse("2024-01-01T10:00:00Z");
        List<TestCase> testCases = new ArrayList<>();
        for (TestOutcome outcome : outcomes) {
            testCases.add(TestCase.builder().name("case-" + testCases.size()).outcome(outcome).build());
        }
        return ExecutionResult.builder(executionId, AgentType.UNIT_TESTING, start)
            .status(status)
            .endTime(start.plusSeconds(2))
            .testCases(testCases)
            .build();
    }
}
