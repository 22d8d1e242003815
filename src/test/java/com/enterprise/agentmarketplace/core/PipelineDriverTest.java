package com.enterprise.agentmarketplace.core;

import com.enterprise.agentmarketplace.agent.CancellationToken;
import com.enterprise.agentmarketplace.agent.ExecutionContext;
import com.enterprise.agentmarketplace.exception.ValidationFailedException;
import com.enterprise.agentmarketplace.model.AgentInput;
import com.enterprise.agentmarketplace.model.AgentType;
import com.enterprise.agentmarketplace.model.ExecutionResult;
import com.enterprise.agentmarketplace.model.ExecutionStatus;
import com.enterprise.agentmarketplace.model.TestOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineDriverTest {

    private PipelineDriver driver;
    private CancellationToken token;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        driver = new PipelineDriver();
        token = new CancellationToken("exec-1");
        context = new ExecutionContext("exec-1", AgentType.UNIT_TESTING, Map.of(), token);
    }

    @Test
    void testPassingRunSkipsAnalysisStages() {
        StubAgent agent = new StubAgent(AgentType.UNIT_TESTING).outcomes(TestOutcome.PASSED, TestOutcome.PASSED);

        ExecutionResult result = driver.run(agent, AgentInput.empty(), context);

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertEquals(List.of(StubAgent.VALIDATE, StubAgent.SCRIPTS, StubAgent.DATA,
                             StubAgent.EXECUTE, StubAgent.EVIDENCE), agent.stages);
        assertEquals(2, result.getTotalTests());
        assertEquals(2, result.getPassedTests());
        assertTrue(result.getRootCauseAnalyses().isEmpty());
        assertTrue(result.getRecommendations().isEmpty());
        assertNotNull(result.getEndTime());
        assertFalse(result.getLogs().isEmpty());
    }

    @Test
    void testFailuresTriggerAnalysisAndRecommendations() {
        StubAgent agent = new StubAgent(AgentType.UNIT_TESTING)
            .outcomes(TestOutcome.PASSED, TestOutcome.FAILED, TestOutcome.ERROR, TestOutcome.SKIPPED);

        ExecutionResult result = driver.run(agent, AgentInput.empty(), context);

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertEquals(List.of(StubAgent.VALIDATE, StubAgent.SCRIPTS, StubAgent.DATA, StubAgent.EXECUTE,
                             StubAgent.EVIDENCE, StubAgent.ANALYZE, StubAgent.RECOMMEND), agent.stages);
        assertEquals(4, result.getTotalTests());
        assertEquals(1, result.getPassedTests());
        assertEquals(1, result.getFailedTests());
        assertEquals(1, result.getErrorTests());
        assertEquals(1, result.getSkippedTests());
        assertEquals(1, result.getRootCauseAnalyses().size());
        assertEquals(1, result.getRecommendations().size());
    }

    @Test
    void testMetricsArePercentagesOfAllTestCases() {
        StubAgent agent = new StubAgent(AgentType.UNIT_TESTING)
            .outcomes(TestOutcome.PASSED, TestOutcome.PASSED, TestOutcome.PASSED, TestOutcome.FAILED);

        ExecutionResult result = driver.run(agent, AgentInput.empty(), context);

        assertEquals(4, result.getMetrics().get("total_tests"));
        assertEquals(75.0, (Double) result.getMetrics().get("pass_rate"), 0.001);
        assertEquals(25.0, (Double) result.getMetrics().get("fail_rate"), 0.001);
        assertEquals(0.5, (Double) result.getMetrics().get("average_execution_time"), 0.001);
    }

    @Test
    void testNoMetricsWithoutTestCases() {
        StubAgent agent = new StubAgent(AgentType.UNIT_TESTING).outcomes();

        ExecutionResult result = driver.run(agent, AgentInput.empty(), context);

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertEquals(0, result.getTotalTests());
        assertTrue(result.getMetrics().isEmpty());
    }

    @Test
    void testValidationFailureStopsPipeline() {
        StubAgent agent = new StubAgent(AgentType.UNIT_TESTING).invalid();

        ExecutionResult result = driver.run(agent, AgentInput.empty(), context);

        assertEquals(ExecutionStatus.FAILED, result.getStatus());
        assertEquals(ValidationFailedException.MESSAGE, result.getErrorMessage());
        assertEquals(List.of(StubAgent.VALIDATE), agent.stages);
        assertTrue(result.getTestCases().isEmpty());
    }

    @Test
    void testStageFaultBecomesFailedResult() {
        StubAgent agent = new StubAgent(AgentType.UNIT_TESTING)
            .failIn(StubAgent.DATA, new IllegalStateException("fixture generator crashed"));

        ExecutionResult result = driver.run(agent, AgentInput.empty(), context);

        assertEquals(ExecutionStatus.FAILED, result.getStatus());
        assertEquals("fixture generator crashed", result.getErrorMessage());
        assertEquals(1, result.getTestScripts().size());
        assertFalse(agent.stages.contains(StubAgent.EXECUTE));
        assertTrue(result.getLogs().stream().anyMatch(line -> line.contains("fixture generator crashed")));
    }

    @Test
    void testFaultWithoutMessageUsesExceptionName() {
        StubAgent agent = new StubAgent(AgentType.UNIT_TESTING)
            .failIn(StubAgent.EVIDENCE, new NullPointerException());

        ExecutionResult result = driver.run(agent, AgentInput.empty(), context);

        assertEquals(ExecutionStatus.FAILED, result.getStatus());
        assertEquals(NullPointerException.class.getName(), result.getErrorMessage());
        assertEquals(1, result.getTotalTests());
    }

    @Test
    void testCancelledTokenStopsBeforeFirstStage() {
        StubAgent agent = new StubAgent(AgentType.UNIT_TESTING);
        token.cancel();

        ExecutionResult result = driver.run(agent, AgentInput.empty(), context);

        assertEquals(ExecutionStatus.CANCELLED, result.getStatus());
        assertNull(result.getErrorMessage());
        assertTrue(agent.stages.isEmpty());
    }

    @Test
    void testCancellationDuringStageKeepsPartialOutputs() {
        StubAgent agent = new StubAgent(AgentType.UNIT_TESTING) {
            @Override
            public Map<String, Object> generateData(AgentInput input, ExecutionContext context) {
                token.cancel();
                return super.generateData(input, context);
            }
        };

        ExecutionResult result = driver.run(agent, AgentInput.empty(), context);

        assertEquals(ExecutionStatus.CANCELLED, result.getStatus());
        assertEquals(1, result.getTestScripts().size());
        assertFalse(agent.stages.contains(StubAgent.EXECUTE));
    }
}
