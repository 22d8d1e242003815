package com.enterprise.agentmarketplace.core;

import com.enterprise.agentmarketplace.agent.ExecutionContext;
import com.enterprise.agentmarketplace.agent.TestingAgent;
import com.enterprise.agentmarketplace.exception.ExecutionCancelledException;
import com.enterprise.agentmarketplace.exception.ValidationFailedException;
import com.enterprise.agentmarketplace.model.AgentInput;
import com.enterprise.agentmarketplace.model.ExecutionResult;
import com.enterprise.agentmarketplace.model.ExecutionStatus;
import com.enterprise.agentmarketplace.model.RootCauseAnalysis;
import com.enterprise.agentmarketplace.model.TestCase;
import com.enterprise.agentmarketplace.model.TestOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Runs the seven pipeline stages of one agent in order and assembles the result.
 * Faults never escape {@link #run}: they are converted into a FAILED or CANCELLED result.
 */
public class PipelineDriver {

    private static final Logger logger = LoggerFactory.getLogger(PipelineDriver.class);

    public ExecutionResult run(TestingAgent agent, AgentInput input, ExecutionContext context) {
        Instant startTime = Instant.now();
        ExecutionResult.Builder result = ExecutionResult.builder(context.getExecutionId(), context.getAgentType(), startTime)
            .status(ExecutionStatus.RUNNING);

        try {
            context.log("Starting " + agent.getMetadata().getName() + " execution");

            checkpoint(context, "Validating inputs");
            if (!agent.validateInputs(input, context)) {
                throw new ValidationFailedException();
            }

            checkpoint(context, "Generating test scripts");
            List<Map<String, Object>> scripts = agent.generateScripts(input, context);
            result.testScripts(scripts);
            context.log("Generated " + (scripts != null ? scripts.size() : 0) + " test scripts");

            checkpoint(context, "Generating test data");
            Map<String, Object> data = agent.generateData(input, context);
            result.testData(data);

            checkpoint(context, "Executing tests");
            List<TestCase> testCases = agent.execute(scripts, data, input, context);
            result.testCases(testCases);
            recordMetrics(result, testCases);
            context.log(String.format("Tests completed: %d passed, %d failed, %d errors",
                testCount(testCases, TestOutcome.PASSED), result.getFailedTests(), result.getErrorTests()));

            checkpoint(context, "Collecting test evidence");
            result.evidences(agent.collectEvidence(testCases, input, context));

            if (result.getFailedTests() + result.getErrorTests() > 0) {
                checkpoint(context, "Performing root cause analysis");
                List<RootCauseAnalysis> rootCauses = agent.analyzeFailures(testCases, input, context);
                result.rootCauseAnalyses(rootCauses);

                checkpoint(context, "Generating recommendations");
                result.recommendations(agent.recommend(testCases, rootCauses, input, context));
            }

            result.status(ExecutionStatus.COMPLETED);
            context.log("Execution completed successfully");

        } catch (ExecutionCancelledException e) {
            markCancelled(result, context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            markCancelled(result, context);
        } catch (Exception e) {
            if (context.getCancellationToken().isCancelled() || Thread.currentThread().isInterrupted()) {
                markCancelled(result, context);
            } else {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
                context.log("Execution failed: " + message, ExecutionContext.LogLevel.ERROR);
                if (!(e instanceof ValidationFailedException)) {
                    logger.error("Execution {} failed in agent {}", context.getExecutionId(),
                                 context.getAgentType().getId(), e);
                }
                result.status(ExecutionStatus.FAILED).errorMessage(message);
            }
        } finally {
            result.endTime(Instant.now());
            result.logs(context.getLogs());
            logger.info("Execution {} ({}) finished with status {}", context.getExecutionId(),
                        context.getAgentType().getId(), result.getStatus());
        }

        return result.build();
    }

    private void checkpoint(ExecutionContext context, String stage) {
        context.getCancellationToken().throwIfCancelled();
        if (Thread.currentThread().isInterrupted()) {
            throw new ExecutionCancelledException(context.getExecutionId());
        }
        context.log(stage);
    }

    private void markCancelled(ExecutionResult.Builder result, ExecutionContext context) {
        context.log("Execution cancelled", ExecutionContext.LogLevel.WARNING);
        result.status(ExecutionStatus.CANCELLED);
    }

    /**
     * pass_rate and fail_rate are percentages of all test cases returned by the execute stage
     */
    private void recordMetrics(ExecutionResult.Builder result, List<TestCase> testCases) {
        if (testCases == null || testCases.isEmpty()) {
            return;
        }
        int total = testCases.size();
        double totalTime = testCases.stream()
            .filter(tc -> tc.getExecutionTimeSeconds() != null)
            .mapToDouble(TestCase::getExecutionTimeSeconds)
            .sum();
        result.metric("total_tests", total)
              .metric("pass_rate", testCount(testCases, TestOutcome.PASSED) * 100.0 / total)
              .metric("fail_rate", testCount(testCases, TestOutcome.FAILED) * 100.0 / total)
              .metric("average_execution_time", totalTime / total);
    }

    private static long testCount(List<TestCase> testCases, TestOutcome outcome) {
        return testCases == null ? 0 : testCases.stream().filter(tc -> tc.hasOutcome(outcome)).count();
    }
}
