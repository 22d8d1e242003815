package com.enterprise.agentmarketplace.agent;

import com.enterprise.agentmarketplace.exception.AgentExecutionException;
import com.enterprise.agentmarketplace.model.AgentInput;
import com.enterprise.agentmarketplace.model.AgentMetadata;
import com.enterprise.agentmarketplace.model.Recommendation;
import com.enterprise.agentmarketplace.model.RootCauseAnalysis;
import com.enterprise.agentmarketplace.model.TestCase;
import com.enterprise.agentmarketplace.model.TestEvidence;

import java.util.List;
import java.util.Map;

/**
 * Seven-stage pipeline contract implemented by every testing agent.
 * <p>
 * Stages are invoked by {@link com.enterprise.agentmarketplace.core.PipelineDriver}
 * strictly in declaration order, on a single worker thread, against a fresh agent
 * instance per execution. Implementations therefore need not be thread-safe, but
 * long-running stages should respond to interruption or check the context's
 * cancellation token.
 */
public interface TestingAgent {

    /**
     * Static description of the agent. Must not have side effects.
     */
    AgentMetadata getMetadata();

    /**
     * Stage 1. Returning false aborts the run with status FAILED.
     */
    boolean validateInputs(AgentInput input, ExecutionContext context)
        throws AgentExecutionException, InterruptedException;

    /**
     * Stage 2. Domain-specific planning artifacts, opaque to the orchestrator.
     */
    List<Map<String, Object>> generateScripts(AgentInput input, ExecutionContext context)
        throws AgentExecutionException, InterruptedException;

    /**
     * Stage 3. Fixtures consumed only by {@link #execute}.
     */
    Map<String, Object> generateData(AgentInput input, ExecutionContext context)
        throws AgentExecutionException, InterruptedException;

    /**
     * Stage 4. The only stage that determines pass/fail counts.
     */
    List<TestCase> execute(List<Map<String, Object>> scripts, Map<String, Object> data,
                           AgentInput input, ExecutionContext context)
        throws AgentExecutionException, InterruptedException;

    /**
     * Stage 5. Artifact references produced alongside the test cases.
     */
    List<TestEvidence> collectEvidence(List<TestCase> testCases, AgentInput input, ExecutionContext context)
        throws AgentExecutionException, InterruptedException;

    /**
     * Stage 6. Only invoked when at least one test case failed or errored.
     */
    List<RootCauseAnalysis> analyzeFailures(List<TestCase> testCases, AgentInput input, ExecutionContext context)
        throws AgentExecutionException, InterruptedException;

    /**
     * Stage 7. Only invoked after {@link #analyzeFailures}.
     */
    List<Recommendation> recommend(List<TestCase> testCases, List<RootCauseAnalysis> rootCauses,
                                   AgentInput input, ExecutionContext context)
        throws AgentExecutionException, InterruptedException;
}
