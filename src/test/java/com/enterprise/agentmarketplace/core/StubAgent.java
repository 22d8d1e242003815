package com.enterprise.agentmarketplace.core;

import com.enterprise.agentmarketplace.agent.ExecutionContext;
import com.enterprise.agentmarketplace.agent.TestingAgent;
import com.enterprise.agentmarketplace.exception.AgentExecutionException;
import com.enterprise.agentmarketplace.model.AgentInput;
import com.enterprise.agentmarketplace.model.AgentMetadata;
import com.enterprise.agentmarketplace.model.AgentType;
import com.enterprise.agentmarketplace.model.Recommendation;
import com.enterprise.agentmarketplace.model.RootCauseAnalysis;
import com.enterprise.agentmarketplace.model.Severity;
import com.enterprise.agentmarketplace.model.TestCase;
import com.enterprise.agentmarketplace.model.TestEvidence;
import com.enterprise.agentmarketplace.model.TestOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Scriptable agent for driver and orchestrator tests.
 * Records every stage it enters and can fail, block or ignore interrupts on demand.
 */
class StubAgent implements TestingAgent {

    static final String VALIDATE = "validate";
    static final String SCRIPTS = "scripts";
    static final String DATA = "data";
    static final String EXECUTE = "execute";
    static final String EVIDENCE = "evidence";
    static final String ANALYZE = "analyze";
    static final String RECOMMEND = "recommend";

    final List<String> stages = new CopyOnWriteArrayList<>();
    final CountDownLatch executeEntered = new CountDownLatch(1);

    private final AgentType agentType;
    private boolean valid = true;
    private List<TestOutcome> outcomes = List.of(TestOutcome.PASSED);
    private String failingStage;
    private RuntimeException failure;
    private Error crash;
    private CountDownLatch release;
    private boolean ignoreInterrupts;

    StubAgent(AgentType agentType) {
        this.agentType = agentType;
    }

    StubAgent invalid() {
        this.valid = false;
        return this;
    }

    StubAgent outcomes(TestOutcome... outcomes) {
        this.outcomes = List.of(outcomes);
        return this;
    }

    StubAgent failIn(String stage, RuntimeException failure) {
        this.failingStage = stage;
        this.failure = failure;
        return this;
    }

    StubAgent crashIn(String stage, Error crash) {
        this.failingStage = stage;
        this.crash = crash;
        return this;
    }

    /**
     * Block inside the execute stage until {@code release} opens
     */
    StubAgent blockUntil(CountDownLatch release) {
        this.release = release;
        return this;
    }

    StubAgent ignoringInterrupts() {
        this.ignoreInterrupts = true;
        return this;
    }

    @Override
    public AgentMetadata getMetadata() {
        return new AgentMetadata(agentType, "Stub " + agentType.getId(), "Scripted test agent",
                                 AgentMetadata.DEFAULT_VERSION, List.of(), List.of(), List.of("stub"), 1);
    }

    @Override
    public boolean validateInputs(AgentInput input, ExecutionContext context) {
        enter(VALIDATE);
        return valid;
    }

    @Override
    public List<Map<String, Object>> generateScripts(AgentInput input, ExecutionContext context) {
        enter(SCRIPTS);
        return List.of(Map.of("script", "stub"));
    }

    @Override
    public Map<String, Object> generateData(AgentInput input, ExecutionContext context) {
        enter(DATA);
        return Map.of("rows", 1);
    }

    @Override
    public List<TestCase> execute(List<Map<String, Object>> scripts, Map<String, Object> data,
                                  AgentInput input, ExecutionContext context)
            throws AgentExecutionException, InterruptedException {
        enter(EXECUTE);
        executeEntered.countDown();
        if (release != null) {
            awaitRelease();
        }

        List<TestCase> testCases = new ArrayList<>();
        for (int i = 0; i < outcomes.size(); i++) {
            testCases.add(TestCase.builder()
                .id("case-" + i)
                .name("case-" + i)
                .outcome(outcomes.get(i))
                .executionTimeSeconds(0.5)
                .errorMessage(outcomes.get(i) == TestOutcome.PASSED ? null : "boom")
                .build());
        }
        return testCases;
    }

    @Override
    public List<TestEvidence> collectEvidence(List<TestCase> testCases, AgentInput input, ExecutionContext context) {
        enter(EVIDENCE);
        return List.of();
    }

    @Override
    public List<RootCauseAnalysis> analyzeFailures(List<TestCase> testCases, AgentInput input,
                                                   ExecutionContext context) {
        enter(ANALYZE);
        return List.of(new RootCauseAnalysis("rca-1", "Logic Error", "stub", List.of("stub"),
                                             Severity.MEDIUM, null));
    }

    @Override
    public List<Recommendation> recommend(List<TestCase> testCases, List<RootCauseAnalysis> rootCauses,
                                          AgentInput input, ExecutionContext context) {
        enter(RECOMMEND);
        return List.of(new Recommendation("rec-1", "Fix", "stub", "code_fix", Severity.MEDIUM,
                                          "fix it", List.of(), "rca-1"));
    }

    private void enter(String stage) {
        stages.add(stage);
        if (stage.equals(failingStage)) {
            if (crash != null) {
                throw crash;
            }
            throw failure;
        }
    }

    private void awaitRelease() throws InterruptedException {
        if (!ignoreInterrupts) {
            release.await();
            return;
        }
        boolean interrupted = false;
        while (release.getCount() > 0) {
            try {
                release.await(10, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
