package com.enterprise.agentmarketplace.agent;

import com.enterprise.agentmarketplace.model.AgentInput;
import com.enterprise.agentmarketplace.model.AgentMetadata;
import com.enterprise.agentmarketplace.model.EvidenceType;
import com.enterprise.agentmarketplace.model.Recommendation;
import com.enterprise.agentmarketplace.model.RootCauseAnalysis;
import com.enterprise.agentmarketplace.model.Severity;
import com.enterprise.agentmarketplace.model.TestCase;
import com.enterprise.agentmarketplace.model.TestEvidence;
import com.enterprise.agentmarketplace.model.TestOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Common plumbing for the built-in agents: required-input validation and
 * builders for evidence, root cause and recommendation records.
 */
public abstract class AbstractTestingAgent implements TestingAgent {

    private final AgentMetadata metadata;

    protected AbstractTestingAgent() {
        this.metadata = createMetadata();
    }

    protected abstract AgentMetadata createMetadata();

    @Override
    public AgentMetadata getMetadata() {
        return metadata;
    }

    /**
     * Accepts the input when every declared required input is present
     */
    @Override
    public boolean validateInputs(AgentInput input, ExecutionContext context) {
        List<String> missing = metadata.getRequiredInputs().stream()
            .filter(field -> !input.isProvided(field))
            .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            context.log("Missing required inputs: " + String.join(", ", missing), ExecutionContext.LogLevel.ERROR);
            return false;
        }
        return true;
    }

    /**
     * Passes when at least one of the given inputs is present
     */
    protected boolean requireAnyOf(AgentInput input, ExecutionContext context, String message, String... fields) {
        for (String field : fields) {
            if (input.isProvided(field)) {
                return true;
            }
        }
        context.log(message, ExecutionContext.LogLevel.ERROR);
        return false;
    }

    protected static String newId() {
        return UUID.randomUUID().toString();
    }

    protected static List<TestCase> failingCases(List<TestCase> testCases) {
        return testCases.stream()
            .filter(tc -> tc.hasOutcome(TestOutcome.FAILED) || tc.hasOutcome(TestOutcome.ERROR))
            .collect(Collectors.toList());
    }

    /**
     * One evidence record per test case and requested kind.
     * File paths follow {@code evidence/<prefix>_<testCaseId>.<extension>}.
     */
    protected static List<TestEvidence> evidenceFor(List<TestCase> testCases, EvidenceKind... kinds) {
        List<TestEvidence> evidences = new ArrayList<>();
        for (TestCase testCase : testCases) {
            for (EvidenceKind kind : kinds) {
                String path = "evidence/" + kind.prefix + "_" + testCase.getId() + "." + kind.extension;
                evidences.add(TestEvidence.of(testCase, kind.type, path, kind.description));
            }
        }
        return evidences;
    }

    protected static RootCauseAnalysis rootCause(TestCase testCase, String category, String cause,
                                                 List<String> components, Severity severity) {
        return new RootCauseAnalysis(newId(), category, cause, components, severity, testCase.getErrorMessage());
    }

    protected static Recommendation recommendation(RootCauseAnalysis rca, String title, String category,
                                                   Severity priority, String suggestedFix,
                                                   List<Map<String, String>> codeChanges) {
        return new Recommendation(newId(), title, "Root cause: " + rca.getRootCause(), category,
                                  priority, suggestedFix, codeChanges, rca.getIssueId());
    }

    protected static Object configValue(AgentInput input, String key, Object fallback) {
        Map<String, Object> config = input.getConfig();
        if (config == null || !config.containsKey(key)) {
            return fallback;
        }
        return config.get(key);
    }

    /**
     * Describes one kind of evidence an agent emits for each test case
     */
    protected static final class EvidenceKind {
        final EvidenceType type;
        final String prefix;
        final String extension;
        final String description;

        public EvidenceKind(EvidenceType type, String prefix, String extension, String description) {
            this.type = type;
            this.prefix = prefix;
            this.extension = extension;
            this.description = description;
        }
    }
}
