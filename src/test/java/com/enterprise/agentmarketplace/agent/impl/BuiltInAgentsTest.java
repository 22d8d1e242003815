package com.enterprise.agentmarketplace.agent.impl;

import com.enterprise.agentmarketplace.agent.AgentRegistry;
import com.enterprise.agentmarketplace.agent.CancellationToken;
import com.enterprise.agentmarketplace.agent.ExecutionContext;
import com.enterprise.agentmarketplace.agent.TestingAgent;
import com.enterprise.agentmarketplace.core.PipelineDriver;
import com.enterprise.agentmarketplace.exception.ValidationFailedException;
import com.enterprise.agentmarketplace.model.AgentInput;
import com.enterprise.agentmarketplace.model.AgentType;
import com.enterprise.agentmarketplace.model.ExecutionResult;
import com.enterprise.agentmarketplace.model.ExecutionStatus;
import com.enterprise.agentmarketplace.model.TestCase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs every built-in agent through the full pipeline
 */
class BuiltInAgentsTest {

    private final AgentRegistry registry = AgentRegistry.defaultRegistry();
    private final PipelineDriver driver = new PipelineDriver();

    @Test
    void testFunctionalAgentBuildsAcceptanceCriteriaPerRequirement() throws Exception {
        AgentInput input = AgentInput.builder()
            .requirementsDoc("- Users can log in\n\n- Users can reset their password\n")
            .build();

        ExecutionResult result = run(AgentType.FUNCTIONAL_TESTING, input);

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertEquals(2, result.getTestScripts().size());
        assertEquals("REQ-001", result.getTestScripts().get(0).get("requirement_id"));
        assertEquals(4, result.getTotalTests());
        assertEquals("REQ-001_AC1", result.getTestCases().get(0).getName());
        assertEquals(8, result.getEvidences().size());
    }

    @Test
    void testFunctionalAgentAcceptsAnyRequirementDocument() throws Exception {
        AgentInput input = AgentInput.builder().brd("Invoices are emailed monthly").build();

        assertEquals(ExecutionStatus.COMPLETED, run(AgentType.FUNCTIONAL_TESTING, input).getStatus());
        assertEquals(List.of("Invoices are emailed monthly"), FunctionalTestingAgent.parseRequirements(input));
    }

    @Test
    void testIntegrationAgentMergesEndpointsAndSpecPaths() throws Exception {
        AgentInput input = AgentInput.builder()
            .endpoints(List.of("/users"))
            .apiSpecs(Map.of("paths", Map.of("/orders", Map.of(), "/users", Map.of())))
            .build();

        ExecutionResult result = run(AgentType.INTEGRATION_TESTING, input);

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertEquals(10, result.getTestScripts().size());
        assertEquals(20, result.getTotalTests());
        assertTrue(names(result).contains("GET_/users_valid_request"));
        assertTrue(names(result).contains("PATCH_/orders_invalid_request"));
    }

    @Test
    void testSecurityAgentCoversOwaspCategories() throws Exception {
        AgentInput input = AgentInput.builder().endpoints(List.of("/login")).build();

        ExecutionResult result = run(AgentType.SECURITY_TESTING, input);

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertEquals(SecurityTestingAgent.OWASP_CATEGORIES.size(), result.getTestScripts().size());
        assertEquals(19, result.getTotalTests());
        assertTrue(names(result).contains("SEC_injection_attacks_SQL_Injection"));
        assertTrue(names(result).contains("SEC_insufficient_logging_Generic_Test"));
        assertEquals(38, result.getEvidences().size());
    }

    @Test
    void testLoadAgentRunsEveryProfilePerEndpoint() throws Exception {
        AgentInput input = AgentInput.builder().endpoints(List.of("/a", "/b")).build();

        ExecutionResult result = run(AgentType.LOAD_TESTING, input);

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertEquals(LoadTestingAgent.PROFILES.size() * 2, result.getTotalTests());
        assertTrue(names(result).contains("Load_peak_load_/b"));
        assertEquals(16, result.getEvidences().size());
    }

    @Test
    void testStressAgentProducesNoEvidence() throws Exception {
        AgentInput input = AgentInput.builder().endpoints(List.of("/checkout")).build();

        ExecutionResult result = run(AgentType.STRESS_TESTING, input);

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertEquals(3, result.getTotalTests());
        assertTrue(names(result).contains("Stress_breaking_point_/checkout"));
        assertTrue(result.getEvidences().isEmpty());
    }

    @Test
    void testRegressionAgentRunsEverySuite() throws Exception {
        AgentInput input = AgentInput.builder().endpoints(List.of("/api")).build();

        ExecutionResult result = run(AgentType.REGRESSION_TESTING, input);

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertEquals(10, result.getTotalTests());
        assertTrue(names(result).contains("Regression_critical_path_payment"));
        assertEquals(10, result.getEvidences().size());
    }

    @Test
    void testEveryAgentRejectsEmptyInput() throws Exception {
        for (AgentType type : AgentType.values()) {
            ExecutionResult result = run(type, AgentInput.empty());

            assertEquals(ExecutionStatus.FAILED, result.getStatus(), type.getId());
            assertEquals(ValidationFailedException.MESSAGE, result.getErrorMessage(), type.getId());
        }
    }

    private ExecutionResult run(AgentType type, AgentInput input) throws Exception {
        TestingAgent agent = registry.create(type);
        ExecutionContext context = new ExecutionContext("exec-" + type.getId(), type, Map.of(),
                                                        new CancellationToken("exec-" + type.getId()));
        return driver.run(agent, input, context);
    }

    private static List<String> names(ExecutionResult result) {
        return result.getTestCases().stream().map(TestCase::getName).collect(Collectors.toList());
    }
}
