package com.enterprise.agentmarketplace.monitoring;

import com.enterprise.agentmarketplace.agent.AgentRegistry;
import com.enterprise.agentmarketplace.config.MarketplaceConfig;
import com.enterprise.agentmarketplace.core.AgentOrchestratorImpl;
import com.enterprise.agentmarketplace.core.PipelineExecutor;
import com.enterprise.agentmarketplace.model.AgentInput;
import com.enterprise.agentmarketplace.model.AgentType;
import com.enterprise.agentmarketplace.storage.MapDBResultStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.time.Duration;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HealthCheckerTest {

    @TempDir
    File tempDir;

    private AgentOrchestratorImpl orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new AgentOrchestratorImpl(AgentRegistry.defaultRegistry(),
            new PipelineExecutor(2, 4, 1000, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(20)),
            MarketplaceConfig.Defaults.defaultExecutionConfig(), Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    @Test
    void testRunningOrchestratorChecks() throws Exception {
        HealthChecker checker = new HealthChecker(orchestrator, null, 10);

        HealthChecker.HealthStatus status = checker.performHealthCheck().get(5, TimeUnit.SECONDS);

        assertTrue(status.getChecks().get("orchestrator.running").isPassed());
        assertTrue(status.getChecks().get("orchestrator.agents").isPassed());
        assertTrue(status.getChecks().get("executions.capacity").isPassed());
        assertFalse(status.getChecks().containsKey("storage.available"));
        assertFalse(status.getChecks().containsKey("executions.success_rate"));
        assertNotNull(status.getTimestamp());
    }

    @Test
    void testLowSuccessRateFailsCheck() throws Exception {
        String executionId = orchestrator.startExecution(AgentType.UNIT_TESTING, AgentInput.empty());
        orchestrator.awaitCompletion(executionId, Duration.ofSeconds(5));

        HealthChecker.HealthStatus status = new HealthChecker(orchestrator, null, 10).check();

        assertFalse(status.getChecks().get("executions.success_rate").isPassed());
        assertFalse(status.isHealthy());
    }

    @Test
    void testShutdownOrchestratorIsUnhealthy() {
        orchestrator.shutdown();

        HealthChecker.HealthStatus status = new HealthChecker(orchestrator, null, 10).check();

        assertFalse(status.isHealthy());
        assertFalse(status.getChecks().get("orchestrator.running").isPassed());
    }

    @Test
    void testStorageCheck() {
        try (MapDBResultStorage storage = new MapDBResultStorage(new File(tempDir, "health.db").getAbsolutePath())) {
            HealthChecker.HealthStatus status = new HealthChecker(orchestrator, storage, 10).check();

            assertTrue(status.getChecks().get("storage.available").isPassed());
        }
    }
}
