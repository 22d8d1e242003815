package com.enterprise.agentmarketplace;

import com.enterprise.agentmarketplace.config.MarketplaceConfig;
import com.enterprise.agentmarketplace.core.AgentOrchestrator;
import com.enterprise.agentmarketplace.model.AgentInput;
import com.enterprise.agentmarketplace.model.AgentType;
import com.enterprise.agentmarketplace.model.ExecutionResult;
import com.enterprise.agentmarketplace.model.ExecutionStatus;
import com.enterprise.agentmarketplace.monitoring.HealthChecker;
import com.enterprise.agentmarketplace.storage.MapDBResultStorage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class AgentMarketplaceFactoryTest {

    @TempDir
    File tempDir;

    @Test
    void testCreateDefault() {
        AgentMarketplaceFactory.AgentMarketplace marketplace = AgentMarketplaceFactory.createDefault();
        try {
            assertNotNull(marketplace.getOrchestrator());
            assertTrue(marketplace.isRunning());
            assertEquals(AgentType.values().length, marketplace.getOrchestrator().listAgents().size());
            assertTrue(marketplace.getMetricsCollector().isPresent());
            assertTrue(marketplace.getHealthChecker().isPresent());
            assertTrue(marketplace.getStorage().isEmpty());
        } finally {
            marketplace.shutdown();
        }
        assertFalse(marketplace.isRunning());
    }

    @Test
    void testCreateWithInvalidConfig() {
        MarketplaceConfig invalidConfig = MarketplaceConfig.builder()
            .executorConfig(new MarketplaceConfig.ExecutorConfig(
                -1, 8, Duration.ofMinutes(2), 500, Duration.ofSeconds(60)
            ))
            .build();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> AgentMarketplaceFactory.create(invalidConfig));
        assertTrue(e.getMessage().startsWith("Configuration validation failed:"));
        assertTrue(e.getMessage().contains("executor.corePoolSize"));
    }

    @Test
    void testMonitoringCanBeDisabled() {
        MarketplaceConfig config = MarketplaceConfig.builder()
            .monitoringConfig(new MarketplaceConfig.MonitoringConfig(false, false))
            .build();

        AgentMarketplaceFactory.AgentMarketplace marketplace = AgentMarketplaceFactory.create(config);
        try {
            assertTrue(marketplace.getMetricsCollector().isEmpty());
            assertTrue(marketplace.getHealthChecker().isEmpty());
        } finally {
            marketplace.shutdown();
        }
    }

    @Test
    void testEndToEndRunIsMeasuredAndPersisted() throws Exception {
        String dbPath = new File(tempDir, "results.db").getAbsolutePath();
        MarketplaceConfig config = MarketplaceConfig.builder()
            .storageConfig(new MarketplaceConfig.StorageConfig(true, dbPath))
            .build();

        AgentMarketplaceFactory.AgentMarketplace marketplace = AgentMarketplaceFactory.create(config);
        String executionId;
        try {
            AgentOrchestrator orchestrator = marketplace.getOrchestrator();
            executionId = orchestrator.startExecution(AgentType.LOAD_TESTING,
                AgentInput.builder().endpoints(List.of("/health")).build());

            assertEquals(ExecutionStatus.COMPLETED,
                         orchestrator.awaitCompletion(executionId, Duration.ofSeconds(10)).orElseThrow());
            await().atMost(Duration.ofSeconds(5))
                .until(() -> marketplace.getStorage().orElseThrow().load(executionId).isPresent());

            assertEquals(1.0, marketplace.getMetricsCollector().orElseThrow()
                .getMetrics().get("executions.completed"));

            HealthChecker.HealthStatus health = marketplace.getHealthChecker().orElseThrow()
                .performHealthCheck().get();
            assertTrue(health.getChecks().containsKey("storage.available"));
            assertTrue(health.getChecks().get("orchestrator.running").isPassed());
        } finally {
            marketplace.shutdown();
        }

        try (MapDBResultStorage reopened = new MapDBResultStorage(dbPath)) {
            Optional<ExecutionResult> stored = reopened.load(executionId);
            assertTrue(stored.isPresent());
            assertEquals(AgentType.LOAD_TESTING, stored.get().getAgentType());
            assertEquals(4, stored.get().getTotalTests());
        }
    }
}
