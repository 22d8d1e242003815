package com.enterprise.agentmarketplace;

import com.enterprise.agentmarketplace.agent.AgentRegistry;
import com.enterprise.agentmarketplace.config.ConfigValidator;
import com.enterprise.agentmarketplace.config.MarketplaceConfig;
import com.enterprise.agentmarketplace.core.AgentOrchestrator;
import com.enterprise.agentmarketplace.core.AgentOrchestratorImpl;
import com.enterprise.agentmarketplace.core.PipelineExecutor;
import com.enterprise.agentmarketplace.monitoring.HealthChecker;
import com.enterprise.agentmarketplace.monitoring.MetricsCollector;
import com.enterprise.agentmarketplace.storage.MapDBResultStorage;
import com.enterprise.agentmarketplace.storage.PersistingExecutionListener;
import com.enterprise.agentmarketplace.storage.ResultStorage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Factory for creating and configuring the agent marketplace
 */
public class AgentMarketplaceFactory {

    private static final Logger logger = LoggerFactory.getLogger(AgentMarketplaceFactory.class);

    /**
     * Create a marketplace with default configuration and the built-in agents
     */
    public static AgentMarketplace createDefault() {
        return create(MarketplaceConfig.builder().build());
    }

    /**
     * Create a marketplace with custom configuration and the built-in agents
     */
    public static AgentMarketplace create(MarketplaceConfig config) {
        return create(config, AgentRegistry.defaultRegistry());
    }

    /**
     * Create a marketplace with custom configuration and agent registry
     */
    public static AgentMarketplace create(MarketplaceConfig config, AgentRegistry registry) {
        ConfigValidator validator = new ConfigValidator();
        List<ConfigValidator.ValidationError> errors = validator.validate(config);

        if (!errors.isEmpty()) {
            StringBuilder errorMsg = new StringBuilder("Configuration validation failed:\n");
            errors.forEach(error -> errorMsg.append("  - ").append(error).append("\n"));
            throw new IllegalArgumentException(errorMsg.toString());
        }
        if (registry == null) {
            throw new IllegalArgumentException("Agent registry is required");
        }

        logger.info("Creating AgentMarketplace with configuration: {}", config);

        ResultStorage storage = null;
        try {
            storage = createStorage(config.getStorageConfig());
            PipelineExecutor executor = createExecutor(config.getExecutorConfig());
            AgentOrchestrator orchestrator = new AgentOrchestratorImpl(
                registry, executor, config.getExecutionConfig(), config.getExecutorConfig().getShutdownTimeout());

            MetricsCollector metricsCollector = null;
            if (config.getMonitoringConfig().isEnableMetrics()) {
                metricsCollector = new MetricsCollector(new SimpleMeterRegistry());
                metricsCollector.bindActiveExecutions(orchestrator);
                orchestrator.addListener(metricsCollector);
            }
            if (storage != null) {
                orchestrator.addListener(new PersistingExecutionListener(storage));
            }

            HealthChecker healthChecker = null;
            if (config.getMonitoringConfig().isEnableHealthChecks()) {
                healthChecker = new HealthChecker(orchestrator, storage,
                    config.getExecutionConfig().getMaxConcurrentExecutions());
            }

            logger.info("AgentMarketplace created successfully");
            return new AgentMarketplace(orchestrator, storage, metricsCollector, healthChecker);

        } catch (RuntimeException e) {
            logger.error("Failed to create AgentMarketplace", e);
            if (storage != null) {
                storage.close();
            }
            throw new IllegalStateException("Failed to create AgentMarketplace", e);
        }
    }

    private static ResultStorage createStorage(MarketplaceConfig.StorageConfig config) {
        if (!config.isEnabled()) {
            return null;
        }
        return new MapDBResultStorage(config.getDbPath());
    }

    private static PipelineExecutor createExecutor(MarketplaceConfig.ExecutorConfig config) {
        BlockingQueue<Runnable> workQueue = new LinkedBlockingQueue<>(config.getQueueCapacity());

        return new PipelineExecutor(
            config.getCorePoolSize(),
            config.getMaximumPoolSize(),
            config.getKeepAliveTime().toMillis(),
            TimeUnit.MILLISECONDS,
            workQueue
        );
    }

    /**
     * Wrapper holding the orchestrator and the optional components built around it
     */
    public static class AgentMarketplace {
        private final AgentOrchestrator orchestrator;
        private final ResultStorage storage;
        private final MetricsCollector metricsCollector;
        private final HealthChecker healthChecker;

        public AgentMarketplace(AgentOrchestrator orchestrator, ResultStorage storage,
                                MetricsCollector metricsCollector, HealthChecker healthChecker) {
            this.orchestrator = orchestrator;
            this.storage = storage;
            this.metricsCollector = metricsCollector;
            this.healthChecker = healthChecker;
        }

        public AgentOrchestrator getOrchestrator() { return orchestrator; }
        public Optional<ResultStorage> getStorage() { return Optional.ofNullable(storage); }
        public Optional<MetricsCollector> getMetricsCollector() { return Optional.ofNullable(metricsCollector); }
        public Optional<HealthChecker> getHealthChecker() { return Optional.ofNullable(healthChecker); }

        /**
         * Stop the orchestrator, then close the storage so cancelled results are persisted first
         */
        public void shutdown() {
            orchestrator.shutdown();
            if (storage != null) {
                storage.close();
            }
        }

        public boolean isRunning() {
            return orchestrator.isRunning();
        }
    }
}
