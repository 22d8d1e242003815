package com.enterprise.agentmarketplace.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for the agent marketplace
 */
public class MarketplaceConfig {

    private final ExecutorConfig executorConfig;
    private final ExecutionConfig executionConfig;
    private final StorageConfig storageConfig;
    private final MonitoringConfig monitoringConfig;
    private final Map<String, Object> customProperties;

    public MarketplaceConfig(ExecutorConfig executorConfig, ExecutionConfig executionConfig,
                             StorageConfig storageConfig, MonitoringConfig monitoringConfig,
                             Map<String, Object> customProperties) {
        this.executorConfig = executorConfig;
        this.executionConfig = executionConfig;
        this.storageConfig = storageConfig;
        this.monitoringConfig = monitoringConfig;
        this.customProperties = customProperties;
    }

    public ExecutorConfig getExecutorConfig() { return executorConfig; }
    public ExecutionConfig getExecutionConfig() { return executionConfig; }
    public StorageConfig getStorageConfig() { return storageConfig; }
    public MonitoringConfig getMonitoringConfig() { return monitoringConfig; }
    public Map<String, Object> getCustomProperties() { return customProperties; }

    @Override
    public String toString() {
        return "MarketplaceConfig{" +
                "executor=" + executorConfig +
                ", execution=" + executionConfig +
                ", storage=" + storageConfig +
                ", monitoring=" + monitoringConfig +
                '}';
    }

    /**
     * Worker pool configuration
     */
    public static class ExecutorConfig {
        private final int corePoolSize;
        private final int maximumPoolSize;
        private final Duration keepAliveTime;
        private final int queueCapacity;
        private final Duration shutdownTimeout;

        public ExecutorConfig(int corePoolSize, int maximumPoolSize, Duration keepAliveTime,
                              int queueCapacity, Duration shutdownTimeout) {
            this.corePoolSize = corePoolSize;
            this.maximumPoolSize = maximumPoolSize;
            this.keepAliveTime = keepAliveTime;
            this.queueCapacity = queueCapacity;
            this.shutdownTimeout = shutdownTimeout;
        }

        public int getCorePoolSize() { return corePoolSize; }
        public int getMaximumPoolSize() { return maximumPoolSize; }
        public Duration getKeepAliveTime() { return keepAliveTime; }
        public int getQueueCapacity() { return queueCapacity; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }

        @Override
        public String toString() {
            return String.format("{core=%d, max=%d, keepAlive=%s, queue=%d, shutdownTimeout=%s}",
                corePoolSize, maximumPoolSize, keepAliveTime, queueCapacity, shutdownTimeout);
        }
    }

    /**
     * Admission control and per-execution time limits
     */
    public static class ExecutionConfig {
        private final int maxConcurrentExecutions;
        private final boolean enforceConcurrencyLimit;
        private final Duration executionTimeout;
        private final Duration cancellationTimeout;

        public ExecutionConfig(int maxConcurrentExecutions, boolean enforceConcurrencyLimit,
                               Duration executionTimeout, Duration cancellationTimeout) {
            this.maxConcurrentExecutions = maxConcurrentExecutions;
            this.enforceConcurrencyLimit = enforceConcurrencyLimit;
            this.executionTimeout = executionTimeout;
            this.cancellationTimeout = cancellationTimeout;
        }

        public int getMaxConcurrentExecutions() { return maxConcurrentExecutions; }
        public boolean isEnforceConcurrencyLimit() { return enforceConcurrencyLimit; }

        /**
         * How long a sequential batch waits for one item before cancelling it
         */
        public Duration getExecutionTimeout() { return executionTimeout; }

        /**
         * How long a cancel request waits for the worker to stop
         */
        public Duration getCancellationTimeout() { return cancellationTimeout; }

        @Override
        public String toString() {
            return String.format("{maxConcurrent=%d, enforce=%s, timeout=%s, cancellationTimeout=%s}",
                maxConcurrentExecutions, enforceConcurrencyLimit, executionTimeout, cancellationTimeout);
        }
    }

    /**
     * Result storage configuration
     */
    public static class StorageConfig {
        private final boolean enabled;
        private final String dbPath;

        public StorageConfig(boolean enabled, String dbPath) {
            this.enabled = enabled;
            this.dbPath = dbPath;
        }

        public boolean isEnabled() { return enabled; }
        public String getDbPath() { return dbPath; }

        @Override
        public String toString() {
            return String.format("{enabled=%s, dbPath=%s}", enabled, dbPath);
        }
    }

    /**
     * Monitoring configuration
     */
    public static class MonitoringConfig {
        private final boolean enableMetrics;
        private final boolean enableHealthChecks;

        public MonitoringConfig(boolean enableMetrics, boolean enableHealthChecks) {
            this.enableMetrics = enableMetrics;
            this.enableHealthChecks = enableHealthChecks;
        }

        public boolean isEnableMetrics() { return enableMetrics; }
        public boolean isEnableHealthChecks() { return enableHealthChecks; }

        @Override
        public String toString() {
            return String.format("{metrics=%s, healthChecks=%s}", enableMetrics, enableHealthChecks);
        }
    }

    /**
     * Builder for creating configurations
     */
    public static class Builder {
        private ExecutorConfig executorConfig = Defaults.defaultExecutorConfig();
        private ExecutionConfig executionConfig = Defaults.defaultExecutionConfig();
        private StorageConfig storageConfig = Defaults.defaultStorageConfig();
        private MonitoringConfig monitoringConfig = Defaults.defaultMonitoringConfig();
        private Map<String, Object> customProperties = new HashMap<>();

        public Builder executorConfig(ExecutorConfig executorConfig) {
            this.executorConfig = executorConfig;
            return this;
        }

        public Builder executionConfig(ExecutionConfig executionConfig) {
            this.executionConfig = executionConfig;
            return this;
        }

        public Builder storageConfig(StorageConfig storageConfig) {
            this.storageConfig = storageConfig;
            return this;
        }

        public Builder monitoringConfig(MonitoringConfig monitoringConfig) {
            this.monitoringConfig = monitoringConfig;
            return this;
        }

        public Builder customProperty(String key, Object value) {
            this.customProperties.put(key, value);
            return this;
        }

        public Builder customProperties(Map<String, Object> properties) {
            this.customProperties.putAll(properties);
            return this;
        }

        public MarketplaceConfig build() {
            return new MarketplaceConfig(executorConfig, executionConfig, storageConfig,
                                         monitoringConfig, customProperties);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default configurations
     */
    public static class Defaults {
        public static ExecutorConfig defaultExecutorConfig() {
            return new ExecutorConfig(
                4, 16, Duration.ofMinutes(1), 100, Duration.ofSeconds(30)
            );
        }

        public static ExecutionConfig defaultExecutionConfig() {
            return new ExecutionConfig(
                10, true, Duration.ofHours(1), Duration.ofSeconds(30)
            );
        }

        public static StorageConfig defaultStorageConfig() {
            String tmpDir = System.getProperty("java.io.tmpdir");
            String uniqueName = java.util.UUID.randomUUID().toString();
            String path = tmpDir.endsWith("/") ? (tmpDir + "agent-results-" + uniqueName + ".db")
                                               : (tmpDir + "/agent-results-" + uniqueName + ".db");
            return new StorageConfig(false, path);
        }

        public static MonitoringConfig defaultMonitoringConfig() {
            return new MonitoringConfig(true, true);
        }
    }
}
