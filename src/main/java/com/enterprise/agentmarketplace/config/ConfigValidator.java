package com.enterprise.agentmarketplace.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates marketplace configuration
 */
public class ConfigValidator {

    /**
     * Validate the configuration and return any validation errors
     */
    public List<ValidationError> validate(MarketplaceConfig config) {
        List<ValidationError> errors = new ArrayList<>();

        if (config == null) {
            errors.add(new ValidationError("config", "Configuration is required"));
            return errors;
        }

        requirePresent(config.getExecutorConfig(), "executor", errors);
        requirePresent(config.getExecutionConfig(), "execution", errors);
        requirePresent(config.getStorageConfig(), "storage", errors);
        requirePresent(config.getMonitoringConfig(), "monitoring", errors);
        if (!errors.isEmpty()) {
            return errors;
        }

        validateExecutorConfig(config.getExecutorConfig(), errors);
        validateExecutionConfig(config.getExecutionConfig(), errors);
        validateStorageConfig(config.getStorageConfig(), errors);

        // every admitted execution must fit in the work queue
        MarketplaceConfig.ExecutionConfig execution = config.getExecutionConfig();
        if (execution.isEnforceConcurrencyLimit()
                && config.getExecutorConfig().getQueueCapacity() < execution.getMaxConcurrentExecutions()) {
            errors.add(new ValidationError("executor.queueCapacity",
                "Queue capacity must be at least the maximum number of concurrent executions"));
        }

        return errors;
    }

    private void requirePresent(Object section, String field, List<ValidationError> errors) {
        if (section == null) {
            errors.add(new ValidationError(field, "Configuration section is required"));
        }
    }

    private void validateExecutorConfig(MarketplaceConfig.ExecutorConfig config, List<ValidationError> errors) {
        if (config.getCorePoolSize() <= 0) {
            errors.add(new ValidationError("executor.corePoolSize",
                "Core pool size must be greater than 0"));
        }

        if (config.getMaximumPoolSize() <= 0) {
            errors.add(new ValidationError("executor.maximumPoolSize",
                "Maximum pool size must be greater than 0"));
        }

        if (config.getCorePoolSize() > config.getMaximumPoolSize()) {
            errors.add(new ValidationError("executor.poolSize",
                "Core pool size cannot be greater than maximum pool size"));
        }

        if (isNegative(config.getKeepAliveTime())) {
            errors.add(new ValidationError("executor.keepAliveTime",
                "Keep alive time cannot be negative"));
        }

        if (config.getQueueCapacity() <= 0) {
            errors.add(new ValidationError("executor.queueCapacity",
                "Queue capacity must be greater than 0"));
        }

        if (isNegative(config.getShutdownTimeout())) {
            errors.add(new ValidationError("executor.shutdownTimeout",
                "Shutdown timeout cannot be negative"));
        }
    }

    private void validateExecutionConfig(MarketplaceConfig.ExecutionConfig config, List<ValidationError> errors) {
        if (config.getMaxConcurrentExecutions() <= 0) {
            errors.add(new ValidationError("execution.maxConcurrentExecutions",
                "Maximum concurrent executions must be greater than 0"));
        }

        if (config.getExecutionTimeout() == null || config.getExecutionTimeout().isNegative()
                || config.getExecutionTimeout().isZero()) {
            errors.add(new ValidationError("execution.executionTimeout",
                "Execution timeout must be positive"));
        }

        if (isNegative(config.getCancellationTimeout())) {
            errors.add(new ValidationError("execution.cancellationTimeout",
                "Cancellation timeout cannot be negative"));
        }
    }

    private void validateStorageConfig(MarketplaceConfig.StorageConfig config, List<ValidationError> errors) {
        if (config.isEnabled() && (config.getDbPath() == null || config.getDbPath().trim().isEmpty())) {
            errors.add(new ValidationError("storage.dbPath",
                "Database path is required when storage is enabled"));
        }
    }

    private static boolean isNegative(Duration duration) {
        return duration == null || duration.isNegative();
    }

    /**
     * Validation error
     */
    public static class ValidationError {
        private final String field;
        private final String message;

        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }

        public String getField() { return field; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
