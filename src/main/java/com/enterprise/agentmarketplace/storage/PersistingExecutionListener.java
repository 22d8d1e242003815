package com.enterprise.agentmarketplace.storage;

import com.enterprise.agentmarketplace.core.ExecutionListener;
import com.enterprise.agentmarketplace.exception.StorageException;
import com.enterprise.agentmarketplace.model.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves every settled result. Failures are logged and never reach the orchestrator.
 */
public class PersistingExecutionListener implements ExecutionListener {

    private static final Logger logger = LoggerFactory.getLogger(PersistingExecutionListener.class);

    private final ResultStorage storage;

    public PersistingExecutionListener(ResultStorage storage) {
        this.storage = storage;
    }

    @Override
    public void onExecutionSettled(ExecutionResult result) {
        try {
            String locator = storage.save(result);
            logger.debug("Persisted execution {} to {}", result.getExecutionId(), locator);
        } catch (StorageException e) {
            logger.error("Failed to persist execution {}", result.getExecutionId(), e);
        }
    }
}
