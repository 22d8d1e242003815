package com.enterprise.agentmarketplace.agent;

import com.enterprise.agentmarketplace.model.AgentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-run state handed to every pipeline stage: identity, run configuration,
 * the cancellation token and the execution log.
 */
public class ExecutionContext {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionContext.class);

    public enum LogLevel {
        INFO,
        WARNING,
        ERROR
    }

    private final String executionId;
    private final AgentType agentType;
    private final Map<String, Object> config;
    private final CancellationToken cancellationToken;
    private final List<String> logs = Collections.synchronizedList(new ArrayList<>());

    public ExecutionContext(String executionId, AgentType agentType, Map<String, Object> config,
                            CancellationToken cancellationToken) {
        this.executionId = executionId;
        this.agentType = agentType;
        this.config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
        this.cancellationToken = cancellationToken;
    }

    public String getExecutionId() { return executionId; }
    public AgentType getAgentType() { return agentType; }
    public Map<String, Object> getConfig() { return config; }
    public CancellationToken getCancellationToken() { return cancellationToken; }

    public void log(String message) {
        log(message, LogLevel.INFO);
    }

    /**
     * Append a line to the execution log and mirror it to the application log
     */
    public void log(String message, LogLevel level) {
        logs.add(String.format("[%s] [%s] %s", LocalDateTime.now(), level, message));

        switch (level) {
            case ERROR:
                logger.error("[{}] {}", executionId, message);
                break;
            case WARNING:
                logger.warn("[{}] {}", executionId, message);
                break;
            default:
                logger.info("[{}] {}", executionId, message);
                break;
        }
    }

    /**
     * Snapshot of the log lines written so far
     */
    public List<String> getLogs() {
        synchronized (logs) {
            return new ArrayList<>(logs);
        }
    }
}
