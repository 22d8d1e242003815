package com.enterprise.agentmarketplace.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One item of work: which agent to run, on what, with which run configuration
 */
public class ExecutionRequest {

    private final AgentType agentType;
    private final AgentInput input;
    private final Map<String, Object> config;

    @JsonCreator
    public ExecutionRequest(@JsonProperty("agentType") AgentType agentType,
                            @JsonProperty("input") AgentInput input,
                            @JsonProperty("config") Map<String, Object> config) {
        this.agentType = Objects.requireNonNull(agentType, "Agent type cannot be null");
        this.input = input != null ? input : AgentInput.empty();
        this.config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
    }

    public static ExecutionRequest of(AgentType agentType, AgentInput input) {
        return new ExecutionRequest(agentType, input, null);
    }

    public AgentType getAgentType() { return agentType; }
    public AgentInput getInput() { return input; }
    public Map<String, Object> getConfig() { return config; }
}
