package com.enterprise.agentmarketplace.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Static description of an agent: what it needs and what it can do.
 */
public class AgentMetadata {

    public static final String DEFAULT_VERSION = "1.0.0";

    private final AgentType agentType;
    private final String name;
    private final String description;
    private final String version;
    private final List<String> requiredInputs;
    private final List<String> optionalInputs;
    private final List<String> capabilities;
    private final Integer estimatedDurationSeconds;

    @JsonCreator
    public AgentMetadata(@JsonProperty("agentType") AgentType agentType,
                         @JsonProperty("name") String name,
                         @JsonProperty("description") String description,
                         @JsonProperty("version") String version,
                         @JsonProperty("requiredInputs") List<String> requiredInputs,
                         @JsonProperty("optionalInputs") List<String> optionalInputs,
                         @JsonProperty("capabilities") List<String> capabilities,
                         @JsonProperty("estimatedDurationSeconds") Integer estimatedDurationSeconds) {
        this.agentType = Objects.requireNonNull(agentType, "Agent type cannot be null");
        this.name = Objects.requireNonNull(name, "Agent name cannot be null");
        this.description = description;
        this.version = version != null ? version : DEFAULT_VERSION;
        this.requiredInputs = requiredInputs != null ? List.copyOf(requiredInputs) : List.of();
        this.optionalInputs = optionalInputs != null ? List.copyOf(optionalInputs) : List.of();
        this.capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
        this.estimatedDurationSeconds = estimatedDurationSeconds;
    }

    public AgentType getAgentType() { return agentType; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getVersion() { return version; }
    public List<String> getRequiredInputs() { return requiredInputs; }
    public List<String> getOptionalInputs() { return optionalInputs; }
    public List<String> getCapabilities() { return capabilities; }

    /**
     * Advisory only, never used for scheduling
     */
    public Integer getEstimatedDurationSeconds() { return estimatedDurationSeconds; }

    @Override
    public String toString() {
        return "AgentMetadata{" +
                "agentType=" + agentType +
                ", name='" + name + '\'' +
                ", version='" + version + '\'' +
                ", requiredInputs=" + requiredInputs +
                '}';
    }
}
