package com.enterprise.agentmarketplace.exception;

import com.enterprise.agentmarketplace.model.AgentType;

/**
 * Exception thrown when no pipeline is registered for an agent type
 */
public class UnknownAgentTypeException extends AgentExecutionException {

    private final AgentType agentType;

    public UnknownAgentTypeException(AgentType agentType) {
        super("Agent type " + (agentType != null ? agentType.getId() : null) + " not found");
        this.agentType = agentType;
    }

    public AgentType getAgentType() {
        return agentType;
    }
}
