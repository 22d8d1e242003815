package com.enterprise.agentmarketplace.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identifies a testing pipeline in the marketplace catalog
 */
public enum AgentType {
    UNIT_TESTING("unit_testing"),
    FUNCTIONAL_TESTING("functional_testing"),
    INTEGRATION_TESTING("integration_testing"),
    REGRESSION_TESTING("regression_testing"),
    SECURITY_TESTING("security_testing"),
    LOAD_TESTING("load_testing"),
    STRESS_TESTING("stress_testing");

    private final String id;

    AgentType(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Resolve a type from its wire id (e.g. {@code unit_testing}) or enum name
     */
    @JsonCreator
    public static AgentType fromId(String value) {
        for (AgentType type : values()) {
            if (type.id.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown agent type: " + value);
    }
}
