package com.enterprise.agentmarketplace.agent;

import com.enterprise.agentmarketplace.agent.impl.FunctionalTestingAgent;
import com.enterprise.agentmarketplace.agent.impl.IntegrationTestingAgent;
import com.enterprise.agentmarketplace.agent.impl.LoadTestingAgent;
import com.enterprise.agentmarketplace.agent.impl.RegressionTestingAgent;
import com.enterprise.agentmarketplace.agent.impl.SecurityTestingAgent;
import com.enterprise.agentmarketplace.agent.impl.StressTestingAgent;
import com.enterprise.agentmarketplace.agent.impl.UnitTestingAgent;
import com.enterprise.agentmarketplace.exception.UnknownAgentTypeException;
import com.enterprise.agentmarketplace.model.AgentMetadata;
import com.enterprise.agentmarketplace.model.AgentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Lookup table from agent type to a factory producing a fresh pipeline instance.
 * The table is fixed at construction and read-only afterwards, so lookups need no locking.
 */
public final class AgentRegistry {

    private static final Logger logger = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<AgentType, Supplier<? extends TestingAgent>> factories;

    private AgentRegistry(Map<AgentType, Supplier<? extends TestingAgent>> factories) {
        this.factories = Collections.unmodifiableMap(new EnumMap<>(factories));
        logger.info("Registered {} testing agents: {}", this.factories.size(), this.factories.keySet());
    }

    /**
     * The built-in catalog of seven testing agents
     */
    public static AgentRegistry defaultRegistry() {
        return builder()
            .register(AgentType.UNIT_TESTING, UnitTestingAgent::new)
            .register(AgentType.FUNCTIONAL_TESTING, FunctionalTestingAgent::new)
            .register(AgentType.INTEGRATION_TESTING, IntegrationTestingAgent::new)
            .register(AgentType.SECURITY_TESTING, SecurityTestingAgent::new)
            .register(AgentType.LOAD_TESTING, LoadTestingAgent::new)
            .register(AgentType.STRESS_TESTING, StressTestingAgent::new)
            .register(AgentType.REGRESSION_TESTING, RegressionTestingAgent::new)
            .build();
    }

    public boolean isRegistered(AgentType agentType) {
        return agentType != null && factories.containsKey(agentType);
    }

    public Set<AgentType> registeredTypes() {
        return factories.keySet();
    }

    /**
     * Instantiate a new pipeline for the given type
     */
    public TestingAgent create(AgentType agentType) throws UnknownAgentTypeException {
        Supplier<? extends TestingAgent> factory = agentType != null ? factories.get(agentType) : null;
        if (factory == null) {
            throw new UnknownAgentTypeException(agentType);
        }
        return factory.get();
    }

    /**
     * Metadata of every registered agent. Each factory is instantiated
     * transiently only to read what it declares.
     */
    public List<AgentMetadata> listMetadata() {
        return factories.values().stream()
            .map(factory -> factory.get().getMetadata())
            .collect(Collectors.toList());
    }

    public Optional<AgentMetadata> metadataFor(AgentType agentType) {
        if (!isRegistered(agentType)) {
            return Optional.empty();
        }
        return Optional.of(factories.get(agentType).get().getMetadata());
    }

    /**
     * Builder collecting the catalog before it is frozen
     */
    public static class Builder {
        private final Map<AgentType, Supplier<? extends TestingAgent>> factories = new EnumMap<>(AgentType.class);

        public Builder register(AgentType agentType, Supplier<? extends TestingAgent> factory) {
            if (agentType == null || factory == null) {
                throw new IllegalArgumentException("Agent type and factory are required");
            }
            if (factories.putIfAbsent(agentType, factory) != null) {
                throw new IllegalArgumentException("Agent type already registered: " + agentType.getId());
            }
            return this;
        }

        public AgentRegistry build() {
            return new AgentRegistry(factories);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
