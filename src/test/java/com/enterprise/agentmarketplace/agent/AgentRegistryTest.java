package com.enterprise.agentmarketplace.agent;

import com.enterprise.agentmarketplace.agent.impl.UnitTestingAgent;
import com.enterprise.agentmarketplace.exception.UnknownAgentTypeException;
import com.enterprise.agentmarketplace.model.AgentMetadata;
import com.enterprise.agentmarketplace.model.AgentType;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentRegistryTest {

    @Test
    void testDefaultRegistryHasEveryAgentType() {
        AgentRegistry registry = AgentRegistry.defaultRegistry();

        assertEquals(EnumSet.allOf(AgentType.class), registry.registeredTypes());
        for (AgentType type : AgentType.values()) {
            assertTrue(registry.isRegistered(type));
        }
    }

    @Test
    void testCreateReturnsFreshInstances() throws Exception {
        AgentRegistry registry = AgentRegistry.defaultRegistry();

        TestingAgent first = registry.create(AgentType.UNIT_TESTING);
        TestingAgent second = registry.create(AgentType.UNIT_TESTING);

        assertNotSame(first, second);
        assertEquals(AgentType.UNIT_TESTING, first.getMetadata().getAgentType());
    }

    @Test
    void testCreateUnknownTypeFails() {
        AgentRegistry registry = AgentRegistry.builder()
            .register(AgentType.UNIT_TESTING, UnitTestingAgent::new)
            .build();

        UnknownAgentTypeException e = assertThrows(UnknownAgentTypeException.class,
            () -> registry.create(AgentType.STRESS_TESTING));
        assertEquals(AgentType.STRESS_TESTING, e.getAgentType());
        assertFalse(registry.isRegistered(AgentType.STRESS_TESTING));
        assertFalse(registry.isRegistered(null));
    }

    @Test
    void testDuplicateRegistrationFails() {
        AgentRegistry.Builder builder = AgentRegistry.builder()
            .register(AgentType.UNIT_TESTING, UnitTestingAgent::new);

        assertThrows(IllegalArgumentException.class,
            () -> builder.register(AgentType.UNIT_TESTING, UnitTestingAgent::new));
        assertThrows(IllegalArgumentException.class,
            () -> builder.register(null, UnitTestingAgent::new));
    }

    @Test
    void testMetadataDescribesEachAgent() {
        AgentRegistry registry = AgentRegistry.defaultRegistry();

        List<AgentMetadata> metadata = registry.listMetadata();

        assertEquals(AgentType.values().length, metadata.size());
        for (AgentMetadata item : metadata) {
            assertNotNull(item.getName());
            assertFalse(item.getCapabilities().isEmpty());
            assertEquals(AgentMetadata.DEFAULT_VERSION, item.getVersion());
        }
        assertEquals(List.of("endpoints"),
                     registry.metadataFor(AgentType.LOAD_TESTING).orElseThrow().getRequiredInputs());
    }

    @Test
    void testMetadataForUnregisteredTypeIsEmpty() {
        AgentRegistry registry = AgentRegistry.builder()
            .register(AgentType.UNIT_TESTING, UnitTestingAgent::new)
            .build();

        assertTrue(registry.metadataFor(AgentType.FUNCTIONAL_TESTING).isEmpty());
    }
}
