package com.enterprise.agentmarketplace.core;

import com.enterprise.agentmarketplace.model.AgentType;
import com.enterprise.agentmarketplace.model.ExecutionResult;
import com.enterprise.agentmarketplace.model.ExecutionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionStateStoreTest {

    private ExecutionStateStore store;
    private ExecutionHandle handle;

    @BeforeEach
    void setUp() {
        store = new ExecutionStateStore();
        handle = new ExecutionHandle("exec-1", AgentType.LOAD_TESTING);
    }

    @Test
    void testRegisteredExecutionReportsRunning() {
        store.register(handle);

        assertEquals(ExecutionStatus.RUNNING, store.status("exec-1").orElseThrow());
        assertTrue(store.result("exec-1").isEmpty());
        assertEquals(1, store.activeCount());
        assertEquals(List.of("exec-1"), store.runningIds());
    }

    @Test
    void testUnknownIdHasNoStatus() {
        assertTrue(store.status("missing").isEmpty());
        assertTrue(store.inFlight("missing").isEmpty());
    }

    @Test
    void testDuplicateRegistrationIsRejected() {
        store.register(handle);

        assertThrows(IllegalStateException.class,
            () -> store.register(new ExecutionHandle("exec-1", AgentType.UNIT_TESTING)));
    }

    @Test
    void testCompleteMovesHandleToResults() {
        store.register(handle);

        assertTrue(store.complete(handle, completed()));

        assertEquals(ExecutionStatus.COMPLETED, store.status("exec-1").orElseThrow());
        assertEquals(0, store.activeCount());
        assertEquals(1, store.listResults().size());
    }

    @Test
    void testClaimedCancellationWinsOverLateCompletion() {
        store.register(handle);

        assertTrue(store.claimCancellation(handle));
        assertFalse(store.claimCancellation(handle));
        assertFalse(store.complete(handle, completed()));
        assertEquals(ExecutionStatus.RUNNING, store.status("exec-1").orElseThrow());

        ExecutionResult cancelled = store.finishCancelled(handle, null);

        assertEquals(ExecutionStatus.CANCELLED, cancelled.getStatus());
        assertEquals(ExecutionStatus.CANCELLED, store.status("exec-1").orElseThrow());
        assertEquals(0, store.activeCount());
    }

    @Test
    void testCancellationKeepsPartialOutputs() {
        store.register(handle);
        store.claimCancellation(handle);

        ExecutionResult partial = ExecutionResult.builder("exec-1", AgentType.LOAD_TESTING, Instant.now())
            .status(ExecutionStatus.RUNNING)
            .logs(List.of("started"))
            .build();
        ExecutionResult cancelled = store.finishCancelled(handle, partial);

        assertEquals(ExecutionStatus.CANCELLED, cancelled.getStatus());
        assertEquals(List.of("started"), cancelled.getLogs());
    }

    @Test
    void testCompletedExecutionCannotBeClaimedForCancellation() {
        store.register(handle);
        store.complete(handle, completed());

        assertFalse(store.claimCancellation(handle));
    }

    @Test
    void testClearInFlightKeepsResults() {
        ExecutionHandle other = new ExecutionHandle("exec-2", AgentType.UNIT_TESTING);
        store.register(handle);
        store.register(other);
        store.complete(other, ExecutionResult.minimal("exec-2", AgentType.UNIT_TESTING,
                                                      ExecutionStatus.FAILED, Instant.now()));

        store.clearInFlight();

        assertEquals(0, store.activeCount());
        assertTrue(store.status("exec-1").isEmpty());
        assertEquals(ExecutionStatus.FAILED, store.status("exec-2").orElseThrow());
    }

    private ExecutionResult completed() {
        return ExecutionResult.minimal("exec-1", AgentType.LOAD_TESTING, ExecutionStatus.COMPLETED,
                                       handle.getSubmittedAt());
    }
}
