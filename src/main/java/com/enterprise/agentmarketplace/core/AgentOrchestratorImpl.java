package com.enterprise.agentmarketplace.core;

import com.enterprise.agentmarketplace.agent.AgentRegistry;
import com.enterprise.agentmarketplace.agent.ExecutionContext;
import com.enterprise.agentmarketplace.agent.TestingAgent;
import com.enterprise.agentmarketplace.config.MarketplaceConfig;
import com.enterprise.agentmarketplace.exception.AgentExecutionException;
import com.enterprise.agentmarketplace.exception.ExecutionRejectedException;
import com.enterprise.agentmarketplace.exception.UnknownAgentTypeException;
import com.enterprise.agentmarketplace.model.AgentInput;
import com.enterprise.agentmarketplace.model.AgentMetadata;
import com.enterprise.agentmarketplace.model.AgentType;
import com.enterprise.agentmarketplace.model.BatchRequest;
import com.enterprise.agentmarketplace.model.ExecutionRequest;
import com.enterprise.agentmarketplace.model.ExecutionResult;
import com.enterprise.agentmarketplace.model.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Main implementation of the AgentOrchestrator
 */
public class AgentOrchestratorImpl implements AgentOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(AgentOrchestratorImpl.class);

    private final AgentRegistry registry;
    private final PipelineExecutor executor;
    private final PipelineDriver driver;
    private final MarketplaceConfig.ExecutionConfig executionConfig;
    private final Duration shutdownTimeout;
    private final ExecutionStateStore store = new ExecutionStateStore();
    private final Semaphore permits;
    private final List<ExecutionListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final Instant startedAt;

    private final AtomicLong totalSubmitted = new AtomicLong(0);
    private final AtomicLong totalCompleted = new AtomicLong(0);
    private final AtomicLong totalFailed = new AtomicLong(0);
    private final AtomicLong totalCancelled = new AtomicLong(0);
    private final AtomicLong totalRejected = new AtomicLong(0);
    private final AtomicLong totalSettled = new AtomicLong(0);
    private final AtomicLong totalExecutionTimeMs = new AtomicLong(0);
    private final Map<AgentType, AtomicLong> countsByType = new ConcurrentHashMap<>();

    public AgentOrchestratorImpl(AgentRegistry registry, PipelineExecutor executor,
                                 MarketplaceConfig.ExecutionConfig executionConfig, Duration shutdownTimeout) {
        this(registry, executor, new PipelineDriver(), executionConfig, shutdownTimeout);
    }

    public AgentOrchestratorImpl(AgentRegistry registry, PipelineExecutor executor, PipelineDriver driver,
                                 MarketplaceConfig.ExecutionConfig executionConfig, Duration shutdownTimeout) {
        this.registry = registry;
        this.executor = executor;
        this.driver = driver;
        this.executionConfig = executionConfig;
        this.shutdownTimeout = shutdownTimeout;
        this.permits = executionConfig.isEnforceConcurrencyLimit()
            ? new Semaphore(executionConfig.getMaxConcurrentExecutions())
            : null;
        this.startedAt = Instant.now();

        logger.info("AgentOrchestrator started with {} agents, concurrency limit {}",
                    registry.registeredTypes().size(),
                    permits != null ? executionConfig.getMaxConcurrentExecutions() : "disabled");
    }

    @Override
    public String startExecution(AgentType agentType, AgentInput input, Map<String, Object> config)
            throws AgentExecutionException {
        ensureRunning();

        TestingAgent agent = registry.create(agentType);
        acquirePermit(agentType);
        return launch(agentType, agent, input, config);
    }

    @Override
    public Map<AgentType, String> startBatch(BatchRequest batch) throws AgentExecutionException, InterruptedException {
        ensureRunning();

        // no item is launched when any type in the batch is unknown
        for (ExecutionRequest request : batch.getExecutions()) {
            if (!registry.isRegistered(request.getAgentType())) {
                throw new UnknownAgentTypeException(request.getAgentType());
            }
        }

        logger.info("Starting {} batch of {} executions",
                    batch.isParallel() ? "parallel" : "sequential", batch.getExecutions().size());
        if (batch.isParallel()) {
            return startParallel(batch.getExecutions());
        }

        Map<AgentType, String> executionIds = new LinkedHashMap<>();
        for (ExecutionRequest request : batch.getExecutions()) {
            String executionId = startExecution(request.getAgentType(), request.getInput(), request.getConfig());
            executionIds.put(request.getAgentType(), executionId);

            ExecutionStatus status = awaitCompletion(executionId, executionConfig.getExecutionTimeout())
                .orElse(ExecutionStatus.FAILED);
            if (status == ExecutionStatus.FAILED && !batch.isContinueOnFailure()) {
                logger.warn("Stopping sequential batch: execution {} ({}) failed",
                            executionId, request.getAgentType().getId());
                break;
            }
        }

        return executionIds;
    }

    /**
     * Admits the whole batch before launching any item; a launch failure cancels the items already started.
     */
    private Map<AgentType, String> startParallel(List<ExecutionRequest> requests)
            throws AgentExecutionException, InterruptedException {
        List<TestingAgent> agents = new ArrayList<>();
        for (ExecutionRequest request : requests) {
            agents.add(registry.create(request.getAgentType()));
        }
        acquirePermits(requests.size());

        Map<AgentType, String> executionIds = new LinkedHashMap<>();
        List<String> launched = new ArrayList<>();
        try {
            for (int i = 0; i < requests.size(); i++) {
                ExecutionRequest request = requests.get(i);
                String executionId = launch(request.getAgentType(), agents.get(i),
                                            request.getInput(), request.getConfig());
                launched.add(executionId);
                executionIds.put(request.getAgentType(), executionId);
            }
        } catch (ExecutionRejectedException e) {
            // the rejected item already returned its permit
            releasePermits(requests.size() - launched.size() - 1);
            logger.warn("Parallel batch rejected after {} of {} launches, cancelling them",
                        launched.size(), requests.size());
            for (String executionId : launched) {
                cancel(executionId);
            }
            throw e;
        }
        return executionIds;
    }

    /**
     * Submits one run. The caller holds a permit for it, which is returned if the pool rejects the run.
     */
    private String launch(AgentType agentType, TestingAgent agent, AgentInput input, Map<String, Object> config)
            throws ExecutionRejectedException {
        AgentInput runInput = input != null ? input : AgentInput.empty();
        Map<String, Object> runConfig = config != null ? config : Map.of();

        ExecutionHandle handle = new ExecutionHandle(UUID.randomUUID().toString(), agentType);
        store.register(handle);

        try {
            handle.attach(executor.submit(() -> runPipeline(handle, agent, runInput, runConfig)));
        } catch (RejectedExecutionException e) {
            store.discard(handle);
            releasePermit();
            totalRejected.incrementAndGet();
            throw new ExecutionRejectedException(
                "Execution of " + agentType.getId() + " rejected: " + e.getMessage(), e);
        }

        totalSubmitted.incrementAndGet();
        countsByType.computeIfAbsent(agentType, type -> new AtomicLong()).incrementAndGet();
        logger.info("Started execution {} for agent {}", handle.getExecutionId(), agentType.getId());
        return handle.getExecutionId();
    }

    @Override
    public Optional<ExecutionStatus> awaitCompletion(String executionId) throws InterruptedException {
        Optional<ExecutionHandle> tracked = store.inFlight(executionId);
        if (tracked.isEmpty()) {
            return store.status(executionId);
        }
        tracked.get().awaitSettled();
        return store.status(executionId);
    }

    @Override
    public Optional<ExecutionStatus> awaitCompletion(String executionId, Duration timeout) throws InterruptedException {
        Optional<ExecutionHandle> tracked = store.inFlight(executionId);
        if (tracked.isEmpty()) {
            return store.status(executionId);
        }
        try {
            tracked.get().awaitSettled(timeout);
        } catch (TimeoutException e) {
            logger.warn("Execution {} did not finish within {}, cancelling", executionId, timeout);
            cancel(executionId);
        }
        return store.status(executionId);
    }

    @Override
    public boolean cancel(String executionId) throws InterruptedException {
        Optional<ExecutionHandle> tracked = store.inFlight(executionId);
        if (tracked.isEmpty()) {
            logger.debug("Cancel ignored for execution {}: not running", executionId);
            return false;
        }

        ExecutionHandle handle = tracked.get();
        if (!store.claimCancellation(handle)) {
            // finished meanwhile, or another caller owns the cancellation
            awaitSettledQuietly(handle);
            return false;
        }

        logger.info("Cancelling execution {}", executionId);
        handle.getCancellationToken().cancel();

        ExecutionResult partial = null;
        try {
            if (handle.claim()) {
                // the worker never started; it will skip the run
                handle.terminated(null);
            }
            handle.interrupt();
            partial = handle.awaitTermination(executionConfig.getCancellationTimeout());
            if (!handle.hasTerminated()) {
                logger.warn("Execution {} did not stop within {}; marking it cancelled anyway",
                            executionId, executionConfig.getCancellationTimeout());
            }
        } finally {
            settle(handle, store.finishCancelled(handle, partial));
        }
        return true;
    }

    @Override
    public Optional<ExecutionStatus> status(String executionId) {
        return store.status(executionId);
    }

    @Override
    public Optional<ExecutionResult> result(String executionId) {
        return store.result(executionId);
    }

    @Override
    public List<ExecutionResult> listResults() {
        return store.listResults();
    }

    @Override
    public int activeCount() {
        return store.activeCount();
    }

    @Override
    public List<AgentMetadata> listAgents() {
        return registry.listMetadata();
    }

    @Override
    public Optional<AgentMetadata> agentMetadata(AgentType agentType) {
        return registry.metadataFor(agentType);
    }

    @Override
    public void addListener(ExecutionListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener is required");
        }
        listeners.add(listener);
    }

    @Override
    public OrchestratorStatistics getStatistics() {
        PipelineExecutor.ExecutorStatistics executorStats = executor.getStatistics();

        return new OrchestratorStatistics() {
            @Override
            public long getTotalSubmitted() {
                return totalSubmitted.get();
            }

            @Override
            public long getTotalCompleted() {
                return totalCompleted.get();
            }

            @Override
            public long getTotalFailed() {
                return totalFailed.get();
            }

            @Override
            public long getTotalCancelled() {
                return totalCancelled.get();
            }

            @Override
            public long getTotalRejected() {
                return totalRejected.get();
            }

            @Override
            public int getActiveExecutions() {
                return store.activeCount();
            }

            @Override
            public double getAverageExecutionTimeMs() {
                long settled = totalSettled.get();
                return settled > 0 ? (double) totalExecutionTimeMs.get() / settled : 0.0;
            }

            @Override
            public long getUptimeMs() {
                return Instant.now().toEpochMilli() - startedAt.toEpochMilli();
            }

            @Override
            public Instant getStartedAt() {
                return startedAt;
            }

            @Override
            public Map<AgentType, Long> getExecutionCountsByType() {
                Map<AgentType, Long> counts = new EnumMap<>(AgentType.class);
                countsByType.forEach((type, count) -> counts.put(type, count.get()));
                return counts;
            }

            @Override
            public int getQueueSize() {
                return executorStats.getQueueSize();
            }

            @Override
            public int getActiveThreadCount() {
                return executorStats.getActiveThreadCount();
            }
        };
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("Shutting down AgentOrchestrator...");

        List<String> runningIds = store.runningIds();
        try {
            for (String executionId : runningIds) {
                cancel(executionId);
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while cancelling running executions", e);
            Thread.currentThread().interrupt();
        }
        store.clearInFlight();
        executor.shutdown(shutdownTimeout);

        logger.info("AgentOrchestrator stopped, {} executions cancelled on shutdown", runningIds.size());
    }

    private void runPipeline(ExecutionHandle handle, TestingAgent agent, AgentInput input,
                             Map<String, Object> config) {
        if (!handle.claim()) {
            return;
        }
        notifyStarted(handle);

        ExecutionResult result = null;
        ExecutionContext context = null;
        try {
            context = new ExecutionContext(handle.getExecutionId(), handle.getAgentType(),
                                           config, handle.getCancellationToken());
            result = driver.run(agent, input, context);
        } catch (Throwable t) {
            result = abortedResult(handle, context, t);
        } finally {
            handle.terminated(result);
            if (result == null) {
                result = ExecutionResult.minimal(handle.getExecutionId(), handle.getAgentType(),
                                                 ExecutionStatus.FAILED, handle.getSubmittedAt());
            }
            if (store.complete(handle, result)) {
                settle(handle, result);
            }
        }
    }

    private ExecutionResult abortedResult(ExecutionHandle handle, ExecutionContext context, Throwable failure) {
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
        logger.error("Execution {} aborted in agent {}", handle.getExecutionId(),
                     handle.getAgentType().getId(), failure);

        ExecutionResult.Builder result = ExecutionResult.builder(handle.getExecutionId(), handle.getAgentType(),
                                                                 handle.getSubmittedAt())
            .status(ExecutionStatus.FAILED)
            .endTime(Instant.now())
            .errorMessage(message);
        if (context != null) {
            context.log("Execution failed: " + message, ExecutionContext.LogLevel.ERROR);
            result.logs(context.getLogs());
        }
        return result.build();
    }

    private void settle(ExecutionHandle handle, ExecutionResult result) {
        // a worker that ignored cancellation keeps its permit until it actually stops
        handle.whenTerminated(this::releasePermit);
        recordOutcome(result);
        for (ExecutionListener listener : listeners) {
            try {
                listener.onExecutionSettled(result);
            } catch (RuntimeException e) {
                logger.warn("Execution listener failed for {}", result.getExecutionId(), e);
            }
        }
        handle.settle(result.getStatus());
    }

    private void notifyStarted(ExecutionHandle handle) {
        for (ExecutionListener listener : listeners) {
            try {
                listener.onExecutionStarted(handle.getExecutionId(), handle.getAgentType());
            } catch (RuntimeException e) {
                logger.warn("Execution listener failed for {}", handle.getExecutionId(), e);
            }
        }
    }

    private void recordOutcome(ExecutionResult result) {
        switch (result.getStatus()) {
            case COMPLETED:
                totalCompleted.incrementAndGet();
                break;
            case FAILED:
                totalFailed.incrementAndGet();
                break;
            case CANCELLED:
                totalCancelled.incrementAndGet();
                break;
            default:
                break;
        }
        totalSettled.incrementAndGet();
        if (result.getDuration() != null) {
            totalExecutionTimeMs.addAndGet(result.getDuration().toMillis());
        }
    }

    private void awaitSettledQuietly(ExecutionHandle handle) throws InterruptedException {
        try {
            handle.awaitSettled(executionConfig.getCancellationTimeout());
        } catch (TimeoutException e) {
            logger.warn("Execution {} still settling after {}", handle.getExecutionId(),
                        executionConfig.getCancellationTimeout());
        }
    }

    private void acquirePermit(AgentType agentType) throws ExecutionRejectedException {
        if (permits != null && !permits.tryAcquire()) {
            totalRejected.incrementAndGet();
            logger.warn("Rejected execution of {}: {} executions already running",
                        agentType.getId(), executionConfig.getMaxConcurrentExecutions());
            throw new ExecutionRejectedException("Maximum of " + executionConfig.getMaxConcurrentExecutions()
                + " concurrent executions reached");
        }
    }

    private void acquirePermits(int count) throws ExecutionRejectedException {
        if (permits != null && !permits.tryAcquire(count)) {
            totalRejected.addAndGet(count);
            logger.warn("Rejected batch of {} executions: limit is {}, {} permits free",
                        count, executionConfig.getMaxConcurrentExecutions(), permits.availablePermits());
            throw new ExecutionRejectedException("Batch of " + count + " executions exceeds the maximum of "
                + executionConfig.getMaxConcurrentExecutions() + " concurrent executions");
        }
    }

    private void releasePermit() {
        releasePermits(1);
    }

    private void releasePermits(int count) {
        if (permits != null && count > 0) {
            permits.release(count);
        }
    }

    private void ensureRunning() {
        if (!running.get()) {
            throw new IllegalStateException("AgentOrchestrator is shut down");
        }
    }
}
