package com.enterprise.agentmarketplace.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded worker pool running one pipeline per task
 */
public class PipelineExecutor {

    private static final Logger logger = LoggerFactory.getLogger(PipelineExecutor.class);

    private final ThreadPoolExecutor executor;
    private final AtomicLong totalSubmitted = new AtomicLong(0);
    private final AtomicLong totalRejected = new AtomicLong(0);

    public PipelineExecutor(int corePoolSize, int maximumPoolSize,
                            long keepAliveTime, TimeUnit unit,
                            BlockingQueue<Runnable> workQueue) {

        this.executor = new ThreadPoolExecutor(
            corePoolSize,
            maximumPoolSize,
            keepAliveTime,
            unit,
            workQueue,
            new PipelineThreadFactory(),
            new PipelineRejectedExecutionHandler()
        );

        logger.info("PipelineExecutor initialized with core={}, max={}, keepAlive={}ms",
                   corePoolSize, maximumPoolSize, unit.toMillis(keepAliveTime));
    }

    /**
     * Submit a pipeline run. The returned future is used only to interrupt the worker.
     *
     * @throws RejectedExecutionException when the pool is saturated or shut down
     */
    public Future<?> submit(Runnable pipelineRun) {
        try {
            Future<?> future = executor.submit(pipelineRun);
            totalSubmitted.incrementAndGet();
            return future;
        } catch (RejectedExecutionException e) {
            totalRejected.incrementAndGet();
            throw e;
        }
    }

    /**
     * Get executor statistics
     */
    public ExecutorStatistics getStatistics() {
        return new ExecutorStatistics() {
            @Override
            public long getTotalSubmitted() {
                return totalSubmitted.get();
            }

            @Override
            public long getTotalRejected() {
                return totalRejected.get();
            }

            @Override
            public int getActiveThreadCount() {
                return executor.getActiveCount();
            }

            @Override
            public int getPoolSize() {
                return executor.getPoolSize();
            }

            @Override
            public int getMaximumPoolSize() {
                return executor.getMaximumPoolSize();
            }

            @Override
            public int getQueueSize() {
                return executor.getQueue().size();
            }

            @Override
            public int getRemainingQueueCapacity() {
                return executor.getQueue().remainingCapacity();
            }
        };
    }

    /**
     * Stop accepting work and wait for running pipelines, forcing interruption after the timeout
     */
    public void shutdown(Duration timeout) {
        logger.info("Shutting down PipelineExecutor...");

        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Executor did not terminate gracefully, forcing shutdown");
                executor.shutdownNow();
            }
            logger.info("PipelineExecutor shutdown completed");
        } catch (InterruptedException e) {
            logger.error("Interrupted during shutdown", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return !executor.isShutdown() && !executor.isTerminated();
    }

    private static class PipelineThreadFactory implements ThreadFactory {
        private final AtomicLong threadNumber = new AtomicLong(1);
        private final String namePrefix = "agent-pipeline-";

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + threadNumber.getAndIncrement());
            t.setDaemon(false);
            t.setPriority(Thread.NORM_PRIORITY);
            return t;
        }
    }

    private static class PipelineRejectedExecutionHandler implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            if (executor.isShutdown()) {
                throw new RejectedExecutionException("Pipeline executor is shut down");
            }
            logger.error("Pipeline rejected - all workers busy and queue is full");
            throw new RejectedExecutionException("Pipeline rejected - system overloaded");
        }
    }

    /**
     * Statistics interface for the executor
     */
    public interface ExecutorStatistics {
        long getTotalSubmitted();
        long getTotalRejected();
        int getActiveThreadCount();
        int getPoolSize();
        int getMaximumPoolSize();
        int getQueueSize();
        int getRemainingQueueCapacity();
    }
}
