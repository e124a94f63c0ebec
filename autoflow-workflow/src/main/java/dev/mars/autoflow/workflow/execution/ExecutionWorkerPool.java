package dev.mars.autoflow.workflow.execution;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.autoflow.config.AutoflowConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Threads that drive executions.
 *
 * <p>A fixed pool of workers advances executions; a scheduler re-submits an execution
 * when one of its suspended nodes is due; handlers run on a separate cached pool so a
 * worker can abandon an attempt that exceeds its timeout. LOOP iterations with
 * concurrency greater than one use their own cached pool.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class ExecutionWorkerPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionWorkerPool.class);

    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService handlerExecutor;
    private final ExecutorService loopExecutor;
    private final Duration shutdownTimeout;
    private final Clock clock;
    private final Consumer<String> advance;
    private final Map<String, ScheduledFuture<?>> wakeups = new ConcurrentHashMap<>();
    private volatile boolean shutdown = false;

    public ExecutionWorkerPool(AutoflowConfiguration config, Clock clock, Consumer<String> advance) {
        this.workers = Executors.newFixedThreadPool(config.getWorkerThreads(), threadFactory("autoflow-worker"));
        this.scheduler = Executors.newScheduledThreadPool(config.getWakeupThreads(), threadFactory("autoflow-wakeup"));
        this.handlerExecutor = Executors.newCachedThreadPool(threadFactory("autoflow-handler"));
        this.loopExecutor = Executors.newCachedThreadPool(threadFactory("autoflow-loop"));
        this.shutdownTimeout = config.getShutdownTimeout();
        this.clock = clock;
        this.advance = advance;
        logger.info("Execution worker pool started with {} workers", config.getWorkerThreads());
    }

    /**
     * Queues the execution for a worker.
     */
    public void submit(String executionId) {
        if (shutdown) {
            logger.warn("Worker pool is shut down, execution {} not queued", executionId);
            return;
        }
        try {
            workers.execute(() -> advance.accept(executionId));
        } catch (RejectedExecutionException e) {
            logger.warn("Execution {} rejected by worker pool: {}", executionId, e.getMessage());
        }
    }

    public void schedule(String executionId, Duration delay) {
        scheduleAt(executionId, clock.instant().plus(delay));
    }

    /**
     * Queues the execution at {@code dueAt}. An earlier pending wake-up for the same
     * execution is kept; a later one is replaced.
     */
    public void scheduleAt(String executionId, Instant dueAt) {
        if (shutdown) {
            return;
        }
        long delayMs = Math.max(0, Duration.between(clock.instant(), dueAt).toMillis());
        wakeups.compute(executionId, (id, existing) -> {
            if (existing != null && !existing.isDone()) {
                if (existing.getDelay(TimeUnit.MILLISECONDS) <= delayMs) {
                    return existing;
                }
                existing.cancel(false);
            }
            logger.debug("Wake-up for execution {} in {} ms", id, delayMs);
            return scheduler.schedule(() -> submit(id), delayMs, TimeUnit.MILLISECONDS);
        });
    }

    public void cancelWakeup(String executionId) {
        ScheduledFuture<?> existing = wakeups.remove(executionId);
        if (existing != null) {
            existing.cancel(false);
        }
    }

    public ExecutorService handlerExecutor() {
        return handlerExecutor;
    }

    public ExecutorService loopExecutor() {
        return loopExecutor;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    @Override
    public void close() {
        shutdown = true;
        scheduler.shutdownNow();
        shutdownGracefully(workers, "worker");
        shutdownGracefully(loopExecutor, "loop");
        shutdownGracefully(handlerExecutor, "handler");
        wakeups.clear();
        logger.info("Execution worker pool stopped");
    }

    private void shutdownGracefully(ExecutorService executor, String name) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("{} threads did not stop within {}, interrupting", name, shutdownTimeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
