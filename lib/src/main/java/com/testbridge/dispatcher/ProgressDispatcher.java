package com.testbridge.dispatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ProgressDispatcher schedules progress runners on a shared thread pool.
 * Threads are daemons so an abandoned run never keeps the JVM alive.
 */
public final class ProgressDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ProgressDispatcher.class);

    private final ExecutorService executor;
    private final String name;
    private volatile boolean shutdown = false;

    private ProgressDispatcher(ExecutorService executor, String name) {
        this.executor = executor;
        this.name = name;
    }

    /**
     * Creates a dispatcher backed by a cached thread pool.
     * Idle threads are reclaimed, so a driver that is not running tests holds no threads.
     *
     * @param name The name prefix for threads
     * @return A new ProgressDispatcher
     */
    public static ProgressDispatcher cachedThreadDispatcher(String name) {
        ExecutorService executor = Executors.newCachedThreadPool(daemonThreadFactory(name));
        logger.debug("Created cached thread progress dispatcher: {}", name);
        return new ProgressDispatcher(executor, name);
    }

    private static ThreadFactory daemonThreadFactory(String name) {
        AtomicInteger threadNumber = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-" + threadNumber.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Schedules a runner for execution on the dispatcher's thread pool.
     *
     * @param task The runnable task (typically a ProgressRunner) to schedule
     */
    public void schedule(Runnable task) {
        if (shutdown) {
            logger.warn("Attempted to schedule task on shutdown progress dispatcher: {}", name);
            return;
        }
        try {
            executor.execute(task);
        } catch (Exception e) {
            logger.error("Failed to schedule task on progress dispatcher {}: {}", name, e.getMessage(), e);
        }
    }

    /**
     * Initiates shutdown of the dispatcher.
     * No new tasks will be accepted; tasks already scheduled run to completion.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        logger.debug("Shutting down progress dispatcher: {}", name);
        executor.shutdown();
    }

    /**
     * Waits for scheduled tasks to finish after a shutdown.
     *
     * @return true if all tasks terminated, false if timeout elapsed
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) {
        try {
            return executor.awaitTermination(timeout, unit);
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for progress dispatcher {} termination", name);
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isShutdown() {
        return shutdown;
    }
}
