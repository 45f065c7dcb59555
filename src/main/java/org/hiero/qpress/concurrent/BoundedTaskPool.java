// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.concurrent;

import static java.lang.System.Logger.Level.WARNING;

import java.io.InterruptedIOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A fixed size worker pool with a hard limit on the number of outstanding tasks, queued plus running. Submitting
 * blocks the caller while the limit is reached, which is the only backpressure between the single archive reader and
 * the workers and bounds the memory held by in flight blocks.
 * <p>
 * Tasks are normally submitted through a {@link TaskBatch} which collects their outcomes and provides the drain
 * barrier for one file.
 */
public final class BoundedTaskPool implements AutoCloseable {
    private final System.Logger LOGGER = System.getLogger(getClass().getName());

    private final ExecutorService executor;
    private final Semaphore permits;
    private final int maxPendingTasks;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Create a pool and start its worker threads.
     *
     * @param workerCount number of worker threads
     * @param maxPendingTasks maximum number of tasks queued or running at once
     * @param threadNamePrefix prefix for worker thread names
     */
    public BoundedTaskPool(int workerCount, int maxPendingTasks, String threadNamePrefix) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1, was " + workerCount);
        }
        if (maxPendingTasks < 1) {
            throw new IllegalArgumentException("maxPendingTasks must be at least 1, was " + maxPendingTasks);
        }
        this.maxPendingTasks = maxPendingTasks;
        this.permits = new Semaphore(maxPendingTasks);
        final AtomicInteger threadNumber = new AtomicInteger(0);
        this.executor = Executors.newFixedThreadPool(workerCount, runnable -> {
            final Thread thread = new Thread(runnable, threadNamePrefix + "-" + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start a new batch of tasks, typically all the blocks of one file.
     *
     * @param name name used in log and error messages
     * @return the new batch
     */
    public TaskBatch newBatch(String name) {
        return new TaskBatch(this, name);
    }

    /**
     * @return the number of tasks queued or running right now
     */
    public int pendingTasks() {
        return maxPendingTasks - permits.availablePermits();
    }

    /**
     * Run a task on the pool, blocking until a task slot is free.
     *
     * @param task the task, it must not throw
     * @return a future completing after the task ran and its slot was released
     * @throws InterruptedIOException if interrupted while waiting for a slot
     * @throws IllegalStateException if the pool is closed
     */
    CompletableFuture<Void> submit(Runnable task) throws InterruptedIOException {
        if (closed.get()) {
            throw new IllegalStateException("BoundedTaskPool is closed");
        }
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            final InterruptedIOException ioe = new InterruptedIOException("Interrupted waiting for a free task slot");
            ioe.initCause(e);
            throw ioe;
        }
        try {
            return CompletableFuture.runAsync(task, executor).whenComplete((ignored, error) -> permits.release());
        } catch (RejectedExecutionException e) {
            permits.release();
            throw new IllegalStateException("BoundedTaskPool is closed", e);
        }
    }

    /** Stop accepting tasks and wait for the queued ones to finish. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                final List<Runnable> notRan = executor.shutdownNow();
                LOGGER.log(WARNING, "Worker pool did not terminate in time; cancelled " + notRan.size() + " tasks");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            LOGGER.log(WARNING, "Interrupted while awaiting worker pool termination");
        }
    }
}
