// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.concurrent;

import java.io.InterruptedIOException;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A group of tasks run on a {@link BoundedTaskPool} whose outcomes are collected and awaited together. Used for the
 * blocks of one file: the reader submits one task per block and then calls {@link #await()} as the drain barrier
 * before moving on to the next file.
 * <p>
 * The first failing task cancels the batch, tasks that have not started yet are skipped. Submitting is meant to be
 * done from a single thread, tasks run on the pool threads. Only a count of unfinished tasks is kept, so a batch of
 * millions of blocks holds no more than the pool's pending tasks.
 */
public final class TaskBatch {
    /** A unit of work that may fail with any exception. */
    @FunctionalInterface
    public interface Task {
        void run() throws Exception;
    }

    /**
     * The outcome of every task of a batch.
     *
     * @param completed number of tasks that ran successfully
     * @param skipped number of tasks not run because the batch was cancelled
     * @param failures failures in the order they were recorded
     */
    public record Result(int completed, int skipped, List<Throwable> failures) {
        /**
         * @return true if no task failed
         */
        public boolean isSuccess() {
            return failures.isEmpty();
        }

        /**
         * @return the first failure with every later one added as suppressed, or null if nothing failed
         */
        public Throwable primaryFailure() {
            if (failures.isEmpty()) return null;
            final Throwable first = failures.get(0);
            for (int i = 1; i < failures.size(); i++) {
                if (failures.get(i) != first) first.addSuppressed(failures.get(i));
            }
            return first;
        }
    }

    private final BoundedTaskPool pool;
    private final String name;
    private final Object lock = new Object();
    /** Tasks submitted but not yet finished or skipped, guarded by {@code lock}. */
    private int outstanding = 0;
    private final Queue<Throwable> failures = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicInteger completed = new AtomicInteger(0);
    private final AtomicInteger skipped = new AtomicInteger(0);
    private boolean awaited = false;

    TaskBatch(BoundedTaskPool pool, String name) {
        this.pool = Objects.requireNonNull(pool);
        this.name = Objects.requireNonNull(name);
    }

    /**
     * @return the batch name
     */
    public String name() {
        return name;
    }

    /**
     * Submit a task, blocking while the pool is at its pending task limit.
     *
     * @param task the task to run
     * @throws InterruptedIOException if interrupted while waiting for a task slot
     * @throws IllegalStateException if the batch was already awaited
     */
    public void submit(Task task) throws InterruptedIOException {
        Objects.requireNonNull(task);
        if (awaited) {
            throw new IllegalStateException("Batch " + name + " was already awaited");
        }
        synchronized (lock) {
            outstanding++;
        }
        final CompletableFuture<Void> future;
        try {
            future = pool.submit(() -> runTask(task));
        } catch (InterruptedIOException | RuntimeException e) {
            taskFinished();
            throw e;
        }
        future.whenComplete((ignored, error) -> {
            // runTask records every task failure, an error here means the pool itself broke
            if (error != null) failures.add(error);
            taskFinished();
        });
    }

    /**
     * Cancel the batch: tasks that have not started are skipped, running tasks finish.
     */
    public void cancel() {
        cancelled.set(true);
    }

    /**
     * @return true once the batch was cancelled or a task failed
     */
    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Wait for every submitted task to finish or be skipped.
     *
     * @return the outcome of all tasks
     * @throws InterruptedIOException if interrupted while waiting, the batch is cancelled in that case
     */
    public Result await() throws InterruptedIOException {
        awaited = true;
        synchronized (lock) {
            while (outstanding > 0) {
                try {
                    lock.wait();
                } catch (InterruptedException e) {
                    cancel();
                    Thread.currentThread().interrupt();
                    final InterruptedIOException ioe = new InterruptedIOException("Interrupted awaiting batch " + name);
                    ioe.initCause(e);
                    throw ioe;
                }
            }
        }
        return new Result(completed.get(), skipped.get(), List.copyOf(failures));
    }

    /**
     * @return the number of submitted tasks that have not finished yet
     */
    int outstandingTasks() {
        synchronized (lock) {
            return outstanding;
        }
    }

    private void taskFinished() {
        synchronized (lock) {
            outstanding--;
            if (outstanding == 0) lock.notifyAll();
        }
    }

    private void runTask(Task task) {
        if (cancelled.get()) {
            skipped.incrementAndGet();
            return;
        }
        try {
            task.run();
            completed.incrementAndGet();
        } catch (Throwable t) {
            // record the error for the drain barrier and stop the rest of the batch
            failures.add(t);
            cancelled.set(true);
        }
    }
}
