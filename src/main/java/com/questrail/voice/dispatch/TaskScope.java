package com.questrail.voice.dispatch;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * TaskScope
 * =============================================================================
 * Structured-concurrency scope owning a bounded set of child tasks.
 *
 * <h2>Operations</h2>
 * <ul>
 *   <li>{@link #spawn(Runnable)}: start a child without waiting for it</li>
 *   <li>{@link #cancelAll()}: interrupt running children, discard unstarted ones</li>
 *   <li>{@link #joinAll()}: wait until no child is left</li>
 *   <li>{@link #close()}: cancel-all, then join-all</li>
 * </ul>
 *
 * <h2>Admission</h2>
 * <p>At most {@code maxInFlight} children may be alive at once. When the scope
 * is saturated, {@link #spawn(Runnable)} refuses the task instead of queueing
 * it, so the spawning thread never blocks.</p>
 *
 * <h2>Cancellation</h2>
 * <p>Cancellation is cooperative: a running child is interrupted and must
 * observe the interrupt at a blocking call. A child counts as alive until its
 * task has actually returned, so {@link #joinAll()} after
 * {@link #cancelAll()} means no child code is still running.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>The scope does <strong>not</strong> own the executor; many scopes share
 * one. The executor must run tasks promptly (no unbounded queueing behind
 * other scopes) for the no-head-of-line-blocking guarantee to hold.</p>
 */
public final class TaskScope implements AutoCloseable
{
    private final Executor executor;
    private final int maxInFlight;

    private final Object lock = new Object();
    private final Set<Child> children = new HashSet<>();
    private boolean cancelled;

    public TaskScope(Executor executor, int maxInFlight)
    {
        this.executor = Objects.requireNonNull(executor, "executor");
        if (maxInFlight <= 0) {
            throw new IllegalArgumentException("maxInFlight must be > 0");
        }
        this.maxInFlight = maxInFlight;
    }

    /**
     * Start {@code task} as a child of this scope.
     *
     * @return false if the task was refused because the scope is saturated,
     *         already cancelled, or the executor is shutting down
     */
    public boolean spawn(Runnable task)
    {
        Objects.requireNonNull(task, "task");
        Child child = new Child(task);
        synchronized (lock) {
            if (cancelled || children.size() >= maxInFlight) {
                return false;
            }
            children.add(child);
        }
        try {
            executor.execute(child);
        }
        catch (RejectedExecutionException e) {
            child.finish();
            return false;
        }
        return true;
    }

    /**
     * Cancel every child and refuse further spawns. Does not wait.
     */
    public void cancelAll()
    {
        synchronized (lock) {
            cancelled = true;
            for (Child child : Set.copyOf(children)) {
                child.cancel();
            }
        }
    }

    /**
     * Wait until every child has finished.
     */
    public void joinAll() throws InterruptedException
    {
        synchronized (lock) {
            while (!children.isEmpty()) {
                lock.wait();
            }
        }
    }

    /** Number of children currently alive. */
    public int inFlight()
    {
        synchronized (lock) {
            return children.size();
        }
    }

    public boolean isCancelled()
    {
        synchronized (lock) {
            return cancelled;
        }
    }

    /**
     * Cancel all children and wait for them to return. Waits even if the
     * calling thread is interrupted; the interrupt flag is restored afterwards.
     */
    @Override
    public void close()
    {
        cancelAll();
        boolean interrupted = false;
        synchronized (lock) {
            while (!children.isEmpty()) {
                try {
                    lock.wait();
                }
                catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private final class Child implements Runnable
    {
        private final Runnable task;

        // guarded by lock
        private Thread runner;
        private boolean started;
        private boolean abandoned;

        Child(Runnable task)
        {
            this.task = task;
        }

        @Override
        public void run()
        {
            synchronized (lock) {
                if (abandoned) {
                    return; // already finished by cancel()
                }
                started = true;
                runner = Thread.currentThread();
            }
            try {
                task.run();
            }
            finally {
                synchronized (lock) {
                    runner = null;
                    // Drop a cancellation interrupt so it cannot leak into the
                    // executor's next task on this thread.
                    Thread.interrupted();
                }
                finish();
            }
        }

        void cancel()
        {
            // lock held by caller
            abandoned = true;
            if (runner != null) {
                runner.interrupt();
            }
            else if (!started) {
                finish();
            }
        }

        void finish()
        {
            synchronized (lock) {
                if (children.remove(this)) {
                    lock.notifyAll();
                }
            }
        }
    }
}
