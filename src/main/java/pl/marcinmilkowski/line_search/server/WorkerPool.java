package pl.marcinmilkowski.line_search.server;

import org.slf4j.Logger;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool running one request handler per connection.
 *
 * <p>Admission is a semaphore with one permit per worker. The accept loop
 * takes a permit before it accepts, so once every worker is busy new clients
 * stay in the OS listen backlog (or are refused by the OS when it is full)
 * instead of piling up inside the process. A permit is returned when its task
 * finishes, whatever the outcome.</p>
 */
public class WorkerPool {

    static final long SATURATION_WARN_MILLIS = 1_000L;
    private static final long IDLE_THREAD_KEEPALIVE_SECONDS = 30L;

    private final int capacity;
    private final Semaphore permits;
    private final ThreadPoolExecutor executor;
    private final Logger logger;

    public WorkerPool(int capacity, Logger logger) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Worker pool capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.logger = logger;
        this.permits = new Semaphore(capacity);
        // the semaphore keeps in-flight tasks <= capacity, so the queue never grows past that either
        this.executor = new ThreadPoolExecutor(capacity, capacity,
            IDLE_THREAD_KEEPALIVE_SECONDS, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(), new WorkerThreadFactory());
        this.executor.allowCoreThreadTimeOut(true);
    }

    /**
     * Block until a worker is free.
     *
     * <p>Waits in bounded slices and logs when the pool stays saturated, so a
     * stuck pool is visible in the log rather than silent.</p>
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void acquire() throws InterruptedException {
        while (!permits.tryAcquire(SATURATION_WARN_MILLIS, TimeUnit.MILLISECONDS)) {
            logger.warn("All {} workers busy; new connections are waiting in the accept backlog", capacity);
        }
    }

    /**
     * Give back a permit taken by {@link #acquire()} without running a task,
     * e.g. when accept() itself failed.
     */
    public void release() {
        permits.release();
    }

    /**
     * Run a task on a pooled thread. The caller must hold a permit from
     * {@link #acquire()}; it is released when the task completes.
     *
     * @throws RejectedExecutionException if the pool has been shut down (the permit is released)
     */
    public void submit(Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } finally {
                    permits.release();
                }
            });
        } catch (RejectedExecutionException e) {
            permits.release();
            throw e;
        }
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Number of tasks currently admitted (running or about to run).
     */
    public int getActiveCount() {
        return capacity - permits.availablePermits();
    }

    public void shutdown() {
        executor.shutdown();
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return executor.awaitTermination(timeout, unit);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "line-search-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
