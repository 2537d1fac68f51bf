package pl.marcinmilkowski.line_search.server;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolTest {

    private final WorkerPool pool = new WorkerPool(2, LoggerFactory.getLogger(WorkerPoolTest.class));

    @AfterEach
    void tearDown() throws Exception {
        pool.shutdown();
        pool.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new WorkerPool(0, LoggerFactory.getLogger(WorkerPoolTest.class)));
    }

    @Test
    @DisplayName("Permits are returned when tasks finish, even when they throw")
    void releasesPermitsAfterTasks() throws Exception {
        CountDownLatch done = new CountDownLatch(2);
        pool.acquire();
        pool.submit(done::countDown);
        pool.acquire();
        pool.submit(() -> {
            done.countDown();
            throw new IllegalStateException("task failure");
        });

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertTrue(waitForActiveCount(0));
    }

    @Test
    @DisplayName("Acquire blocks while every worker is busy")
    void acquireBlocksWhenSaturated() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<String> threadName = new AtomicReference<>();
        for (int i = 0; i < 2; i++) {
            pool.acquire();
            pool.submit(() -> {
                threadName.set(Thread.currentThread().getName());
                awaitQuietly(release);
            });
        }
        assertEquals(2, pool.getActiveCount());

        CountDownLatch acquired = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                pool.acquire();
                acquired.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();

        assertFalse(acquired.await(300, TimeUnit.MILLISECONDS));
        release.countDown();
        assertTrue(acquired.await(5, TimeUnit.SECONDS));
        pool.release();
        waiter.join();

        assertTrue(threadName.get().startsWith("line-search-worker-"));
    }

    @Test
    @DisplayName("Submitting after shutdown is rejected and returns the permit")
    void rejectsAfterShutdown() throws Exception {
        pool.shutdown();
        pool.acquire();

        assertThrows(RejectedExecutionException.class, () -> pool.submit(() -> { }));
        assertEquals(0, pool.getActiveCount());
    }

    private boolean waitForActiveCount(int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (pool.getActiveCount() == expected) {
                return true;
            }
            Thread.sleep(10);
        }
        return false;
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
