package com.questrail.voice.dispatch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class TaskScopeTest
{
    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void shutdown()
    {
        executor.shutdownNow();
    }

    @Test
    void joinAllWaitsForEveryChild() throws Exception
    {
        AtomicInteger completed = new AtomicInteger();
        TaskScope scope = new TaskScope(executor, 8);

        for (int i = 0; i < 5; i++) {
            assertTrue(scope.spawn(() -> {
                sleep(20);
                completed.incrementAndGet();
            }));
        }
        scope.joinAll();

        assertEquals(5, completed.get());
        assertEquals(0, scope.inFlight());
    }

    @Test
    void spawnDoesNotWaitForTheChild() throws Exception
    {
        CountDownLatch release = new CountDownLatch(1);
        TaskScope scope = new TaskScope(executor, 8);

        long start = System.nanoTime();
        assertTrue(scope.spawn(() -> await(release)));
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 1000);
        assertEquals(1, scope.inFlight());

        release.countDown();
        scope.joinAll();
    }

    @Test
    void saturatedScopeRefusesInsteadOfBlocking() throws Exception
    {
        CountDownLatch release = new CountDownLatch(1);
        TaskScope scope = new TaskScope(executor, 2);

        assertTrue(scope.spawn(() -> await(release)));
        assertTrue(scope.spawn(() -> await(release)));
        assertFalse(scope.spawn(() -> { }));
        assertEquals(2, scope.inFlight());

        release.countDown();
        scope.joinAll();
        assertTrue(scope.spawn(() -> { }));
        scope.joinAll();
    }

    @Test
    void cancelAllInterruptsRunningChildren() throws Exception
    {
        CountDownLatch running = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        TaskScope scope = new TaskScope(executor, 4);

        scope.spawn(() -> {
            running.countDown();
            try {
                Thread.sleep(60_000);
            }
            catch (InterruptedException e) {
                interrupted.set(true);
            }
        });
        assertTrue(running.await(5, TimeUnit.SECONDS));

        scope.cancelAll();
        scope.joinAll();

        assertTrue(interrupted.get());
        assertTrue(scope.isCancelled());
        assertFalse(scope.spawn(() -> { }));
    }

    @Test
    void cancelledChildThatNeverStartedDoesNotRun() throws Exception
    {
        // An executor that holds tasks until told to run them.
        List<Runnable> held = new ArrayList<>();
        AtomicBoolean ran = new AtomicBoolean();
        TaskScope scope = new TaskScope(held::add, 4);

        assertTrue(scope.spawn(() -> ran.set(true)));
        scope.cancelAll();
        assertEquals(0, scope.inFlight());

        held.forEach(Runnable::run);
        assertFalse(ran.get());
    }

    @Test
    void rejectedExecutionIsAReturnValueNotAnException()
    {
        ExecutorService stopped = Executors.newSingleThreadExecutor();
        stopped.shutdown();
        TaskScope scope = new TaskScope(stopped, 4);

        assertFalse(scope.spawn(() -> { }));
        assertEquals(0, scope.inFlight());
    }

    @Test
    void closeCancelsAndJoins() throws Exception
    {
        CountDownLatch running = new CountDownLatch(1);
        TaskScope scope = new TaskScope(executor, 4);
        scope.spawn(() -> {
            running.countDown();
            await(new CountDownLatch(1));
        });
        assertTrue(running.await(5, TimeUnit.SECONDS));

        scope.close();

        assertEquals(0, scope.inFlight());
    }

    private static void sleep(long millis)
    {
        try {
            Thread.sleep(millis);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch)
    {
        try {
            latch.await();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
