package com.redline.core;

import com.redline.chain.RequestContext;
import com.redline.chain.RequestScope;
import com.redline.http.MockRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the ThreadPool implementation.
 *
 * <p>These tests verify thread pool configuration, task execution, request context
 * propagation, saturation handling and shutdown behavior.</p>
 */
@DisplayName("ThreadPool Implementation Tests")
public class ThreadPoolTest {

    // Test configuration constants
    private static final int CUSTOM_CORE_POOL_SIZE = 4;
    private static final int CUSTOM_MAX_POOL_SIZE = 8;
    private static final int CUSTOM_QUEUE_CAPACITY = 100;
    private static final Duration CUSTOM_KEEP_ALIVE_TIME = Duration.ofSeconds(30);
    private static final int TASK_COUNT_SMALL = 10;
    private static final int TASK_COUNT_MEDIUM = 100;
    private static final int TASK_EXECUTION_DELAY_MS = 100;
    private static final int SHORT_TIMEOUT_SECONDS = 5;
    private static final int MEDIUM_TIMEOUT_SECONDS = 10;

    private ThreadPool threadPool;

    @BeforeEach
    void setUp() {
        threadPool = null;
    }

    @AfterEach
    void tearDown() {
        if (threadPool != null) {
            try {
                threadPool.shutdown();
                threadPool.awaitTermination(SHORT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                threadPool.shutdownNow();
            }
        }
    }

    private ThreadPool createDefaultThreadPool() {
        threadPool = new ThreadPool();
        return threadPool;
    }

    private ThreadPool createCustomThreadPool(ThreadPool.ThreadPoolConfig config) {
        threadPool = new ThreadPool(config);
        return threadPool;
    }

    private void awaitLatch(CountDownLatch latch, int timeoutSeconds) throws InterruptedException {
        assertTrue(latch.await(timeoutSeconds, TimeUnit.SECONDS),
                "Latch should complete within timeout");
    }

    private void drain(ThreadPool pool) throws InterruptedException {
        pool.shutdown();
        assertTrue(pool.awaitTermination(SHORT_TIMEOUT_SECONDS, TimeUnit.SECONDS),
                "Thread pool should terminate");
    }

    @Test
    @DisplayName("Should create thread pool with custom configuration")
    void testCustomConfiguration() {
        // Given: custom thread pool configuration
        ThreadPool.ThreadPoolConfig config = new ThreadPool.ThreadPoolConfig()
                .setCorePoolSize(CUSTOM_CORE_POOL_SIZE)
                .setMaxPoolSize(CUSTOM_MAX_POOL_SIZE)
                .setQueueCapacity(CUSTOM_QUEUE_CAPACITY)
                .setKeepAliveTime(CUSTOM_KEEP_ALIVE_TIME)
                .setCallerRunsWhenRejected(false);

        // When: thread pool is created with custom config
        ThreadPool pool = createCustomThreadPool(config);

        // Then: configuration should be applied correctly
        assertEquals(CUSTOM_CORE_POOL_SIZE, pool.getConfig().getCorePoolSize());
        assertEquals(CUSTOM_MAX_POOL_SIZE, pool.getConfig().getMaxPoolSize());
        assertEquals(CUSTOM_QUEUE_CAPACITY, pool.getConfig().getQueueCapacity());
        assertEquals(CUSTOM_KEEP_ALIVE_TIME, pool.getConfig().getKeepAliveTime());
        assertFalse(pool.getConfig().isCallerRunsWhenRejected());
    }

    @Test
    @DisplayName("Should execute Runnable tasks on named worker threads")
    void testTaskExecution() throws Exception {
        // Given: a thread pool and a task
        ThreadPool pool = createDefaultThreadPool();
        AtomicReference<String> threadName = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        // When: task is executed
        pool.execute(() -> {
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        // Then: task should complete on a worker thread
        awaitLatch(latch, SHORT_TIMEOUT_SECONDS);
        assertTrue(threadName.get().startsWith("redline-worker-"));

        // Verify metrics
        drain(pool);
        assertEquals(1, pool.getTasksSubmitted());
        assertEquals(1, pool.getTasksCompleted());
        assertEquals(0, pool.getTasksRejected());
    }

    @Test
    @DisplayName("Should supply Callable results through a CompletableFuture")
    void testSupply() throws Exception {
        // Given: a thread pool and a callable task
        ThreadPool pool = createDefaultThreadPool();
        int expectedResult = 42;

        // When: callable is supplied
        CompletableFuture<Integer> future = pool.supply(() -> {
            Thread.sleep(TASK_EXECUTION_DELAY_MS);
            return expectedResult;
        });

        // Then: future should return correct result
        assertEquals(expectedResult, future.get(SHORT_TIMEOUT_SECONDS, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Should complete the future exceptionally when the Callable fails")
    void testSupplyFailure() {
        ThreadPool pool = createDefaultThreadPool();

        CompletableFuture<Object> future = pool.supply(() -> {
            throw new IllegalStateException("failed");
        });

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> future.get(SHORT_TIMEOUT_SECONDS, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    @DisplayName("Should carry the submitter's request context to the worker")
    void testRequestContextPropagation() throws Exception {
        // Given: a request context bound on the submitting thread
        ThreadPool pool = createDefaultThreadPool();
        RequestContext context = new RequestContext(MockRequest.get("/ctx").build(), pool);

        // When: a task is supplied while the context is bound
        CompletableFuture<RequestContext> seen = RequestScope.call(context,
                () -> pool.supply(RequestScope::current));

        // Then: the worker sees the same context
        assertSame(context, seen.get(SHORT_TIMEOUT_SECONDS, TimeUnit.SECONDS));
        assertNull(RequestScope.current());
    }

    @Test
    @DisplayName("Should handle multiple concurrent tasks")
    void testMultipleTasks() throws Exception {
        // Given: a thread pool and multiple tasks
        ThreadPool pool = createDefaultThreadPool();
        int numTasks = TASK_COUNT_MEDIUM;
        CountDownLatch latch = new CountDownLatch(numTasks);
        AtomicInteger counter = new AtomicInteger(0);

        // When: multiple tasks are submitted
        for (int i = 0; i < numTasks; i++) {
            pool.execute(() -> {
                counter.incrementAndGet();
                latch.countDown();
            });
        }

        // Then: all tasks should complete successfully
        awaitLatch(latch, MEDIUM_TIMEOUT_SECONDS);
        assertEquals(numTasks, counter.get());

        // Verify metrics
        drain(pool);
        assertEquals(numTasks, pool.getTasksSubmitted());
        assertEquals(numTasks, pool.getTasksCompleted());
        assertTrue(pool.getAverageExecutionTime() >= 0);
    }

    @Test
    @DisplayName("Should run rejected tasks in the caller thread when saturated")
    void testCallerRunsWhenSaturated() throws Exception {
        // Given: a pool with one thread and a one-slot queue, both occupied
        ThreadPool pool = createCustomThreadPool(new ThreadPool.ThreadPoolConfig()
                .setCorePoolSize(1).setMaxPoolSize(1).setQueueCapacity(1));
        CountDownLatch block = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        pool.execute(() -> {
            started.countDown();
            try {
                block.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        awaitLatch(started, SHORT_TIMEOUT_SECONDS);
        pool.execute(() -> { });

        // When: a third task is submitted
        AtomicReference<Thread> ranOn = new AtomicReference<>();
        pool.execute(() -> ranOn.set(Thread.currentThread()));

        // Then: it ran in the submitting thread
        assertSame(Thread.currentThread(), ranOn.get());
        assertEquals(1, pool.getTasksRejected());
        block.countDown();
    }

    @Test
    @DisplayName("Should reject tasks when saturated and caller-runs is off")
    void testRejectWhenSaturated() throws Exception {
        ThreadPool pool = createCustomThreadPool(new ThreadPool.ThreadPoolConfig()
                .setCorePoolSize(1).setMaxPoolSize(1).setQueueCapacity(1)
                .setCallerRunsWhenRejected(false));
        CountDownLatch block = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        pool.execute(() -> {
            started.countDown();
            try {
                block.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        awaitLatch(started, SHORT_TIMEOUT_SECONDS);
        pool.execute(() -> { });

        assertThrows(RejectedExecutionException.class, () -> pool.execute(() -> { }));
        assertEquals(1, pool.getTasksRejected());
        block.countDown();
    }

    @Test
    @DisplayName("Should shutdown gracefully and complete pending tasks")
    void testShutdown() throws Exception {
        // Given: a thread pool with running tasks
        ThreadPool pool = createDefaultThreadPool();
        int numTasks = TASK_COUNT_SMALL;
        CountDownLatch latch = new CountDownLatch(numTasks);

        // When: tasks are submitted and pool is shut down
        for (int i = 0; i < numTasks; i++) {
            pool.execute(() -> {
                try {
                    Thread.sleep(TASK_EXECUTION_DELAY_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    latch.countDown();
                }
            });
        }

        pool.shutdown();

        // Then: all tasks should complete and pool should terminate
        awaitLatch(latch, SHORT_TIMEOUT_SECONDS);
        assertTrue(pool.awaitTermination(SHORT_TIMEOUT_SECONDS, TimeUnit.SECONDS),
                "Thread pool should terminate gracefully");
        assertTrue(pool.isShutdown());
        assertEquals(numTasks, pool.getTasksCompleted());
    }

    @Test
    @DisplayName("Should shutdown immediately and interrupt running tasks")
    void testShutdownNow() throws Exception {
        // Given: a thread pool with a thread for each long-running task
        int numTasks = TASK_COUNT_SMALL;
        ThreadPool pool = createCustomThreadPool(new ThreadPool.ThreadPoolConfig()
                .setCorePoolSize(numTasks).setMaxPoolSize(numTasks));
        CountDownLatch startedLatch = new CountDownLatch(numTasks);
        CountDownLatch blockLatch = new CountDownLatch(1);

        for (int i = 0; i < numTasks; i++) {
            pool.execute(() -> {
                startedLatch.countDown();
                try {
                    blockLatch.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        awaitLatch(startedLatch, SHORT_TIMEOUT_SECONDS);

        // When: the pool is shut down now
        pool.shutdownNow();

        // Then: the pool terminates without waiting for the tasks to be released
        assertTrue(pool.isShutdown(), "Executor should be shutting down");
        assertTrue(pool.awaitTermination(SHORT_TIMEOUT_SECONDS, TimeUnit.SECONDS),
                "Thread pool should terminate");
        blockLatch.countDown();
    }
}
