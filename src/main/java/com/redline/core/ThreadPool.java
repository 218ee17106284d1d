package com.redline.core;

import com.redline.chain.RequestScope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Worker pool for asynchronous request work, such as {@link Redline#async(Callable)}.
 * Every task runs with the request context of the code that submitted it.
 */
public class ThreadPool implements Executor {
    private static final Logger logger = LoggerFactory.getLogger(ThreadPool.class);

    private final ExecutorService executor;

    // Statistics for monitoring
    private final AtomicLong tasksSubmitted = new AtomicLong(0);
    private final AtomicLong tasksCompleted = new AtomicLong(0);
    private final AtomicLong tasksRejected = new AtomicLong(0);
    private final AtomicLong totalExecutionTime = new AtomicLong(0);

    private final ThreadPoolConfig config;

    /**
     * Creates a new thread pool with default configuration.
     */
    public ThreadPool() {
        this(new ThreadPoolConfig());
    }

    /**
     * Creates a new thread pool with the specified configuration.
     *
     * @param config the thread pool configuration
     */
    public ThreadPool(ThreadPoolConfig config) {
        this.config = config;

        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, "redline-worker-" + threadNumber.getAndIncrement());
                thread.setDaemon(config.isDaemonThreads());
                return thread;
            }
        };

        RejectedExecutionHandler rejectionHandler = (r, executor) -> {
            tasksRejected.incrementAndGet();
            if (config.isCallerRunsWhenRejected()) {
                logger.debug("Thread pool saturated, executing task in caller thread");
                r.run();
            } else {
                logger.warn("Thread pool saturated, rejecting task");
                throw new RejectedExecutionException("Thread pool saturated");
            }
        };

        ThreadPoolExecutor threadPoolExecutor = new ThreadPoolExecutor(
                config.getCorePoolSize(),
                config.getMaxPoolSize(),
                config.getKeepAliveTime().toMillis(), TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(config.getQueueCapacity()),
                threadFactory,
                rejectionHandler);
        threadPoolExecutor.allowCoreThreadTimeOut(true);
        this.executor = threadPoolExecutor;

        logger.debug("Created thread pool: core={}, max={}, queue={}",
                config.getCorePoolSize(), config.getMaxPoolSize(), config.getQueueCapacity());
    }

    /**
     * Submits a task to the thread pool. The task keeps the submitter's request context.
     *
     * @param task the task to execute
     */
    @Override
    public void execute(Runnable task) {
        tasksSubmitted.incrementAndGet();
        Runnable scoped = RequestScope.wrap(task);
        executor.execute(() -> {
            long startTime = System.nanoTime();
            try {
                scoped.run();
            } finally {
                totalExecutionTime.addAndGet(System.nanoTime() - startTime);
                tasksCompleted.incrementAndGet();
            }
        });
    }

    /**
     * Runs a task asynchronously with the submitter's request context.
     *
     * @param task the task
     * @param <T> the type of the task's result
     * @return a future completing with the task's result or failure
     */
    public <T> CompletableFuture<T> supply(Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        execute(() -> {
            try {
                future.complete(task.call());
            } catch (Exception e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    /**
     * Shuts down the thread pool, allowing previously submitted tasks to complete.
     */
    public void shutdown() {
        executor.shutdown();
    }

    /**
     * Shuts down the thread pool immediately, attempting to stop all actively
     * executing tasks.
     *
     * @return a list of tasks that were awaiting execution
     */
    public List<Runnable> shutdownNow() {
        return executor.shutdownNow();
    }

    /**
     * Waits for all tasks to complete or until the timeout occurs.
     *
     * @param timeout the maximum time to wait
     * @param unit    the time unit of the timeout argument
     * @return true if the executor terminated, false if the timeout elapsed before
     *         termination
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return executor.awaitTermination(timeout, unit);
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    public long getTasksSubmitted() {
        return tasksSubmitted.get();
    }

    public long getTasksCompleted() {
        return tasksCompleted.get();
    }

    public long getTasksRejected() {
        return tasksRejected.get();
    }

    /**
     * Gets the average execution time of completed tasks in nanoseconds.
     *
     * @return the average execution time in nanoseconds, or 0 if no tasks have been
     *         completed
     */
    public double getAverageExecutionTime() {
        long completed = tasksCompleted.get();
        return completed > 0 ? (double) totalExecutionTime.get() / completed : 0;
    }

    public ThreadPoolConfig getConfig() {
        return config;
    }

    /**
     * Configuration for the thread pool.
     */
    public static class ThreadPoolConfig {
        private int corePoolSize = Runtime.getRuntime().availableProcessors() * 2;
        private int maxPoolSize = Runtime.getRuntime().availableProcessors() * 8;
        private int queueCapacity = 10000;
        private Duration keepAliveTime = Duration.ofSeconds(30);
        private boolean daemonThreads = true;
        private boolean callerRunsWhenRejected = true;

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public ThreadPoolConfig setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
            return this;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public ThreadPoolConfig setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
            return this;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public ThreadPoolConfig setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Duration getKeepAliveTime() {
            return keepAliveTime;
        }

        public ThreadPoolConfig setKeepAliveTime(Duration keepAliveTime) {
            this.keepAliveTime = keepAliveTime;
            return this;
        }

        public boolean isDaemonThreads() {
            return daemonThreads;
        }

        public ThreadPoolConfig setDaemonThreads(boolean daemonThreads) {
            this.daemonThreads = daemonThreads;
            return this;
        }

        public boolean isCallerRunsWhenRejected() {
            return callerRunsWhenRejected;
        }

        public ThreadPoolConfig setCallerRunsWhenRejected(boolean callerRunsWhenRejected) {
            this.callerRunsWhenRejected = callerRunsWhenRejected;
            return this;
        }
    }
}
