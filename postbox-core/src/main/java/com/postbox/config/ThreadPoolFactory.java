package com.postbox.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the thread pools that host actor bodies.
 *
 * <p>An actor blocked in {@code receive()} keeps its thread, so a pool must offer at least as many
 * threads as there are live actors. The default {@link ThreadPoolType#CACHED} pool grows on demand;
 * {@link ThreadPoolType#FIXED} and {@link ThreadPoolType#WORK_STEALING} suit a known, bounded
 * number of actors.
 */
public class ThreadPoolFactory {
    private static final int DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 10;

    private ThreadPoolType executorType = ThreadPoolType.CACHED;
    private int fixedPoolSize = Runtime.getRuntime().availableProcessors();
    private int workStealingParallelism = Runtime.getRuntime().availableProcessors();
    private boolean useNamedThreads = true;
    private boolean daemonThreads = true;
    private int actorShutdownTimeoutSeconds = DEFAULT_SHUTDOWN_TIMEOUT_SECONDS;

    /**
     * Enum defining the types of thread pools that can be used.
     */
    public enum ThreadPoolType {
        /**
         * Creates threads on demand and reuses idle ones.
         * Suits any number of long-lived actors.
         */
        CACHED,

        /**
         * Uses a fixed thread pool with a specified number of threads.
         * Actors beyond the pool size wait until a running actor finishes.
         */
        FIXED,

        /**
         * Uses a work-stealing pool with the configured parallelism.
         */
        WORK_STEALING
    }

    /**
     * Enum defining the types of workloads that actors can be optimized for.
     */
    public enum WorkloadType {
        /**
         * Many actors doing mostly IO operations.
         */
        IO_BOUND,

        /**
         * Fewer actors doing intensive computation.
         */
        CPU_BOUND,

        /**
         * A mix of IO and CPU operations.
         */
        MIXED
    }

    /**
     * Optimizes the thread pool configuration for a specific workload type.
     *
     * @param workloadType The type of workload to optimize for
     * @return This ThreadPoolFactory instance for method chaining
     */
    public ThreadPoolFactory optimizeFor(WorkloadType workloadType) {
        switch (workloadType) {
            case IO_BOUND:
                return setExecutorType(ThreadPoolType.CACHED);
            case CPU_BOUND:
                return setExecutorType(ThreadPoolType.FIXED)
                        .setFixedPoolSize(Runtime.getRuntime().availableProcessors());
            case MIXED:
                return setExecutorType(ThreadPoolType.WORK_STEALING);
            default:
                throw new IllegalArgumentException("Unknown workload type: " + workloadType);
        }
    }

    /**
     * Creates an executor service based on the current configuration.
     *
     * @param poolName Name prefix for the threads in this pool
     * @return A new executor service
     */
    public ExecutorService createExecutorService(String poolName) {
        switch (executorType) {
            case CACHED:
                return useNamedThreads
                        ? Executors.newCachedThreadPool(createNamedThreadFactory(poolName + "-actor"))
                        : Executors.newCachedThreadPool();
            case FIXED:
                return useNamedThreads
                        ? Executors.newFixedThreadPool(fixedPoolSize, createNamedThreadFactory(poolName + "-worker"))
                        : Executors.newFixedThreadPool(fixedPoolSize);
            case WORK_STEALING:
                return new ForkJoinPool(workStealingParallelism,
                        ForkJoinPool.defaultForkJoinWorkerThreadFactory, null, true);
            default:
                throw new IllegalStateException("Unknown executor type: " + executorType);
        }
    }

    /**
     * Creates a named thread factory for better thread identification in logs and profilers.
     *
     * @param prefix The prefix for thread names
     * @return A thread factory that creates named threads
     */
    private ThreadFactory createNamedThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, prefix + "-" + threadNumber.getAndIncrement());
                thread.setDaemon(daemonThreads);
                return thread;
            }
        };
    }

    // Getters and setters

    public ThreadPoolType getExecutorType() {
        return executorType;
    }

    public ThreadPoolFactory setExecutorType(ThreadPoolType executorType) {
        this.executorType = executorType;
        return this;
    }

    public int getFixedPoolSize() {
        return fixedPoolSize;
    }

    public ThreadPoolFactory setFixedPoolSize(int fixedPoolSize) {
        if (fixedPoolSize < 1) {
            throw new IllegalArgumentException("fixedPoolSize must be positive: " + fixedPoolSize);
        }
        this.fixedPoolSize = fixedPoolSize;
        return this;
    }

    public int getWorkStealingParallelism() {
        return workStealingParallelism;
    }

    public ThreadPoolFactory setWorkStealingParallelism(int workStealingParallelism) {
        if (workStealingParallelism < 1) {
            throw new IllegalArgumentException("workStealingParallelism must be positive: " + workStealingParallelism);
        }
        this.workStealingParallelism = workStealingParallelism;
        return this;
    }

    public boolean isUseNamedThreads() {
        return useNamedThreads;
    }

    public ThreadPoolFactory setUseNamedThreads(boolean useNamedThreads) {
        this.useNamedThreads = useNamedThreads;
        return this;
    }

    public boolean isDaemonThreads() {
        return daemonThreads;
    }

    public ThreadPoolFactory setDaemonThreads(boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }

    public int getActorShutdownTimeoutSeconds() {
        return actorShutdownTimeoutSeconds;
    }

    public ThreadPoolFactory setActorShutdownTimeoutSeconds(int actorShutdownTimeoutSeconds) {
        this.actorShutdownTimeoutSeconds = actorShutdownTimeoutSeconds;
        return this;
    }
}
