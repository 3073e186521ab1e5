package com.postbox.runtime;

import com.postbox.AbstractSpawner;
import com.postbox.Completion;
import com.postbox.ExecutionFailureException;
import com.postbox.Result;
import com.postbox.config.ThreadPoolFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Spawner that runs each actor body as one task on an {@link Executor}.
 *
 * <p>Two flavours:
 * <ul>
 *   <li>{@link #using(Executor)} borrows an executor the caller already runs; closing the spawner
 *       leaves it alone.</li>
 *   <li>{@link #create(ThreadPoolFactory, String)} owns a pool built from the factory; closing the
 *       spawner shuts the pool down and resolves unfinished actors to execution failures.</li>
 * </ul>
 */
public class ExecutorSpawner extends AbstractSpawner implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ExecutorSpawner.class);

    private final Executor executor;
    private final ExecutorService ownedPool;
    private final int shutdownTimeoutSeconds;

    private ExecutorSpawner(Executor executor, ExecutorService ownedPool, int shutdownTimeoutSeconds) {
        this.executor = executor;
        this.ownedPool = ownedPool;
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
    }

    /**
     * Creates a spawner on an executor owned by the caller.
     *
     * @param executor the executor to run actor bodies on
     * @return a new spawner
     */
    public static ExecutorSpawner using(Executor executor) {
        Objects.requireNonNull(executor, "executor cannot be null");
        return new ExecutorSpawner(executor, null, 0);
    }

    /**
     * Creates a spawner that owns a default cached thread pool.
     *
     * @return a new spawner
     */
    public static ExecutorSpawner create() {
        return create(new ThreadPoolFactory(), "postbox");
    }

    /**
     * Creates a spawner that owns a pool built by the given factory.
     *
     * @param threadPoolFactory the pool configuration
     * @param poolName prefix for thread names
     * @return a new spawner
     */
    public static ExecutorSpawner create(ThreadPoolFactory threadPoolFactory, String poolName) {
        Objects.requireNonNull(threadPoolFactory, "threadPoolFactory cannot be null");
        ExecutorService pool = threadPoolFactory.createExecutorService(poolName);
        logger.debug("Created {} pool '{}' for actors", threadPoolFactory.getExecutorType(), poolName);
        return new ExecutorSpawner(pool, pool, threadPoolFactory.getActorShutdownTimeoutSeconds());
    }

    @Override
    public <R> Completion<R> spawn(String name, Callable<R> body) {
        CompletableFuture<Result<R>> future = new CompletableFuture<>();
        ActorTask<R> task = new ActorTask<>(bind(name, body, future), name, future);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            return rejected(name, future, e);
        }
        logger.debug("Spawned actor {}", name);
        return Completion.of(name, future, () -> task.cancel(true));
    }

    /**
     * @return true if this spawner shuts its executor down on {@link #close()}
     */
    public boolean ownsExecutor() {
        return ownedPool != null;
    }

    /**
     * Shuts down the owned pool: waits for running actors up to the configured timeout, then
     * interrupts them. Actors that had not started are resolved to execution failures.
     * Does nothing for a borrowed executor.
     */
    @Override
    public void close() {
        if (ownedPool == null || ownedPool.isShutdown()) {
            return;
        }
        logger.debug("Shutting down actor pool");
        ownedPool.shutdown();
        try {
            if (!ownedPool.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                forceShutdown();
            }
        } catch (InterruptedException e) {
            forceShutdown();
            Thread.currentThread().interrupt();
        }
    }

    private void forceShutdown() {
        List<Runnable> neverStarted = ownedPool.shutdownNow();
        logger.warn("Actor pool did not terminate in {}s, interrupted running actors and dropped {} queued",
                shutdownTimeoutSeconds, neverStarted.size());
        for (Runnable runnable : neverStarted) {
            if (runnable instanceof FutureTask) {
                ((FutureTask<?>) runnable).cancel(false);
            }
        }
    }

    /**
     * Executor task for one actor body. Cancelling it resolves the actor's completion to an
     * execution failure even if the body never started.
     */
    private static final class ActorTask<R> extends FutureTask<Void> {
        private final String name;
        private final CompletableFuture<Result<R>> future;

        ActorTask(Runnable body, String name, CompletableFuture<Result<R>> future) {
            super(body, null);
            this.name = name;
            this.future = future;
        }

        @Override
        protected void done() {
            if (isCancelled()) {
                future.completeExceptionally(new ExecutionFailureException("Actor task was cancelled", name));
            }
        }
    }
}
