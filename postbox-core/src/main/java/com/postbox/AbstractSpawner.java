package com.postbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for spawners. Subclasses decide where a body runs; this class decides how its
 * outcome is reported.
 */
public abstract class AbstractSpawner implements Spawner {

    private static final Logger logger = LoggerFactory.getLogger(AbstractSpawner.class);

    /**
     * Wraps a body into a task that completes the given future when run.
     * A task whose future is already complete (for example after an abort) does not run the body.
     *
     * @param name the actor name
     * @param body the body to run
     * @param future completed with the body's outcome
     * @param <R> The body's value type
     * @return a task suitable for handing to an executor
     */
    protected <R> Runnable bind(String name, Callable<R> body, CompletableFuture<Result<R>> future) {
        return () -> {
            if (future.isDone()) {
                logger.debug("Actor {} was aborted before it started", name);
                return;
            }
            try {
                R value = body.call();
                future.complete(Result.success(value));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                if (future.completeExceptionally(
                        new ExecutionFailureException("Actor task was interrupted", name, e))) {
                    logger.warn("Actor {} was interrupted before its body finished", name);
                }
            } catch (Exception e) {
                logger.debug("Actor {} body failed: {}", name, e.toString());
                future.complete(Result.failure(e));
            } catch (Error e) {
                logger.warn("Actor {} task died", name, e);
                future.completeExceptionally(new ExecutionFailureException("Actor task died", name, e));
            }
        };
    }

    /**
     * Resolves a future to an execution failure because the task could not be scheduled.
     *
     * @return a completion handle that is already done
     */
    protected <R> Completion<R> rejected(String name, CompletableFuture<Result<R>> future, Throwable cause) {
        logger.warn("Actor {} could not be scheduled: {}", name, cause.toString());
        future.completeExceptionally(new ExecutionFailureException("Actor task was rejected", name, cause));
        return Completion.of(name, future, () -> { });
    }
}
