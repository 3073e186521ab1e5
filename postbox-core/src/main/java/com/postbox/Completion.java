package com.postbox;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Completion handle for one actor body execution.
 *
 * <p>Resolves to a {@link Result} carrying either the body's value or the exception the body
 * threw. If the hosting task could not run the body to completion, {@link #await()} throws
 * {@link ExecutionFailureException} instead, so "the actor logic failed" and "the actor never got
 * to finish its logic" are never confused.
 *
 * <p>Usage:
 * <pre>{@code
 * Launched<String, Integer> actor = Actors.launch(mailboxes, spawner, ctx -> ctx.receive().length());
 * actor.ref().tell("hello");
 * actor.ref().close();
 * int length = actor.completion().await().getOrThrow();
 * }</pre>
 *
 * @param <R> The type of value returned by the body
 */
public final class Completion<R> {

    private final String actorName;
    private final CompletableFuture<Result<R>> future;
    private final Runnable abortAction;

    private Completion(String actorName, CompletableFuture<Result<R>> future, Runnable abortAction) {
        this.actorName = actorName;
        this.future = future;
        this.abortAction = abortAction;
    }

    /**
     * Creates a completion handle backed by the given future.
     * The future must complete normally with the body's {@link Result}, or exceptionally with an
     * {@link ExecutionFailureException}.
     *
     * @param actorName the name of the actor, used in failure messages
     * @param future the future the spawner completes
     * @param abortAction stops the hosting task; run at most once, by {@link #abort()}
     * @param <R> The body's value type
     * @return a new completion handle
     */
    public static <R> Completion<R> of(String actorName, CompletableFuture<Result<R>> future, Runnable abortAction) {
        Objects.requireNonNull(future, "future cannot be null");
        Objects.requireNonNull(abortAction, "abortAction cannot be null");
        return new Completion<>(actorName, future, abortAction);
    }

    /**
     * Waits for the body to finish.
     *
     * @return the body's outcome
     * @throws ExecutionFailureException if the hosting task could not run the body to completion
     * @throws InterruptedException if interrupted while waiting
     */
    public Result<R> await() throws ExecutionFailureException, InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            throw new ExecutionFailureException("Actor task was cancelled", actorName, e);
        }
    }

    /**
     * Waits at most the given time for the body to finish.
     *
     * @param timeout the maximum time to wait
     * @return the body's outcome
     * @throws ExecutionFailureException if the hosting task could not run the body to completion
     * @throws InterruptedException if interrupted while waiting
     * @throws TimeoutException if the body did not finish in time
     */
    public Result<R> await(Duration timeout)
            throws ExecutionFailureException, InterruptedException, TimeoutException {
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            throw new ExecutionFailureException("Actor task was cancelled", actorName, e);
        }
    }

    /**
     * Aborts the hosting task. If the body has not finished yet, the handle resolves to an
     * execution failure and the task is cancelled (interrupting it if it is running).
     *
     * @return true if this call aborted the task, false if it had already finished
     */
    public boolean abort() {
        boolean aborted = future.completeExceptionally(
                new ExecutionFailureException("Actor task was aborted", actorName));
        if (aborted) {
            abortAction.run();
        }
        return aborted;
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * Returns a future view of this handle. Cancelling the returned future does not affect
     * the actor; use {@link #abort()} for that.
     *
     * @return a copy of the underlying future
     */
    public CompletableFuture<Result<R>> toFuture() {
        return future.copy();
    }

    public String actorName() {
        return actorName;
    }

    private ExecutionFailureException unwrap(Throwable cause) {
        if (cause instanceof ExecutionFailureException) {
            return (ExecutionFailureException) cause;
        }
        return new ExecutionFailureException("Actor task failed", actorName, cause);
    }
}
