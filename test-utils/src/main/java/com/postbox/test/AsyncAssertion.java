package com.postbox.test;

import com.postbox.Completion;
import com.postbox.ExecutionFailureException;
import com.postbox.Result;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Assertions for waiting on actors without {@code Thread.sleep()}.
 *
 * <p>Usage:
 * <pre>{@code
 * Result<Integer> result = AsyncAssertion.awaitResult(actor.completion(), Duration.ofSeconds(2));
 * ExecutionFailureException failure = AsyncAssertion.awaitExecutionFailure(aborted.completion(), Duration.ofSeconds(2));
 * AsyncAssertion.eventually(() -> !ref.isOpen(), Duration.ofSeconds(1));
 * }</pre>
 */
public final class AsyncAssertion {

    private static final long DEFAULT_POLL_INTERVAL_MS = 20;

    private AsyncAssertion() {
    }

    /**
     * Waits for the actor body to finish and returns its outcome.
     *
     * @throws AssertionError if the body does not finish in time or its task failed to run it
     */
    public static <R> Result<R> awaitResult(Completion<R> completion, Duration timeout) {
        Objects.requireNonNull(completion, "completion cannot be null");
        try {
            return completion.await(timeout);
        } catch (TimeoutException e) {
            throw new AssertionError("Actor " + completion.actorName() + " did not finish within " + timeout);
        } catch (ExecutionFailureException e) {
            throw new AssertionError("Actor " + completion.actorName() + " failed to execute: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting for actor " + completion.actorName(), e);
        }
    }

    /**
     * Waits for the actor's task to end in an execution failure and returns it.
     *
     * @throws AssertionError if the body finishes with a result instead, or nothing happens in time
     */
    public static ExecutionFailureException awaitExecutionFailure(Completion<?> completion, Duration timeout) {
        Objects.requireNonNull(completion, "completion cannot be null");
        try {
            Result<?> result = completion.await(timeout);
            throw new AssertionError("Expected an execution failure from actor " + completion.actorName()
                    + " but its body finished with " + result);
        } catch (ExecutionFailureException e) {
            return e;
        } catch (TimeoutException e) {
            throw new AssertionError("Actor " + completion.actorName() + " did not finish within " + timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting for actor " + completion.actorName(), e);
        }
    }

    /**
     * Waits until the condition becomes true or timeout is reached.
     *
     * @throws AssertionError if the condition doesn't become true within timeout
     */
    public static void eventually(BooleanSupplier condition, Duration timeout) {
        Objects.requireNonNull(condition, "condition cannot be null");
        long endTime = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > endTime) {
                throw new AssertionError("Condition did not become true within " + timeout);
            }
            try {
                Thread.sleep(DEFAULT_POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting for condition", e);
            }
        }
    }
}
