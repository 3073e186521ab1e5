package com.postbox;

import java.util.concurrent.Callable;

/**
 * Runs actor bodies as independent concurrent activities.
 *
 * <p>Implementations start the body without the caller having to drive it and report its
 * outcome through the returned {@link Completion}. A body that throws an {@link Exception}
 * has failed on its own terms and resolves to {@link Result.Failure}; anything that stops the
 * task from finishing the body (abort, interruption, rejection, an {@link Error}) resolves to an
 * {@link ExecutionFailureException}. {@link AbstractSpawner} implements that classification.
 */
public interface Spawner {

    /**
     * Starts running the body.
     *
     * @param name the actor name, used for thread names and logs
     * @param body the computation, already bound to its {@link Context}
     * @param <R> The body's value type
     * @return the completion handle for this execution
     */
    <R> Completion<R> spawn(String name, Callable<R> body);
}
