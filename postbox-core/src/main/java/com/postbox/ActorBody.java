package com.postbox;

/**
 * The logic of an actor: a sequential computation driven by {@link Context#receive()}.
 *
 * <p>Example:
 * <pre>{@code
 * ActorBody<String, Integer> counter = ctx -> {
 *     int count = 0;
 *     while (true) {
 *         try {
 *             ctx.receive();
 *             count++;
 *         } catch (NoSenderException e) {
 *             return count;
 *         }
 *     }
 * };
 * }</pre>
 *
 * @param <M> The type of messages the actor receives
 * @param <R> The type of value the body produces when it finishes
 */
@FunctionalInterface
public interface ActorBody<M, R> {

    /**
     * Runs the actor until it decides to finish.
     *
     * @param context the actor's private context
     * @return the actor's result
     * @throws Exception to report a failure of the actor's own logic
     */
    R run(Context<M> context) throws Exception;
}
