package com.postbox;

/**
 * What {@link Actors#launch} hands back: the address of the new actor and the handle on its outcome.
 *
 * @param ref the first reference to the actor's mailbox; close it (and all copies) to let the actor finish
 * @param completion resolves when the actor body finishes
 * @param <M> The message type
 * @param <R> The body's value type
 */
public record Launched<M, R>(ActorRef<M> ref, Completion<R> completion) {
}
