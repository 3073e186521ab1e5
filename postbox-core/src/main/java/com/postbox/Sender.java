package com.postbox;

/**
 * Write end of a mailbox, implemented by mailbox backends.
 * Application code never sees a Sender directly; it is wrapped by {@link ActorRef#create(Sender)},
 * which shares it among all clones of the reference.
 *
 * @param <M> The type of messages accepted
 */
public interface Sender<M> {

    /**
     * Enqueues a message without blocking.
     *
     * @param message the message, never null
     * @return true if the message was enqueued, false if the mailbox no longer accepts messages
     */
    boolean offer(M message);

    /**
     * Called exactly once, when the last {@link ActorRef} for this mailbox has been released.
     * After this call {@link #offer(Object)} returns false, and the receiving side reports
     * {@link NoSenderException} once its queue is drained. Once reported, that outcome is final.
     */
    void disconnect();
}
