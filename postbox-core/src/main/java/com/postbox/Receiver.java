package com.postbox;

/**
 * Read end of one actor's mailbox.
 *
 * <p>A receiver has a single reader: at most one thread may be blocked in {@link #receive()}
 * at a time. Messages come out in the order they were enqueued across all clones of the
 * {@link ActorRef} bound to the same mailbox.
 *
 * @param <M> The type of messages stored in the mailbox
 */
public interface Receiver<M> extends AutoCloseable {

    /**
     * Retrieves and removes the next message, waiting if necessary until one arrives.
     * Queued messages are always drained before closure is reported, and once closure has been
     * reported every further call reports it again without blocking.
     *
     * @return the next message
     * @throws NoSenderException if the queue is empty and no ActorRef to this mailbox remains
     * @throws InterruptedException if interrupted while waiting
     */
    M receive() throws NoSenderException, InterruptedException;

    /**
     * Releases the read end. Queued messages are no longer delivered and further sends are dropped silently;
     * senders are not notified.
     */
    @Override
    void close();
}
