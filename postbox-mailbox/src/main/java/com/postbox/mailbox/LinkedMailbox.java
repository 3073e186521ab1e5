package com.postbox.mailbox;

import java.util.concurrent.LinkedBlockingQueue;

/**
 * Mailbox backed by an unbounded {@link LinkedBlockingQueue}.
 *
 * Recommended for:
 * - General-purpose actor mailboxes
 * - Actors with few senders or bursty traffic
 * - IO-bound and mixed workloads
 *
 * @param <M> The type of messages
 */
public class LinkedMailbox<M> extends AbstractMailbox<M> {

    private final LinkedBlockingQueue<M> queue = new LinkedBlockingQueue<>();

    @Override
    protected boolean enqueue(M message) {
        return queue.offer(message);
    }

    @Override
    protected M dequeue() {
        return queue.poll();
    }

    @Override
    public int size() {
        return queue.size();
    }
}
