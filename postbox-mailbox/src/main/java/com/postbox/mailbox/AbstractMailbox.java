package com.postbox.mailbox;

import com.postbox.NoSenderException;
import com.postbox.Receiver;
import com.postbox.Sender;

import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Both ends of an unbounded multi-producer, single-consumer mailbox.
 *
 * <p>Subclasses supply the queue; this class adds the open/closed state and the blocking
 * {@link #receive()}. Enqueuing never takes the lock except to wake the consumer. The consumer
 * only waits while holding the lock and re-checks the queue before every wait, so a wake-up is
 * never lost.
 *
 * <p>Two one-way transitions end the mailbox:
 * <ul>
 *   <li>{@link #disconnect()}: every ActorRef is gone. Further offers are rejected. Queued
 *       messages are still delivered, then {@link NoSenderException} is reported on every
 *       receive, even if a send racing with the disconnect slipped into the queue.</li>
 *   <li>{@link #close()}: the receiver is gone. Queued messages are never delivered and further
 *       offers are rejected; senders are not told. The queue is left to the garbage collector
 *       because only the consumer thread may drain it.</li>
 * </ul>
 *
 * @param <M> The type of messages
 */
public abstract class AbstractMailbox<M> implements Sender<M>, Receiver<M> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private volatile boolean sendersGone = false;
    private volatile boolean receiverClosed = false;
    // set once NoSenderException has been reported; written only by the consumer
    private volatile boolean terminated = false;

    /**
     * Adds a message to the tail of the queue without blocking.
     */
    protected abstract boolean enqueue(M message);

    /**
     * Removes the head of the queue, or returns null if it is empty.
     */
    protected abstract M dequeue();

    /**
     * Returns the number of queued messages.
     *
     * @return the number of messages
     */
    public abstract int size();

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public boolean offer(M message) {
        Objects.requireNonNull(message, "Message cannot be null");
        if (sendersGone || receiverClosed || !enqueue(message)) {
            return false;
        }
        signalNotEmpty();
        return true;
    }

    @Override
    public M receive() throws NoSenderException, InterruptedException {
        if (terminated) {
            throw new NoSenderException();
        }
        // Fast path: try non-blocking poll first
        M message = receiverClosed ? null : dequeue();
        if (message != null) {
            return message;
        }

        lock.lockInterruptibly();
        try {
            while (true) {
                if (receiverClosed) {
                    throw new NoSenderException("Mailbox receiver has been closed");
                }
                message = dequeue();
                if (message != null) {
                    return message;
                }
                if (sendersGone) {
                    // everything sent before the last ref was released is visible now
                    message = dequeue();
                    if (message != null) {
                        return message;
                    }
                    terminated = true;
                    throw new NoSenderException();
                }
                notEmpty.await();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void disconnect() {
        sendersGone = true;
        signalAll();
    }

    @Override
    public void close() {
        receiverClosed = true;
        signalAll();
    }

    /**
     * @return true once the last ActorRef has been released
     */
    public boolean isDisconnected() {
        return sendersGone;
    }

    /**
     * @return true once the receiver has been closed
     */
    public boolean isClosed() {
        return receiverClosed;
    }

    private void signalNotEmpty() {
        lock.lock();
        try {
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    private void signalAll() {
        lock.lock();
        try {
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
