package com.postbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.lang.ref.Reference;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Address of an actor's mailbox, and the only way to send to it.
 *
 * <p>Every ActorRef is one handle on a mailbox's write end. {@link #copy()} creates another
 * handle on the same mailbox; {@link #close()} releases this one. The mailbox stays open for
 * senders while at least one handle is live, and closes for good when the last handle is
 * released. A handle that becomes unreachable without being closed is released by a
 * {@link Cleaner}, so forgetting to close only delays closure.
 *
 * <p>Sending is fire-and-forget: {@link #tell(Object)} never blocks and never reports whether
 * the message was delivered. Messages sent to a mailbox whose receiver has gone are dropped.
 *
 * @param <M> The type of messages this actor accepts
 */
public final class ActorRef<M> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ActorRef.class);
    private static final Cleaner CLEANER = Cleaner.create();

    private final SenderGroup<M> group;
    private final Release release;
    private final Cleaner.Cleanable cleanable;

    private ActorRef(SenderGroup<M> group) {
        this.group = group;
        this.release = new Release(group);
        this.cleanable = CLEANER.register(this, release);
    }

    /**
     * Wraps a backend write end into the first handle of a new mailbox.
     * Intended for {@link MailboxFactory} implementations.
     *
     * @param sender the backend write end
     * @param <M> The message type
     * @return the first live handle
     */
    public static <M> ActorRef<M> create(Sender<M> sender) {
        Objects.requireNonNull(sender, "sender cannot be null");
        return new ActorRef<>(new SenderGroup<>(sender));
    }

    /**
     * Sends a message to the actor. If the mailbox no longer accepts messages, or this handle
     * has already been closed, the message is silently dropped.
     *
     * @param message the message to send
     */
    public void tell(M message) {
        Objects.requireNonNull(message, "Message cannot be null");
        try {
            if (release.released.get()) {
                logger.trace("Dropping message sent through a closed ActorRef: {}", message);
                return;
            }
            if (!group.sender.offer(message)) {
                logger.trace("Dropping message for a mailbox that no longer accepts messages: {}", message);
            }
        } finally {
            // keeps the cleaner from releasing this handle while the offer is in flight
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Creates a second handle on the same mailbox. The copy must be closed independently.
     *
     * @return a new live handle
     * @throws IllegalStateException if this handle has already been closed
     */
    public ActorRef<M> copy() {
        if (release.released.get() || !group.retain()) {
            throw new IllegalStateException("Cannot copy a closed ActorRef");
        }
        return new ActorRef<>(group);
    }

    /**
     * Releases this handle. Closing an already closed handle has no effect.
     */
    @Override
    public void close() {
        cleanable.clean();
    }

    /**
     * Returns whether this handle is live and its mailbox still has live handles.
     * This is a snapshot for diagnostics: a true result does not guarantee the next message
     * will be delivered, since the receiver may go away at any time without notice.
     *
     * @return true if this handle has not been closed
     */
    public boolean isOpen() {
        return !release.released.get() && group.handles.get() > 0;
    }

    /**
     * Two handles are equal when they address the same mailbox.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActorRef)) return false;
        return group == ((ActorRef<?>) o).group;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(group);
    }

    @Override
    public String toString() {
        return "ActorRef@" + Integer.toHexString(hashCode()) + (isOpen() ? "" : "[closed]");
    }

    /**
     * Shared state of all handles on one mailbox: the backend write end and the live handle count.
     */
    private static final class SenderGroup<M> {
        private final Sender<M> sender;
        private final AtomicInteger handles = new AtomicInteger(1);

        SenderGroup(Sender<M> sender) {
            this.sender = sender;
        }

        boolean retain() {
            while (true) {
                int current = handles.get();
                if (current == 0) {
                    return false;
                }
                if (handles.compareAndSet(current, current + 1)) {
                    return true;
                }
            }
        }

        void release() {
            if (handles.decrementAndGet() == 0) {
                logger.debug("Last ActorRef released, disconnecting mailbox");
                sender.disconnect();
            }
        }
    }

    /**
     * Cleaning action for one handle. Must not reference the ActorRef itself.
     */
    private static final class Release implements Runnable {
        private final SenderGroup<?> group;
        private final AtomicBoolean released = new AtomicBoolean(false);

        Release(SenderGroup<?> group) {
            this.group = group;
        }

        @Override
        public void run() {
            if (released.compareAndSet(false, true)) {
                group.release();
            }
        }
    }
}
