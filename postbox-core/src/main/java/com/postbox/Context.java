package com.postbox;

import java.util.Objects;

/**
 * Handle given to a running actor body. Owned by the task executing that body and
 * not to be shared with other threads.
 *
 * @param <M> The type of messages the actor receives
 */
public final class Context<M> {

    private final String name;
    private final Receiver<M> receiver;

    Context(String name, Receiver<M> receiver) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.receiver = Objects.requireNonNull(receiver, "receiver cannot be null");
    }

    /**
     * Waits for the next message in this actor's mailbox.
     *
     * @return the next message
     * @throws NoSenderException if the mailbox is drained and no ActorRef to it remains
     * @throws InterruptedException if the hosting task is interrupted while waiting
     */
    public M receive() throws NoSenderException, InterruptedException {
        return receiver.receive();
    }

    /**
     * @return the name this actor was launched with
     */
    public String name() {
        return name;
    }

    void close() {
        receiver.close();
    }

    @Override
    public String toString() {
        return "Context[" + name + "]";
    }
}
