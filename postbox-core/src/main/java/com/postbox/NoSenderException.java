package com.postbox;

/**
 * Thrown by {@link Receiver#receive()} when the mailbox is empty and every {@link ActorRef}
 * pointing at it has been released. The condition is permanent.
 */
public class NoSenderException extends Exception {

    public NoSenderException() {
        super("No sender remains for this mailbox");
    }

    public NoSenderException(String message) {
        super(message);
    }
}
