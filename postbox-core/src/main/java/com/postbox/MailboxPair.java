package com.postbox;

import java.util.Objects;

/**
 * The two ends of a freshly created mailbox.
 *
 * @param ref the first reference bound to the write end
 * @param receiver the read end
 * @param <M> The message type
 */
public record MailboxPair<M>(ActorRef<M> ref, Receiver<M> receiver) {

    public MailboxPair {
        Objects.requireNonNull(ref, "ref cannot be null");
        Objects.requireNonNull(receiver, "receiver cannot be null");
    }
}
