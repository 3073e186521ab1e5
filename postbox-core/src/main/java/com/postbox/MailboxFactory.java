package com.postbox;

/**
 * Creates mailboxes. This is the only way a mailbox comes into existence.
 *
 * <p>Each call yields a new, empty, open and unbounded queue that shares nothing with any
 * other mailbox created by the same factory. Construction cannot fail.
 */
public interface MailboxFactory {

    /**
     * Creates a new mailbox.
     *
     * @param <M> The message type
     * @return the write end (as an ActorRef) and read end of the new mailbox
     */
    <M> MailboxPair<M> makeMailbox();
}
