package com.postbox.mailbox;

import com.postbox.ActorRef;
import com.postbox.MailboxFactory;
import com.postbox.MailboxPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates {@link LinkedMailbox} mailboxes.
 */
public class LinkedMailboxFactory implements MailboxFactory {
    private static final Logger logger = LoggerFactory.getLogger(LinkedMailboxFactory.class);

    @Override
    public <M> MailboxPair<M> makeMailbox() {
        LinkedMailbox<M> mailbox = new LinkedMailbox<>();
        logger.debug("Created LinkedMailbox");
        return new MailboxPair<>(ActorRef.create(mailbox), mailbox);
    }
}
