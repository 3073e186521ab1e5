package com.postbox.mailbox;

import com.postbox.ActorRef;
import com.postbox.MailboxFactory;
import com.postbox.MailboxPair;
import com.postbox.config.MailboxConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Creates {@link MpscMailbox} mailboxes with the chunk size taken from a {@link MailboxConfig}.
 */
public class MpscMailboxFactory implements MailboxFactory {
    private static final Logger logger = LoggerFactory.getLogger(MpscMailboxFactory.class);

    private final MailboxConfig config;

    public MpscMailboxFactory() {
        this(new MailboxConfig());
    }

    public MpscMailboxFactory(MailboxConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    @Override
    public <M> MailboxPair<M> makeMailbox() {
        MpscMailbox<M> mailbox = new MpscMailbox<>(config.getInitialCapacity());
        logger.debug("Created MpscMailbox with initial chunk size: {}", mailbox.getChunkSize());
        return new MailboxPair<>(ActorRef.create(mailbox), mailbox);
    }
}
