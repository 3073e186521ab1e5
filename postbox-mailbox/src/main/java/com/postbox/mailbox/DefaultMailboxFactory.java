package com.postbox.mailbox;

import com.postbox.MailboxFactory;
import com.postbox.MailboxPair;
import com.postbox.config.MailboxConfig;
import com.postbox.config.ThreadPoolFactory.WorkloadType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Mailbox factory that picks a backend from a workload hint.
 *
 * Backend per workload:
 * - IO_BOUND: LinkedMailbox (few messages per actor, mostly waiting)
 * - CPU_BOUND: MpscMailbox (lock-free enqueue for high-throughput senders)
 * - MIXED/no hint: LinkedMailbox
 */
public class DefaultMailboxFactory implements MailboxFactory {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMailboxFactory.class);

    private final Map<WorkloadType, MailboxFactory> strategies;
    private final MailboxFactory defaultStrategy;
    private final WorkloadType workloadTypeHint;

    public DefaultMailboxFactory() {
        this(null, new MailboxConfig());
    }

    public DefaultMailboxFactory(WorkloadType workloadTypeHint) {
        this(workloadTypeHint, new MailboxConfig());
    }

    public DefaultMailboxFactory(WorkloadType workloadTypeHint, MailboxConfig config) {
        MailboxConfig effectiveConfig = (config != null) ? config : new MailboxConfig();
        this.defaultStrategy = new LinkedMailboxFactory();
        this.strategies = new EnumMap<>(WorkloadType.class);
        this.strategies.put(WorkloadType.IO_BOUND, defaultStrategy);
        this.strategies.put(WorkloadType.CPU_BOUND, new MpscMailboxFactory(effectiveConfig));
        this.strategies.put(WorkloadType.MIXED, defaultStrategy);
        this.workloadTypeHint = workloadTypeHint;
    }

    @Override
    public <M> MailboxPair<M> makeMailbox() {
        MailboxFactory strategy = (workloadTypeHint != null)
                ? strategies.getOrDefault(workloadTypeHint, defaultStrategy)
                : defaultStrategy;
        logger.debug("DefaultMailboxFactory creating mailbox - workloadHint: {}", workloadTypeHint);
        return strategy.makeMailbox();
    }

    public WorkloadType getWorkloadTypeHint() {
        return workloadTypeHint;
    }
}
