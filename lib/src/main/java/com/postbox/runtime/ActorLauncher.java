package com.postbox.runtime;

import com.postbox.ActorBody;
import com.postbox.Actors;
import com.postbox.Launched;
import com.postbox.MailboxFactory;
import com.postbox.Spawner;
import com.postbox.config.MailboxConfig;
import com.postbox.config.ThreadPoolFactory;
import com.postbox.config.ThreadPoolFactory.WorkloadType;
import com.postbox.mailbox.DefaultMailboxFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * A mailbox factory and a spawner bound together, so application code can launch actors
 * without passing both around.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ActorLauncher launcher = ActorLauncher.create()) {
 *     Launched<String, Void> printer = launcher.launch("printer", ctx -> {
 *         while (true) {
 *             System.out.println(ctx.receive());
 *         }
 *     });
 *     printer.ref().tell("hello");
 * }
 * }</pre>
 */
public class ActorLauncher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ActorLauncher.class);

    private final MailboxFactory mailboxes;
    private final Spawner spawner;
    private final ExecutorSpawner ownedSpawner;

    /**
     * Creates a launcher over capabilities owned by the caller. Closing the launcher does not close them.
     *
     * @param mailboxes the mailbox factory
     * @param spawner the spawner
     */
    public ActorLauncher(MailboxFactory mailboxes, Spawner spawner) {
        this(mailboxes, spawner, null);
    }

    private ActorLauncher(MailboxFactory mailboxes, Spawner spawner, ExecutorSpawner ownedSpawner) {
        this.mailboxes = Objects.requireNonNull(mailboxes, "mailboxes cannot be null");
        this.spawner = Objects.requireNonNull(spawner, "spawner cannot be null");
        this.ownedSpawner = ownedSpawner;
    }

    /**
     * Creates a launcher with default mailboxes and its own cached thread pool.
     *
     * @return a new launcher; close it to shut the pool down
     */
    public static ActorLauncher create() {
        ExecutorSpawner spawner = ExecutorSpawner.create();
        return new ActorLauncher(new DefaultMailboxFactory(), spawner, spawner);
    }

    /**
     * Creates a launcher whose mailboxes and pool are tuned for a workload.
     *
     * @param workloadType the expected workload
     * @return a new launcher; close it to shut the pool down
     */
    public static ActorLauncher create(WorkloadType workloadType) {
        ThreadPoolFactory threadPoolFactory = new ThreadPoolFactory().optimizeFor(workloadType);
        ExecutorSpawner spawner = ExecutorSpawner.create(threadPoolFactory, "postbox-" + workloadType.name().toLowerCase());
        logger.debug("Created launcher for {} workload", workloadType);
        return new ActorLauncher(new DefaultMailboxFactory(workloadType, new MailboxConfig()), spawner, spawner);
    }

    public <M, R> Launched<M, R> launch(ActorBody<M, R> body) {
        return Actors.launch(mailboxes, spawner, body);
    }

    public <M, R> Launched<M, R> launch(String name, ActorBody<M, R> body) {
        return Actors.launch(mailboxes, spawner, name, body);
    }

    public MailboxFactory mailboxes() {
        return mailboxes;
    }

    public Spawner spawner() {
        return spawner;
    }

    /**
     * Shuts down the spawner if this launcher created it.
     */
    @Override
    public void close() {
        if (ownedSpawner != null) {
            ownedSpawner.close();
        }
    }
}
