package com.postbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Brings actors into existence.
 *
 * <p>Launching binds three things: a {@link MailboxFactory} for the actor's inbox, a
 * {@link Spawner} to run it, and the {@link ActorBody} itself. Launches are independent of
 * each other: there is no registry, no lookup by name and no supervision.
 *
 * <pre>{@code
 * Launched<String, Void> greeter = Actors.launch(mailboxes, spawner, ctx -> {
 *     while (true) {
 *         System.out.println("Hello " + ctx.receive());
 *     }
 * });
 * greeter.ref().tell("Fred");
 * }</pre>
 */
public final class Actors {

    private static final Logger logger = LoggerFactory.getLogger(Actors.class);
    private static final AtomicLong ACTOR_COUNTER = new AtomicLong();

    private Actors() {
    }

    /**
     * Launches an actor with a generated name.
     *
     * @see #launch(MailboxFactory, Spawner, String, ActorBody)
     */
    public static <M, R> Launched<M, R> launch(MailboxFactory mailboxes, Spawner spawner, ActorBody<M, R> body) {
        return launch(mailboxes, spawner, "actor-" + ACTOR_COUNTER.incrementAndGet(), body);
    }

    /**
     * Launches an actor: creates its mailbox, wraps the read end into a {@link Context}, binds the
     * body to that context and hands the result to the spawner.
     * The read end is closed when the body finishes, after which messages to the actor are dropped.
     *
     * @param mailboxes creates the actor's mailbox
     * @param spawner runs the actor's body
     * @param name the actor name, used for logs and thread names
     * @param body the actor's logic
     * @param <M> The message type
     * @param <R> The body's value type
     * @return the actor's address and completion handle
     */
    public static <M, R> Launched<M, R> launch(MailboxFactory mailboxes, Spawner spawner, String name,
                                               ActorBody<M, R> body) {
        Objects.requireNonNull(mailboxes, "mailboxes cannot be null");
        Objects.requireNonNull(spawner, "spawner cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(body, "body cannot be null");

        MailboxPair<M> mailbox = mailboxes.makeMailbox();
        Context<M> context = new Context<>(name, mailbox.receiver());
        Callable<R> task = () -> {
            try {
                return body.run(context);
            } finally {
                context.close();
                logger.debug("Actor {} finished", name);
            }
        };
        Completion<R> completion = spawner.spawn(name, task);
        // covers bodies that never ran: rejected or aborted before start
        completion.toFuture().whenComplete((result, error) -> context.close());
        logger.debug("Launched actor {}", name);
        return new Launched<>(mailbox.ref(), completion);
    }
}
