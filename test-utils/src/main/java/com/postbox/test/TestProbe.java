package com.postbox.test;

import com.postbox.ActorRef;
import com.postbox.Actors;
import com.postbox.Completion;
import com.postbox.Launched;
import com.postbox.MailboxFactory;
import com.postbox.NoSenderException;
import com.postbox.Spawner;
import com.postbox.mailbox.LinkedMailboxFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An actor that records every message it receives, for asserting on what other actors send.
 *
 * <p>Usage:
 * <pre>{@code
 * TestProbe<String> probe = TestProbe.create(new ThreadSpawner());
 * greeter.tell(new Greet("Fred", probe.ref().copy()));
 * assertEquals("Hello Fred!", probe.expectMessage(Duration.ofSeconds(1)));
 * }</pre>
 *
 * <p>The probe runs until every ActorRef to it is closed; its completion then resolves to the
 * number of messages it received.
 *
 * @param <T> the message type
 */
public class TestProbe<T> implements AutoCloseable {

    private static final AtomicInteger PROBE_COUNTER = new AtomicInteger();

    private final ActorRef<T> ref;
    private final Completion<Integer> completion;
    private final BlockingQueue<T> receivedMessages;

    private TestProbe(ActorRef<T> ref, Completion<Integer> completion, BlockingQueue<T> receivedMessages) {
        this.ref = ref;
        this.completion = completion;
        this.receivedMessages = receivedMessages;
    }

    /**
     * Creates a probe with a linked mailbox.
     *
     * @param spawner runs the probe; must run it concurrently with the test
     * @param <T> the message type
     * @return a new TestProbe
     */
    public static <T> TestProbe<T> create(Spawner spawner) {
        return create(new LinkedMailboxFactory(), spawner, "probe-" + PROBE_COUNTER.incrementAndGet());
    }

    /**
     * Creates a probe with the given mailbox factory and name.
     *
     * @param mailboxes creates the probe's mailbox
     * @param spawner runs the probe; must run it concurrently with the test
     * @param name the probe actor's name
     * @param <T> the message type
     * @return a new TestProbe
     */
    public static <T> TestProbe<T> create(MailboxFactory mailboxes, Spawner spawner, String name) {
        BlockingQueue<T> queue = new LinkedBlockingQueue<>();
        Launched<T, Integer> launched = Actors.launch(mailboxes, spawner, name, ctx -> {
            int count = 0;
            while (true) {
                T message;
                try {
                    message = ctx.receive();
                } catch (NoSenderException e) {
                    return count;
                }
                queue.offer(message);
                count++;
            }
        });
        return new TestProbe<>(launched.ref(), launched.completion(), queue);
    }

    /**
     * Gets the probe's own reference. Hand out {@code ref().copy()} so the probe's reference
     * stays usable after the receiver closes its copy.
     *
     * @return the probe's ActorRef
     */
    public ActorRef<T> ref() {
        return ref;
    }

    /**
     * Expects a message within the given timeout.
     *
     * @param timeout the maximum time to wait
     * @return the received message
     * @throws AssertionError if no message is received within the timeout
     */
    public T expectMessage(Duration timeout) {
        try {
            T message = receivedMessages.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (message == null) {
                throw new AssertionError("Expected message within " + timeout + " but none received");
            }
            return message;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting for message", e);
        }
    }

    /**
     * Expects a specific message within the given timeout.
     *
     * @throws AssertionError if no message arrives or it differs from the expected one
     */
    public T expectMessage(T expected, Duration timeout) {
        T message = expectMessage(timeout);
        if (!expected.equals(message)) {
            throw new AssertionError("Expected message " + expected + " but received " + message);
        }
        return message;
    }

    /**
     * Asserts that no message arrives within the given duration.
     *
     * @throws AssertionError if a message is received
     */
    public void expectNoMessage(Duration duration) {
        try {
            T message = receivedMessages.poll(duration.toMillis(), TimeUnit.MILLISECONDS);
            if (message != null) {
                throw new AssertionError("Expected no message but received: " + message);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting", e);
        }
    }

    /**
     * Removes and returns the messages received so far without waiting.
     */
    public List<T> drain() {
        List<T> messages = new ArrayList<>();
        receivedMessages.drainTo(messages);
        return messages;
    }

    /**
     * @return resolves to the number of messages received, once every reference to the probe is closed
     */
    public Completion<Integer> completion() {
        return completion;
    }

    /**
     * Closes the probe's own reference.
     */
    @Override
    public void close() {
        ref.close();
    }
}
