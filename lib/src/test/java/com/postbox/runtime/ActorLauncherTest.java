package com.postbox.runtime;

import com.postbox.ActorRef;
import com.postbox.Launched;
import com.postbox.NoSenderException;
import com.postbox.Result;
import com.postbox.config.ThreadPoolFactory.WorkloadType;
import com.postbox.mailbox.LinkedMailboxFactory;
import com.postbox.test.AsyncAssertion;
import com.postbox.test.ManualSpawner;
import com.postbox.test.TestProbe;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End to end actor lifecycles on a real pool.
 */
@Timeout(20)
class ActorLauncherTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private ActorLauncher launcher;

    @BeforeEach
    void setUp() {
        launcher = ActorLauncher.create();
    }

    @AfterEach
    void tearDown() {
        launcher.close();
    }

    @Test
    void testDoublerReturnsValue() {
        Launched<Integer, Integer> doubler = launcher.launch("doubler", ctx -> ctx.receive() * 2);

        doubler.ref().tell(21);

        assertEquals(42, AsyncAssertion.awaitResult(doubler.completion(), TIMEOUT).getOrThrow());
    }

    @Test
    void testClosingOnlyRefEndsActorWithNoSender() {
        Launched<String, String> actor = launcher.launch(ctx -> ctx.receive());

        actor.ref().close();

        Result<String> result = AsyncAssertion.awaitResult(actor.completion(), TIMEOUT);
        assertTrue(result.failedWith(NoSenderException.class));
    }

    @Test
    void testNestedActorsReplyThroughCarriedRef() {
        // outer receives a name, launches an inner greeter and forwards the request with its own reply ref
        Launched<String, String> outer = launcher.launch("outer", ctx -> {
            String name = ctx.receive();
            Launched<String, String> reply = launcher.launch("reply", replyCtx -> replyCtx.receive());
            Launched<ActorRef<String>, Void> inner = launcher.launch("inner", innerCtx -> {
                try (ActorRef<String> replyTo = innerCtx.receive()) {
                    replyTo.tell("Hello " + name + "!");
                }
                return null;
            });
            try (ActorRef<ActorRef<String>> innerRef = inner.ref(); ActorRef<String> replyRef = reply.ref()) {
                innerRef.tell(replyRef.copy());
                return reply.completion().await(TIMEOUT).getOrThrow();
            }
        });

        outer.ref().tell("Fred");

        assertEquals("Hello Fred!", AsyncAssertion.awaitResult(outer.completion(), TIMEOUT).getOrThrow());
    }

    @Test
    void testActorsDoNotSeeEachOthersMessages() {
        try (TestProbe<String> first = TestProbe.create(launcher.spawner());
             TestProbe<String> second = TestProbe.create(launcher.spawner())) {
            first.ref().tell("for first");
            second.ref().tell("for second");

            first.expectMessage("for first", TIMEOUT);
            second.expectMessage("for second", TIMEOUT);
            first.expectNoMessage(Duration.ofMillis(100));
            second.expectNoMessage(Duration.ofMillis(100));
        }
    }

    @Test
    void testActorProcessesMessagesFromManyClonesInOrder() {
        Launched<Integer, List<Integer>> collector = launcher.launch("collector", ctx -> {
            List<Integer> seen = new ArrayList<>();
            while (true) {
                try {
                    seen.add(ctx.receive());
                } catch (NoSenderException e) {
                    return seen;
                }
            }
        });
        ActorRef<Integer> copy = collector.ref().copy();

        for (int i = 0; i < 100; i++) {
            (i % 2 == 0 ? collector.ref() : copy).tell(i);
        }
        collector.ref().close();
        copy.close();

        List<Integer> seen = AsyncAssertion.awaitResult(collector.completion(), TIMEOUT).getOrThrow();
        assertEquals(100, seen.size());
        for (int i = 0; i < 100; i++) {
            assertEquals(i, seen.get(i));
        }
    }

    @Test
    void testWorkloadTunedLauncher() {
        try (ActorLauncher cpu = ActorLauncher.create(WorkloadType.CPU_BOUND)) {
            Launched<String, String> thread = cpu.launch(ctx -> Thread.currentThread().getName());

            String name = AsyncAssertion.awaitResult(thread.completion(), TIMEOUT).getOrThrow();
            assertTrue(name.startsWith("postbox-cpu_bound-worker-"));
        }
    }

    @Test
    void testBorrowedSpawnerOutlivesLauncher() {
        ManualSpawner spawner = new ManualSpawner();
        ActorLauncher borrowed = new ActorLauncher(new LinkedMailboxFactory(), spawner);
        Launched<String, Integer> actor = borrowed.launch("len", ctx -> ctx.receive().length());

        borrowed.close();
        actor.ref().tell("hello");
        spawner.runAll();

        assertSame(spawner, borrowed.spawner());
        assertEquals(5, AsyncAssertion.awaitResult(actor.completion(), TIMEOUT).getOrThrow());
    }
}
