package com.postbox.mailbox;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MpscMailboxTest extends MailboxContractTest {

    @Override
    protected AbstractMailbox<String> newMailbox() {
        return new MpscMailbox<>(4);
    }

    @Test
    void testChunkSizeRoundedToPowerOfTwo() {
        assertEquals(128, new MpscMailbox<String>().getChunkSize());
        assertEquals(64, new MpscMailbox<String>(33).getChunkSize());
        assertEquals(2, new MpscMailbox<String>(0).getChunkSize());
        assertEquals(2, new MpscMailbox<String>(-5).getChunkSize());
    }

    @Test
    void testGrowsBeyondInitialChunk() {
        MpscMailbox<String> mailbox = new MpscMailbox<>(2);
        for (int i = 0; i < 10000; i++) {
            assertTrue(mailbox.offer("msg" + i));
        }
        assertEquals(10000, mailbox.size());
    }

    @Test
    void testNextPowerOfTwo() {
        assertEquals(1, MpscMailbox.nextPowerOfTwo(0));
        assertEquals(2, MpscMailbox.nextPowerOfTwo(2));
        assertEquals(4, MpscMailbox.nextPowerOfTwo(3));
        assertEquals(1024, MpscMailbox.nextPowerOfTwo(1000));
    }
}
