package com.postbox.mailbox;

import org.jctools.queues.MpscUnboundedArrayQueue;

/**
 * Mailbox backed by a JCTools MPSC (Multi-Producer Single-Consumer) queue.
 *
 * This implementation provides:
 * - Lock-free message enqueuing
 * - Chunked array storage with low allocation overhead
 *
 * Recommended for:
 * - High-throughput actors with many senders
 * - CPU-bound workloads
 *
 * Trade-offs:
 * - Uses more memory than LinkedMailbox when mostly empty (array-based with chunking)
 * - Only one thread may dequeue, which the single-reader rule of receive() already guarantees
 *
 * @param <M> The type of messages
 */
public class MpscMailbox<M> extends AbstractMailbox<M> {

    private final MpscUnboundedArrayQueue<M> queue;
    private final int chunkSize;

    /**
     * Creates an MPSC mailbox with default initial chunk size (128).
     */
    public MpscMailbox() {
        this(128);
    }

    /**
     * Creates an MPSC mailbox with the specified initial chunk size.
     * The mailbox is unbounded; the chunk size is rounded up to a power of two, minimum 2.
     *
     * @param initialCapacity the initial chunk size
     */
    public MpscMailbox(int initialCapacity) {
        // JCTools requires a chunk of at least 2
        int safeCapacity = Math.max(2, initialCapacity);
        this.chunkSize = nextPowerOfTwo(safeCapacity);
        this.queue = new MpscUnboundedArrayQueue<>(chunkSize);
    }

    @Override
    protected boolean enqueue(M message) {
        return queue.offer(message);
    }

    @Override
    protected M dequeue() {
        return queue.poll();
    }

    @Override
    public int size() {
        return queue.size();
    }

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Rounds up to the next power of 2.
     */
    static int nextPowerOfTwo(int value) {
        if (value <= 1) {
            return 1;
        }
        if ((value & (value - 1)) == 0) {
            return value;
        }
        return Integer.highestOneBit(value) << 1;
    }
}
