package com.postbox.config;

/**
 * Configuration for mailbox backends.
 * Mailboxes are always unbounded; the initial capacity only sizes the first storage chunk of
 * array-backed queues.
 */
public class MailboxConfig {
    public static final int DEFAULT_INITIAL_CAPACITY = 128;

    private int initialCapacity;

    /**
     * Creates a new MailboxConfig with default values.
     */
    public MailboxConfig() {
        this.initialCapacity = DEFAULT_INITIAL_CAPACITY;
    }

    /**
     * Sets the initial chunk size. Values below 2 are raised to 2 by the backends.
     *
     * @param initialCapacity The initial capacity
     * @return This MailboxConfig instance
     */
    public MailboxConfig setInitialCapacity(int initialCapacity) {
        this.initialCapacity = initialCapacity;
        return this;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    @Override
    public String toString() {
        return "MailboxConfig{initialCapacity=" + initialCapacity + '}';
    }
}
