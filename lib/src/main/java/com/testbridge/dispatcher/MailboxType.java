package com.testbridge.dispatcher;

/**
 * Defines the queue implementation behind a progress mailbox.
 * Both are unbounded so that framework threads never block while reporting progress.
 *
 * <ul>
 *   <li>{@link #CONCURRENT_LINKED} - JDK ConcurrentLinkedQueue (default)</li>
 *   <li>{@link #MPSC} - JCTools MpscUnboundedArrayQueue, lock-free for many producers and one consumer</li>
 * </ul>
 */
public enum MailboxType {
    /**
     * Non-blocking linked queue from the JDK.
     * Good balance between performance and simplicity.
     */
    CONCURRENT_LINKED,

    /**
     * Chunked multi-producer single-consumer array queue from JCTools.
     * Best choice when a framework reports progress from many threads at a high rate.
     */
    MPSC
}
