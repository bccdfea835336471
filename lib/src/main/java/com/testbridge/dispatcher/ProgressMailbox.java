package com.testbridge.dispatcher;

import org.jctools.queues.MpscUnboundedArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ProgressMailbox buffers progress notifications between the framework's threads and
 * the single runner that delivers them, using coalesced scheduling: the runner is scheduled
 * only when the mailbox goes from idle to having work.
 *
 * <p>Enqueueing never blocks; both queue types are unbounded.
 *
 * @param <T> The type of entries in the mailbox
 */
public final class ProgressMailbox<T> {

    private static final Logger logger = LoggerFactory.getLogger(ProgressMailbox.class);

    static final int MPSC_CHUNK_SIZE = 256;

    private final Queue<T> queue;
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private final Runnable scheduleAction;
    private final String ownerId;

    /**
     * Creates a mailbox of the given type.
     *
     * @param mailboxType The queue implementation
     * @param scheduleAction The action to invoke when the runner must be scheduled
     * @param ownerId Identifier used in log messages
     */
    public static <T> ProgressMailbox<T> create(MailboxType mailboxType, Runnable scheduleAction, String ownerId) {
        Queue<T> queue = mailboxType == MailboxType.MPSC
                ? new MpscUnboundedArrayQueue<>(MPSC_CHUNK_SIZE)
                : new ConcurrentLinkedQueue<>();
        return new ProgressMailbox<>(queue, scheduleAction, ownerId);
    }

    private ProgressMailbox(Queue<T> queue, Runnable scheduleAction, String ownerId) {
        this.queue = queue;
        this.scheduleAction = Objects.requireNonNull(scheduleAction, "scheduleAction");
        this.ownerId = ownerId;
    }

    /**
     * Enqueues an entry and schedules the runner if it is not already scheduled.
     *
     * @param entry The entry to enqueue
     */
    public void enqueue(T entry) {
        Objects.requireNonNull(entry, "entry cannot be null");
        queue.offer(entry);

        if (scheduled.compareAndSet(false, true)) {
            try {
                scheduleAction.run();
            } catch (Throwable t) {
                logger.error("Progress mailbox {} schedule action failed", ownerId, t);
                scheduled.set(false);
            }
        }
    }

    /**
     * Polls an entry from the mailbox (consumer side).
     *
     * @return The next entry, or null if empty
     */
    public T poll() {
        return queue.poll();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * Attempts to clear the scheduled flag after processing a batch.
     *
     * @return true if cleared, false if already false
     */
    public boolean tryClearScheduled() {
        return scheduled.compareAndSet(true, false);
    }

    public AtomicBoolean getScheduled() {
        return scheduled;
    }
}
