package com.testbridge.dispatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * ProgressRunner drains a ProgressMailbox in batches, handing each entry to a consumer.
 * Only one activation runs at a time, so entries are consumed strictly in FIFO order.
 * If entries remain after a batch, the runner re-schedules itself.
 *
 * @param <T> The type of entries to process
 */
public final class ProgressRunner<T> implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ProgressRunner.class);

    private final String ownerId;
    private final ProgressMailbox<T> mailbox;
    private final Consumer<T> consumer;
    private final ProgressDispatcher dispatcher;
    private final int throughput;

    /**
     * Creates a ProgressRunner.
     *
     * @param ownerId Identifier used in log messages
     * @param mailbox The mailbox to drain
     * @param consumer Receives each entry in order
     * @param dispatcher The dispatcher for re-scheduling
     * @param throughput Maximum number of entries to process per activation
     */
    public ProgressRunner(
            String ownerId,
            ProgressMailbox<T> mailbox,
            Consumer<T> consumer,
            ProgressDispatcher dispatcher,
            int throughput) {
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox");
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.throughput = Math.max(1, throughput);
    }

    @Override
    public void run() {
        try {
            int processed = 0;
            T entry;

            while (processed < throughput && (entry = mailbox.poll()) != null) {
                try {
                    consumer.accept(entry);
                } catch (Throwable t) {
                    logger.error("Progress runner {} failed to deliver entry: {}", ownerId, entry, t);
                }
                processed++;
            }

            if (processed > 0) {
                logger.trace("Progress runner {} delivered {} entries", ownerId, processed);
            }
        } finally {
            // Clear the flag, then look again: entries may have arrived while the flag was still set
            if (mailbox.tryClearScheduled()) {
                if (!mailbox.isEmpty()) {
                    if (mailbox.getScheduled().compareAndSet(false, true)) {
                        dispatcher.schedule(this);
                    }
                }
            }
        }
    }
}
