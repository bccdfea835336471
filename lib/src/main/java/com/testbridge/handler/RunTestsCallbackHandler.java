package com.testbridge.handler;

import com.testbridge.TestEventListener;
import com.testbridge.config.DriverConfig;
import com.testbridge.dispatcher.ProgressDispatcher;
import com.testbridge.dispatcher.ProgressMailbox;
import com.testbridge.dispatcher.ProgressRunner;
import org.slf4j.Logger;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Callback handler for test runs.
 *
 * <p>Every message from the framework is forwarded to the listener, in receipt order, by a
 * single runner on the progress dispatcher, so the framework's threads never wait on the
 * listener. The terminal slot is completed only when the runner reaches the entry queued by
 * {@link #complete(String)}, after every message the framework sent before the action returned.
 * The last message recognised as a final result wins; the returned value is the fallback.
 */
public class RunTestsCallbackHandler extends CallbackHandler {

    private static final AtomicLong RUN_COUNTER = new AtomicLong();

    private final TestEventListener listener;
    private final FinalResultDetector finalResultDetector;
    private final ProgressDispatcher dispatcher;
    private final ProgressMailbox<Entry> mailbox;
    private final ProgressRunner<Entry> runner;

    // Written by the runner only
    private volatile String finalResult;

    /**
     * A mailbox entry. Entries that are not forwarded only carry a terminal result.
     */
    private record Entry(String message, boolean forward) {
    }

    public RunTestsCallbackHandler(TestEventListener listener, DriverConfig config,
                                   ProgressDispatcher dispatcher, Logger logger) {
        super(logger, config.getResultTimeout());
        this.listener = Objects.requireNonNull(listener, "listener");
        this.finalResultDetector = config.getFinalResultDetector();
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        String ownerId = "run-" + RUN_COUNTER.incrementAndGet();
        this.mailbox = ProgressMailbox.create(config.getProgressMailboxType(), this::schedule, ownerId);
        this.runner = new ProgressRunner<>(ownerId, mailbox, this::deliver, dispatcher, config.getProgressThroughput());
    }

    @Override
    public void accept(String message) {
        mailbox.enqueue(new Entry(message, true));
    }

    /**
     * Queues the end of the action behind any progress still waiting for delivery.
     * The entry is not forwarded to the listener.
     */
    @Override
    public void complete(String returnValue) {
        mailbox.enqueue(new Entry(returnValue, false));
    }

    private void schedule() {
        dispatcher.schedule(runner);
    }

    private void deliver(Entry entry) {
        if (!entry.forward()) {
            String terminal = finalResult;
            super.complete(terminal != null ? terminal : entry.message());
            return;
        }
        try {
            listener.onTestEvent(entry.message());
        } catch (RuntimeException e) {
            logger.error("Test event listener failed on event: {}", abbreviate(entry.message()), e);
        }
        if (finalResultDetector.isFinalResult(entry.message())) {
            finalResult = entry.message();
        }
    }
}
