package com.testbridge.dispatcher;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ProgressDispatcherTest {

    @Test
    void testRunsTasksOnNamedDaemonThreads() throws InterruptedException {
        ProgressDispatcher dispatcher = ProgressDispatcher.cachedThreadDispatcher("progress-test");
        AtomicReference<Thread> thread = new AtomicReference<>();
        CountDownLatch ran = new CountDownLatch(1);

        dispatcher.schedule(() -> {
            thread.set(Thread.currentThread());
            ran.countDown();
        });

        assertTrue(ran.await(2, TimeUnit.SECONDS));
        assertTrue(thread.get().isDaemon());
        assertTrue(thread.get().getName().startsWith("progress-test-"));
        dispatcher.shutdown();
        assertTrue(dispatcher.awaitTermination(2, TimeUnit.SECONDS));
    }

    @Test
    void testScheduleAfterShutdownIsIgnored() throws InterruptedException {
        ProgressDispatcher dispatcher = ProgressDispatcher.cachedThreadDispatcher("progress-test");
        dispatcher.shutdown();
        AtomicBoolean ran = new AtomicBoolean();

        dispatcher.schedule(() -> ran.set(true));

        assertTrue(dispatcher.isShutdown());
        assertTrue(dispatcher.awaitTermination(2, TimeUnit.SECONDS));
        assertFalse(ran.get());
    }

    @Test
    void testShutdownIsIdempotent() {
        ProgressDispatcher dispatcher = ProgressDispatcher.cachedThreadDispatcher("progress-test");

        dispatcher.shutdown();
        dispatcher.shutdown();

        assertTrue(dispatcher.isShutdown());
    }
}
