package com.testbridge.handler;

import com.testbridge.DriverException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class CallbackHandlerTest {

    @Test
    void testFirstMessageIsTheResult() {
        CallbackHandler handler = new CallbackHandler();

        handler.accept("<test-suite/>");

        assertTrue(handler.isComplete());
        assertEquals("<test-suite/>", handler.getResult());
    }

    @Test
    void testLaterMessagesAreLoggedAndIgnored() {
        Logger logger = mock(Logger.class);
        CallbackHandler handler = new CallbackHandler(logger, null);

        handler.accept("first");
        handler.accept("second");
        handler.complete("third");

        assertEquals("first", handler.getResult());
        verify(logger).warn(anyString(), eq("second"));
        verify(logger, never()).warn(anyString(), eq("third"));
    }

    @Test
    void testReturnValueIsTheResultWhenNothingWasReported() {
        CallbackHandler handler = new CallbackHandler();

        handler.complete("<returned/>");

        assertEquals("<returned/>", handler.getResult());
    }

    @Test
    void testFailRaisesTheGivenException() {
        CallbackHandler handler = new CallbackHandler();
        DriverException failure = new DriverException("stopped");

        assertTrue(handler.fail(failure));

        assertSame(failure, assertThrows(DriverException.class, handler::getResult));
    }

    @Test
    void testFailAfterResultHasNoEffect() {
        CallbackHandler handler = new CallbackHandler();
        handler.accept("done");

        assertFalse(handler.fail(new DriverException("too late")));
        assertEquals("done", handler.getResult());
    }

    @Test
    void testNullResultIsAllowed() {
        CallbackHandler handler = new CallbackHandler();

        handler.complete(null);

        assertTrue(handler.isComplete());
        assertNull(handler.getResult());
    }

    @Test
    void testGetResultWaitsForAnotherThread() {
        CallbackHandler handler = new CallbackHandler();

        CompletableFuture.runAsync(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            handler.accept("late");
        });

        assertEquals("late", handler.getResult());
    }

    @Test
    void testTimeoutRaisesDriverException() {
        CallbackHandler handler = new CallbackHandler(null, Duration.ofMillis(50));

        DriverException e = assertThrows(DriverException.class, handler::getResult);
        assertTrue(e.getMessage().contains("No result received"));
    }

    @Test
    void testInterruptRaisesDriverException() {
        CallbackHandler handler = new CallbackHandler();
        Thread.currentThread().interrupt();

        try {
            assertThrows(DriverException.class, handler::getResult);
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testAbbreviateLongMessages() {
        String longMessage = "x".repeat(500);

        assertEquals(203, CallbackHandler.abbreviate(longMessage).length());
        assertEquals("short", CallbackHandler.abbreviate("short"));
        assertNull(CallbackHandler.abbreviate(null));
    }
}
