package com.testbridge.handler;

import com.testbridge.DriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Receives the result of a framework action across the execution boundary.
 *
 * <p>The handler is passed to the framework as a {@code Consumer<String>}, a type visible on
 * both sides of an isolated class loader. The first message received is the terminal result;
 * {@link #getResult()} blocks until it arrives. Executors call {@link #complete(String)} once
 * the action has returned, which supplies the result when the framework reported none.
 */
public class CallbackHandler implements Consumer<String> {

    private static final Logger defaultLogger = LoggerFactory.getLogger(CallbackHandler.class);
    private static final int LOGGED_MESSAGE_LENGTH = 200;

    private final CompletableFuture<String> result = new CompletableFuture<>();
    protected final Logger logger;
    private final Duration timeout;

    public CallbackHandler() {
        this(defaultLogger, null);
    }

    /**
     * @param logger the logger of the owning driver
     * @param timeout how long {@link #getResult()} waits, or null to wait indefinitely
     */
    public CallbackHandler(Logger logger, Duration timeout) {
        this.logger = logger != null ? logger : defaultLogger;
        this.timeout = timeout;
    }

    /**
     * Called by the framework with a message.
     *
     * @param message the message
     */
    @Override
    public void accept(String message) {
        receiveResult(message);
    }

    /**
     * Signals that the action has returned. The returned value becomes the terminal result
     * unless the framework already reported one.
     *
     * @param returnValue the value the action returned, possibly null
     */
    public void complete(String returnValue) {
        result.complete(returnValue);
    }

    /**
     * Fails the pending result; {@link #getResult()} throws the given exception.
     *
     * @param failure the reason no result will arrive
     * @return true if this call failed the result, false if it was already complete
     */
    public boolean fail(DriverException failure) {
        return result.completeExceptionally(failure);
    }

    /**
     * Stores the terminal result. Later results are ignored.
     *
     * @param message the result
     */
    private void receiveResult(String message) {
        if (!result.complete(message)) {
            logger.warn("Ignoring result received after the terminal result: {}", abbreviate(message));
        }
    }

    /**
     * Returns whether the terminal result has arrived.
     *
     * @return true once a result was received
     */
    public boolean isComplete() {
        return result.isDone();
    }

    /**
     * Blocks until the terminal result arrives.
     *
     * @return the result, possibly null
     * @throws DriverException if interrupted, the configured timeout elapses or the result was failed
     */
    public String getResult() {
        try {
            if (timeout == null) {
                return result.get();
            }
            return result.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DriverException("Interrupted while waiting for the framework result", e);
        } catch (TimeoutException e) {
            throw new DriverException("No result received from the framework within " + timeout, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof DriverException) {
                throw (DriverException) e.getCause();
            }
            throw new DriverException("Framework result failed", e.getCause());
        }
    }

    static String abbreviate(String message) {
        if (message == null || message.length() <= LOGGED_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, LOGGED_MESSAGE_LENGTH) + "...";
    }
}
