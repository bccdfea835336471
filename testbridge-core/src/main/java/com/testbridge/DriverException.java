package com.testbridge;

/**
 * Base exception for failures raised while driving a test framework.
 * Subclasses identify the specific failure kind; a plain DriverException
 * means the framework itself threw while executing an action.
 */
public class DriverException extends RuntimeException {

    /**
     * Creates a new DriverException with the specified detail message.
     *
     * @param message the detail message
     */
    public DriverException(String message) {
        super(message);
    }

    /**
     * Creates a new DriverException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     */
    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
