package com.testbridge;

/**
 * Thrown when a driver operation is called in a lifecycle state that does not allow it,
 * for example running tests before a module was loaded.
 */
public class InvalidDriverStateException extends DriverException {

    public InvalidDriverStateException(String message) {
        super(message);
    }
}
