package com.testbridge;

/**
 * Thrown when a module location descriptor cannot be turned into a filesystem path.
 */
public class PathResolutionException extends DriverException {

    public PathResolutionException(String message) {
        super(message);
    }

    public PathResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
