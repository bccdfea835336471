package com.testbridge;

/**
 * Thrown when the test module or its companion framework module
 * cannot be located or read.
 */
public class ModuleLoadException extends DriverException {

    public ModuleLoadException(String message) {
        super(message);
    }

    public ModuleLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
