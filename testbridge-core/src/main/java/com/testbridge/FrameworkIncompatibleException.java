package com.testbridge;

/**
 * Thrown when the framework found next to a test module does not honour the
 * controller contract this driver expects. This is never used for a missing
 * or unreadable module; see {@link ModuleLoadException} for that.
 */
public class FrameworkIncompatibleException extends DriverException {

    public FrameworkIncompatibleException(String message) {
        super(message);
    }

    public FrameworkIncompatibleException(String message, Throwable cause) {
        super(message, cause);
    }
}
