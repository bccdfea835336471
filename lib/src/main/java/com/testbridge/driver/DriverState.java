package com.testbridge.driver;

/**
 * Lifecycle states of a framework driver.
 * A controller exists exactly while the driver is {@link #LOADED}.
 */
public enum DriverState {
    /** No module loaded yet, or the last load failed. */
    UNLOADED,
    /** A controller exists; count, explore, run and stop are allowed. */
    LOADED,
    /** The execution context has been released. */
    CLOSED
}
