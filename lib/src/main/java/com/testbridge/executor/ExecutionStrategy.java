package com.testbridge.executor;

import com.testbridge.config.DriverConfig;
import org.slf4j.Logger;

/**
 * Defines where the framework controller is hosted.
 *
 * <ul>
 *   <li>{@link #IN_PROCESS} - class loader parented to the driver's loader; direct method calls</li>
 *   <li>{@link #ISOLATED} - class loader parented to the platform loader; action objects and
 *       settings copied by value</li>
 * </ul>
 */
public enum ExecutionStrategy {
    IN_PROCESS,
    ISOLATED;

    /**
     * Creates the executor implementing this strategy.
     *
     * @param config the driver configuration
     * @param logger the driver's logger
     * @return a new executor
     */
    public FrameworkExecutor createExecutor(DriverConfig config, Logger logger) {
        switch (this) {
            case IN_PROCESS:
                return new InProcessExecutor(config, logger);
            case ISOLATED:
                return new IsolatedContextExecutor(config, logger);
            default:
                throw new IllegalStateException("Unknown execution strategy: " + this);
        }
    }
}
