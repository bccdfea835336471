package com.testbridge.executor;

import com.testbridge.handler.CallbackHandler;
import com.testbridge.module.LoadedModules;

import java.util.Map;

/**
 * Hosts a framework controller and invokes actions on it.
 * Implementations differ in how far the framework is isolated from the driver.
 */
public interface FrameworkExecutor {

    /**
     * Creates the execution context holding the modules.
     *
     * @param modules the located test and framework modules
     * @return the context
     * @throws com.testbridge.ModuleLoadException if the modules cannot be added to a class loader
     */
    ExecutionContext createContext(LoadedModules modules);

    /**
     * Creates the framework controller.
     *
     * @param context the execution context
     * @param idPrefix prefix for all test identifiers, possibly empty
     * @param settings framework settings
     * @return a handle to the controller
     * @throws com.testbridge.FrameworkIncompatibleException if the controller contract does not match
     */
    ControllerHandle createController(ExecutionContext context, String idPrefix, Map<String, Object> settings);

    /**
     * Invokes an action and, once it has returned, calls {@link CallbackHandler#complete(String)}
     * with its return value. A run handler publishes its terminal result only after that call.
     *
     * @param action the action and its arguments
     * @param controller the controller
     * @param handler receives the result and, for runs, progress
     */
    void dispatch(FrameworkAction action, ControllerHandle controller, CallbackHandler handler);
}
