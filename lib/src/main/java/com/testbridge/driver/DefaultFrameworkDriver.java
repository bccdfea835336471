package com.testbridge.driver;

import com.testbridge.DriverException;
import com.testbridge.FrameworkDriver;
import com.testbridge.FrameworkIncompatibleException;
import com.testbridge.InvalidDriverStateException;
import com.testbridge.TestEventListener;
import com.testbridge.config.DriverConfig;
import com.testbridge.dispatcher.ProgressDispatcher;
import com.testbridge.executor.ControllerHandle;
import com.testbridge.executor.ExecutionContext;
import com.testbridge.executor.FrameworkAction;
import com.testbridge.executor.FrameworkExecutor;
import com.testbridge.handler.CallbackHandler;
import com.testbridge.handler.RunTestsCallbackHandler;
import com.testbridge.module.LoadedModules;
import com.testbridge.module.ModuleLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Drives a test module through the framework jar that sits next to it.
 *
 * <p>The driver locates both modules, asks its {@link FrameworkExecutor} to host the framework
 * controller, and performs each lifecycle operation as one framework action whose result comes
 * back through a {@link CallbackHandler}. {@link #stopRun(boolean)} shares no handler or lock
 * with {@link #run}, so it can be called from another thread while a run is blocked.
 * {@link #close()} during a run fails that run with a {@link DriverException}.
 */
public class DefaultFrameworkDriver implements FrameworkDriver {

    static final String LOAD_MESSAGE = "Method called without calling Load first";

    private final DriverConfig config;
    private final ModuleLoader moduleLoader;
    private final FrameworkExecutor executor;
    private final Logger logger;
    private final ProgressDispatcher progressDispatcher;

    private volatile String id = "";
    private volatile DriverState state = DriverState.UNLOADED;
    private volatile ControllerHandle controller;
    private volatile String moduleFileName;
    private volatile CallbackHandler activeRun;

    public DefaultFrameworkDriver() {
        this(new DriverConfig());
    }

    public DefaultFrameworkDriver(DriverConfig config) {
        this(config, LoggerFactory.getLogger(DefaultFrameworkDriver.class));
    }

    /**
     * @param config the driver configuration
     * @param logger the logger this driver and its executor report through
     */
    public DefaultFrameworkDriver(DriverConfig config, Logger logger) {
        this(config, new ModuleLoader(config), config.getExecutionStrategy().createExecutor(config, logger), logger);
    }

    DefaultFrameworkDriver(DriverConfig config, ModuleLoader moduleLoader, FrameworkExecutor executor, Logger logger) {
        this.config = Objects.requireNonNull(config, "config");
        this.moduleLoader = Objects.requireNonNull(moduleLoader, "moduleLoader");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.progressDispatcher = ProgressDispatcher.cachedThreadDispatcher("testbridge-progress");
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void setId(String id) {
        if (state != DriverState.UNLOADED) {
            throw new InvalidDriverStateException("The ID cannot be changed once a module is loaded");
        }
        this.id = id == null ? "" : id;
    }

    @Override
    public String load(String modulePath, Map<String, Object> settings) {
        if (state == DriverState.LOADED) {
            throw new InvalidDriverStateException("Load has already been called on this driver");
        }
        if (state == DriverState.CLOSED) {
            throw new InvalidDriverStateException("Driver has been closed");
        }
        Objects.requireNonNull(modulePath, "modulePath");

        String idPrefix = id.isEmpty() ? "" : id + "-";
        Map<String, Object> frozenSettings = settings == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(settings));

        LoadedModules modules = moduleLoader.load(modulePath);
        ExecutionContext context = executor.createContext(modules);
        String fileName = modules.target().fileName();
        try {
            ControllerHandle handle = executor.createController(context, idPrefix, frozenSettings);

            logger.info("Loading {} - see separate log file", fileName);
            CallbackHandler handler = newHandler();
            executor.dispatch(FrameworkAction.load(), handle, handler);
            String result = handler.getResult();

            this.moduleFileName = fileName;
            this.controller = handle;
            this.state = DriverState.LOADED;
            logger.info("Loaded {}", fileName);
            return result;
        } catch (RuntimeException e) {
            context.close();
            logger.warn("Failed to load {}: {}", fileName, e.getMessage());
            throw e;
        }
    }

    @Override
    public int countTestCases(String filter) {
        ControllerHandle handle = checkLoadWasCalled();

        CallbackHandler handler = newHandler();
        executor.dispatch(FrameworkAction.count(filter), handle, handler);

        return parseCount(handler.getResult());
    }

    @Override
    public String run(TestEventListener listener, String filter) {
        Objects.requireNonNull(listener, "listener");
        ControllerHandle handle = checkLoadWasCalled();

        CallbackHandler handler = new RunTestsCallbackHandler(listener, config, progressDispatcher, logger);
        activeRun = handler;
        try {
            if (state == DriverState.CLOSED) {
                throw new InvalidDriverStateException("Driver has been closed");
            }
            logger.info("Running {} - see separate log file", moduleFileName);
            executor.dispatch(FrameworkAction.run(filter), handle, handler);

            return handler.getResult();
        } finally {
            activeRun = null;
        }
    }

    @Override
    public String explore(String filter) {
        ControllerHandle handle = checkLoadWasCalled();

        CallbackHandler handler = newHandler();

        logger.info("Exploring {} - see separate log file", moduleFileName);
        executor.dispatch(FrameworkAction.explore(filter), handle, handler);

        return handler.getResult();
    }

    @Override
    public void stopRun(boolean force) {
        ControllerHandle handle = checkLoadWasCalled();
        logger.info("Stopping run of {} (force={})", moduleFileName, force);
        executor.dispatch(FrameworkAction.stopRun(force), handle, newHandler());
    }

    @Override
    public void close() {
        if (state == DriverState.CLOSED) {
            return;
        }
        state = DriverState.CLOSED;
        ControllerHandle handle = controller;
        controller = null;
        CallbackHandler run = activeRun;
        if (run != null && run.fail(new DriverException("Driver closed while a run was in progress"))
                && handle != null) {
            abortRun(handle);
        }
        if (handle != null) {
            handle.context().close();
        }
        progressDispatcher.shutdown();
        logger.debug("Closed driver {}", id);
    }

    /**
     * Returns the current lifecycle state.
     *
     * @return the state
     */
    public DriverState getState() {
        return state;
    }

    private void abortRun(ControllerHandle handle) {
        logger.warn("Closing {} during a run; stopping the run", moduleFileName);
        try {
            executor.dispatch(FrameworkAction.stopRun(true), handle, newHandler());
        } catch (DriverException e) {
            logger.warn("Framework failed to stop the run of {}: {}", moduleFileName, e.getMessage());
        }
    }

    private ControllerHandle checkLoadWasCalled() {
        ControllerHandle handle = controller;
        if (state != DriverState.LOADED || handle == null) {
            throw new InvalidDriverStateException(LOAD_MESSAGE);
        }
        return handle;
    }

    private CallbackHandler newHandler() {
        return new CallbackHandler(logger, config.getResultTimeout());
    }

    static int parseCount(String result) {
        if (result == null || result.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(result.trim());
        } catch (NumberFormatException e) {
            throw new FrameworkIncompatibleException("Framework returned a test count that is not a number: " + result, e);
        }
    }
}
