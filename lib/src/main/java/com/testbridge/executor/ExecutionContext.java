package com.testbridge.executor;

import com.testbridge.module.LoadedModules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLClassLoader;
import java.util.Objects;

/**
 * A class loader holding a test module and its framework.
 * Framework code runs with this loader as the thread context class loader.
 */
public final class ExecutionContext implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionContext.class);

    private final URLClassLoader classLoader;
    private final LoadedModules modules;

    /**
     * Restores the previous context class loader when closed.
     */
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }

    public ExecutionContext(URLClassLoader classLoader, LoadedModules modules) {
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
        this.modules = Objects.requireNonNull(modules, "modules");
    }

    /**
     * Makes this context's loader the context class loader of the current thread.
     *
     * @return a scope that restores the previous loader
     */
    public Scope enter() {
        Thread thread = Thread.currentThread();
        ClassLoader previous = thread.getContextClassLoader();
        thread.setContextClassLoader(classLoader);
        return () -> thread.setContextClassLoader(previous);
    }

    /**
     * Loads a type through this context without initialising it.
     *
     * @param typeName the binary class name
     * @return the class
     * @throws ClassNotFoundException if the type is not visible in this context
     */
    public Class<?> loadType(String typeName) throws ClassNotFoundException {
        return Class.forName(typeName, false, classLoader);
    }

    public ClassLoader getClassLoader() {
        return classLoader;
    }

    public LoadedModules getModules() {
        return modules;
    }

    @Override
    public void close() {
        try {
            classLoader.close();
        } catch (IOException e) {
            logger.warn("Failed to close class loader for {}", modules.target().path(), e);
        }
    }
}
