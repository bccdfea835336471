package com.testbridge.executor;

import com.testbridge.DriverException;
import com.testbridge.FrameworkIncompatibleException;
import com.testbridge.config.DriverConfig;
import org.slf4j.Logger;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Map;
import java.util.Objects;

/**
 * Reflection plumbing shared by both executors.
 * Failures thrown by framework code are surfaced as {@link DriverException}; failures to call
 * the framework at all are classified as {@link FrameworkIncompatibleException}.
 */
abstract class AbstractFrameworkExecutor implements FrameworkExecutor {

    static final String INVALID_FRAMEWORK_MESSAGE =
            "Running tests against this version of the framework using this driver is not supported. "
                    + "Please update the test framework to the latest version.";
    static final String UNSUPPORTED_MODULE_MESSAGE =
            "This driver cannot support this test module. Use a platform specific runner.";

    protected final DriverConfig config;
    protected final Logger logger;

    protected AbstractFrameworkExecutor(DriverConfig config, Logger logger) {
        this.config = Objects.requireNonNull(config, "config");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Loads the controller type, logging the lookup failure before classifying it.
     */
    protected Class<?> loadControllerType(ExecutionContext context) {
        String typeName = config.getControllerTypeName();
        try {
            return context.loadType(typeName);
        } catch (ClassNotFoundException | LinkageError e) {
            logger.error("Could not find type {}", typeName);
            throw new FrameworkIncompatibleException(INVALID_FRAMEWORK_MESSAGE, e);
        }
    }

    protected Constructor<?> controllerConstructor(Class<?> controllerType) {
        try {
            return controllerType.getConstructor(String.class, String.class, Map.class);
        } catch (NoSuchMethodException e) {
            logger.error("Could not find constructor (String, String, Map) on {}", controllerType.getName());
            throw new FrameworkIncompatibleException(INVALID_FRAMEWORK_MESSAGE, e);
        }
    }

    protected Object construct(Constructor<?> constructor, Object... args) {
        try {
            return constructor.newInstance(args);
        } catch (InvocationTargetException e) {
            throw frameworkFailure(constructor.getDeclaringClass().getName(), e.getCause());
        } catch (IllegalArgumentException e) {
            throw new FrameworkIncompatibleException(UNSUPPORTED_MODULE_MESSAGE, e);
        } catch (InstantiationException | IllegalAccessException e) {
            logger.error("Could not construct {}: {}", constructor.getDeclaringClass().getName(), e.toString());
            throw new FrameworkIncompatibleException(INVALID_FRAMEWORK_MESSAGE, e);
        }
    }

    protected Object invoke(Method method, Object target, Object... args) {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw frameworkFailure(method.getName(), e.getCause());
        } catch (IllegalArgumentException e) {
            throw new FrameworkIncompatibleException(UNSUPPORTED_MODULE_MESSAGE, e);
        } catch (IllegalAccessException e) {
            logger.error("Could not invoke {} on {}: {}", method.getName(), target.getClass().getName(), e.toString());
            throw new FrameworkIncompatibleException(INVALID_FRAMEWORK_MESSAGE, e);
        }
    }

    private DriverException frameworkFailure(String member, Throwable cause) {
        if (cause instanceof DriverException) {
            return (DriverException) cause;
        }
        return new DriverException("Framework failed in " + member + ": " + cause, cause);
    }

    static Object[] concat(Object first, Object[] middle, Object last) {
        Object[] all = new Object[middle.length + 2];
        all[0] = first;
        System.arraycopy(middle, 0, all, 1, middle.length);
        all[all.length - 1] = last;
        return all;
    }
}
