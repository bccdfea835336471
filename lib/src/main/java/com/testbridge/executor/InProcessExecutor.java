package com.testbridge.executor;

import com.testbridge.FrameworkIncompatibleException;
import com.testbridge.config.DriverConfig;
import com.testbridge.handler.CallbackHandler;
import com.testbridge.module.LoadedModules;
import org.slf4j.Logger;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.net.URLClassLoader;
import java.util.Map;

/**
 * Runs the framework in a class loader parented to the driver's own loader.
 *
 * <p>Settings are passed by reference and controller methods are called directly; a method's
 * return value becomes the terminal result. For runs, the handler itself is passed as the
 * progress callback.
 */
public class InProcessExecutor extends AbstractFrameworkExecutor {

    public InProcessExecutor(DriverConfig config, Logger logger) {
        super(config, logger);
    }

    @Override
    public ExecutionContext createContext(LoadedModules modules) {
        URLClassLoader loader = new URLClassLoader(
                "testbridge-inprocess-" + modules.target().fileName(),
                modules.urls(),
                config.getInProcessParentClassLoader());
        return new ExecutionContext(loader, modules);
    }

    @Override
    public ControllerHandle createController(ExecutionContext context, String idPrefix, Map<String, Object> settings) {
        String typeName = config.getControllerTypeName();
        if (!context.getModules().framework().containsType(typeName)) {
            logger.error("Could not find type {} in {}", typeName, context.getModules().framework().fileName());
            throw new FrameworkIncompatibleException(INVALID_FRAMEWORK_MESSAGE);
        }

        try (ExecutionContext.Scope ignored = context.enter()) {
            Class<?> controllerType = loadControllerType(context);
            Constructor<?> constructor = controllerConstructor(controllerType);
            ActionRegistry actions = ActionRegistry.resolveAll(
                    type -> controllerType.getMethod(type.getMethodName(), type.getMethodParameterTypes()),
                    logger);
            Object controller = construct(constructor,
                    context.getModules().target().path().toString(), idPrefix, settings);
            return new ControllerHandle(controller, context, actions);
        }
    }

    @Override
    public void dispatch(FrameworkAction action, ControllerHandle controller, CallbackHandler handler) {
        Method method = (Method) controller.actions().get(action.type());
        logger.debug("Invoking {} on {}", method.getName(), controller.controller().getClass().getName());
        Object result;
        try (ExecutionContext.Scope ignored = controller.context().enter()) {
            result = invoke(method, controller.controller(), action.methodArguments(handler));
        }
        handler.complete(result == null ? null : String.valueOf(result));
    }
}
