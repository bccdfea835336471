package com.testbridge.executor;

import com.testbridge.FrameworkIncompatibleException;
import com.testbridge.config.DriverConfig;
import com.testbridge.handler.CallbackHandler;
import com.testbridge.module.LoadedModules;
import org.slf4j.Logger;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.net.URLClassLoader;
import java.util.Map;

/**
 * Runs the framework in a class loader that shares nothing with the driver but the JDK.
 *
 * <p>Settings are copied into the context by value. Each action is performed by constructing
 * the framework's action object with {@code (controller, arguments..., handler)}; the action
 * reports its result through the handler before its constructor returns. Actions return no
 * value, so the handler is completed with null once the constructor returns.
 */
public class IsolatedContextExecutor extends AbstractFrameworkExecutor {

    public IsolatedContextExecutor(DriverConfig config, Logger logger) {
        super(config, logger);
    }

    @Override
    public ExecutionContext createContext(LoadedModules modules) {
        URLClassLoader loader = new URLClassLoader(
                "testbridge-isolated-" + modules.target().fileName(),
                modules.urls(),
                ClassLoader.getPlatformClassLoader());
        return new ExecutionContext(loader, modules);
    }

    @Override
    public ControllerHandle createController(ExecutionContext context, String idPrefix, Map<String, Object> settings) {
        try (ExecutionContext.Scope ignored = context.enter()) {
            Map<String, Object> marshalledSettings = marshal(settings, context);
            Class<?> controllerType = loadControllerType(context);
            Constructor<?> constructor = controllerConstructor(controllerType);
            String controllerTypeName = config.getControllerTypeName();
            ActionRegistry actions = ActionRegistry.resolveAll(
                    type -> context.loadType(type.actionTypeName(controllerTypeName))
                            .getConstructor(type.constructorParameterTypes(controllerType)),
                    logger);
            Object controller = construct(constructor,
                    context.getModules().target().path().toString(), idPrefix, marshalledSettings);
            return new ControllerHandle(controller, context, actions);
        }
    }

    @Override
    public void dispatch(FrameworkAction action, ControllerHandle controller, CallbackHandler handler) {
        Constructor<?> constructor = (Constructor<?>) controller.actions().get(action.type());
        logger.debug("Creating {} in {}", constructor.getDeclaringClass().getName(),
                controller.context().getClassLoader().getName());
        try (ExecutionContext.Scope ignored = controller.context().enter()) {
            construct(constructor, concat(controller.controller(), action.arguments(), handler));
        }
        handler.complete(null);
    }

    private Map<String, Object> marshal(Map<String, Object> settings, ExecutionContext context) {
        try {
            return SettingsMarshaller.marshal(settings, context.getClassLoader());
        } catch (IOException | ClassNotFoundException e) {
            logger.error("Settings cannot be passed into {}: {}", context.getModules().target().fileName(), e.toString());
            throw new FrameworkIncompatibleException(UNSUPPORTED_MODULE_MESSAGE, e);
        }
    }
}
