package com.testbridge.executor;

import com.testbridge.FrameworkIncompatibleException;
import org.slf4j.Logger;

import java.lang.reflect.Executable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The constructors or methods implementing each {@link ActionType} for one controller.
 * All actions are resolved up front, so a framework missing any of them is rejected at load time.
 */
public final class ActionRegistry {

    /**
     * Looks up the member implementing an action.
     */
    @FunctionalInterface
    public interface Resolver {
        Executable resolve(ActionType type) throws ReflectiveOperationException;
    }

    private final Map<ActionType, Executable> actions;

    private ActionRegistry(Map<ActionType, Executable> actions) {
        this.actions = Collections.unmodifiableMap(actions);
    }

    /**
     * Resolves every action type.
     *
     * @param resolver performs the lookup in the execution context
     * @param logger the driver's logger, used to report lookup failures
     * @return the registry
     * @throws FrameworkIncompatibleException if any action cannot be found
     */
    public static ActionRegistry resolveAll(Resolver resolver, Logger logger) {
        Map<ActionType, Executable> actions = new EnumMap<>(ActionType.class);
        for (ActionType type : ActionType.values()) {
            try {
                actions.put(type, resolver.resolve(type));
            } catch (ReflectiveOperationException | LinkageError e) {
                logger.error("Could not find implementation of action {}: {}", type, e.toString());
                throw new FrameworkIncompatibleException(AbstractFrameworkExecutor.INVALID_FRAMEWORK_MESSAGE, e);
            }
        }
        return new ActionRegistry(actions);
    }

    /**
     * Returns the member implementing an action.
     *
     * @param type the action
     * @return a constructor or method
     */
    public Executable get(ActionType type) {
        return actions.get(type);
    }
}
