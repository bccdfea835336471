package com.testbridge.executor;

import java.util.function.Consumer;

/**
 * A single invocation of a framework action together with its arguments.
 * Each variant knows how its arguments are laid out for both execution strategies.
 */
public sealed interface FrameworkAction
        permits FrameworkAction.Load, FrameworkAction.Count, FrameworkAction.Explore,
                FrameworkAction.Run, FrameworkAction.StopRun {

    ActionType type();

    /**
     * Arguments placed between the controller and the handler when the action
     * class is constructed.
     */
    Object[] arguments();

    /**
     * Arguments for a direct call of the controller method.
     *
     * @param callback the handler, for methods that report progress
     */
    default Object[] methodArguments(Consumer<String> callback) {
        return arguments();
    }

    static FrameworkAction load() {
        return new Load();
    }

    static FrameworkAction count(String filter) {
        return new Count(filter);
    }

    static FrameworkAction explore(String filter) {
        return new Explore(filter);
    }

    static FrameworkAction run(String filter) {
        return new Run(filter);
    }

    static FrameworkAction stopRun(boolean force) {
        return new StopRun(force);
    }

    record Load() implements FrameworkAction {
        @Override
        public ActionType type() {
            return ActionType.LOAD;
        }

        @Override
        public Object[] arguments() {
            return new Object[0];
        }
    }

    record Count(String filter) implements FrameworkAction {
        @Override
        public ActionType type() {
            return ActionType.COUNT;
        }

        @Override
        public Object[] arguments() {
            return new Object[] { filter };
        }
    }

    record Explore(String filter) implements FrameworkAction {
        @Override
        public ActionType type() {
            return ActionType.EXPLORE;
        }

        @Override
        public Object[] arguments() {
            return new Object[] { filter };
        }
    }

    record Run(String filter) implements FrameworkAction {
        @Override
        public ActionType type() {
            return ActionType.RUN;
        }

        @Override
        public Object[] arguments() {
            return new Object[] { filter };
        }

        @Override
        public Object[] methodArguments(Consumer<String> callback) {
            return new Object[] { callback, filter };
        }
    }

    record StopRun(boolean force) implements FrameworkAction {
        @Override
        public ActionType type() {
            return ActionType.STOP_RUN;
        }

        @Override
        public Object[] arguments() {
            return new Object[] { force };
        }
    }
}
