package com.testbridge.executor;

import java.util.Objects;

/**
 * A framework controller living in an execution context, with its resolved actions.
 *
 * @param controller the controller instance
 * @param context the context the controller was created in
 * @param actions the action members for this controller
 */
public record ControllerHandle(Object controller, ExecutionContext context, ActionRegistry actions) {

    public ControllerHandle {
        Objects.requireNonNull(controller, "controller");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(actions, "actions");
    }
}
