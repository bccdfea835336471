package com.testbridge.executor;

import java.util.function.Consumer;

/**
 * The closed set of actions a framework controller supports.
 *
 * <p>Each action is known to the framework under two names: a nested action class of the
 * controller, constructed inside an isolated context with
 * {@code (controller, arguments..., Consumer<String> handler)}, and a controller method
 * invoked directly in-process.
 */
public enum ActionType {
    LOAD("LoadTestsAction", "loadTests",
            new Class<?>[0], new Class<?>[0]),
    COUNT("CountTestsAction", "countTests",
            new Class<?>[] { String.class }, new Class<?>[] { String.class }),
    EXPLORE("ExploreTestsAction", "exploreTests",
            new Class<?>[] { String.class }, new Class<?>[] { String.class }),
    RUN("RunTestsAction", "runTests",
            new Class<?>[] { String.class }, new Class<?>[] { Consumer.class, String.class }),
    STOP_RUN("StopRunAction", "stopRun",
            new Class<?>[] { boolean.class }, new Class<?>[] { boolean.class });

    private final String actionClassName;
    private final String methodName;
    private final Class<?>[] argumentTypes;
    private final Class<?>[] methodParameterTypes;

    ActionType(String actionClassName, String methodName, Class<?>[] argumentTypes, Class<?>[] methodParameterTypes) {
        this.actionClassName = actionClassName;
        this.methodName = methodName;
        this.argumentTypes = argumentTypes;
        this.methodParameterTypes = methodParameterTypes;
    }

    /**
     * Returns the binary name of the action class nested in a controller type.
     *
     * @param controllerTypeName the controller's binary name
     * @return for example {@code com.example.FrameworkController$RunTestsAction}
     */
    public String actionTypeName(String controllerTypeName) {
        return controllerTypeName + "$" + actionClassName;
    }

    /**
     * Returns the constructor signature of the action class.
     *
     * @param controllerType the controller class as loaded in the execution context
     * @return controller type, argument types, then the handler type
     */
    public Class<?>[] constructorParameterTypes(Class<?> controllerType) {
        Class<?>[] types = new Class<?>[argumentTypes.length + 2];
        types[0] = controllerType;
        System.arraycopy(argumentTypes, 0, types, 1, argumentTypes.length);
        types[types.length - 1] = Consumer.class;
        return types;
    }

    public String getActionClassName() {
        return actionClassName;
    }

    public String getMethodName() {
        return methodName;
    }

    public Class<?>[] getMethodParameterTypes() {
        return methodParameterTypes.clone();
    }
}
