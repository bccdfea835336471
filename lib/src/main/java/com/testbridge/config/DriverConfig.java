package com.testbridge.config;

import com.testbridge.dispatcher.MailboxType;
import com.testbridge.executor.ExecutionStrategy;
import com.testbridge.handler.FinalResultDetector;
import com.testbridge.module.FileUriPathResolver;
import com.testbridge.module.PathResolver;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a framework driver.
 * Controls how modules are located, which execution strategy hosts the framework controller,
 * and how progress notifications are forwarded during a run.
 */
public class DriverConfig {
    // Default values for driver configuration
    public static final ExecutionStrategy DEFAULT_EXECUTION_STRATEGY = ExecutionStrategy.ISOLATED;
    public static final String DEFAULT_FRAMEWORK_MODULE_NAME = "testbridge-framework.jar";
    public static final String DEFAULT_CONTROLLER_TYPE_NAME = "com.testbridge.framework.api.FrameworkController";
    public static final MailboxType DEFAULT_PROGRESS_MAILBOX_TYPE = MailboxType.CONCURRENT_LINKED;
    public static final int DEFAULT_PROGRESS_THROUGHPUT = 64;

    private ExecutionStrategy executionStrategy;
    private String frameworkModuleName;
    private String controllerTypeName;
    private MailboxType progressMailboxType;
    private int progressThroughput;
    private FinalResultDetector finalResultDetector;
    private PathResolver pathResolver;
    private Duration resultTimeout;
    private ClassLoader inProcessParentClassLoader;

    /**
     * Creates a new DriverConfig with default values.
     */
    public DriverConfig() {
        this.executionStrategy = DEFAULT_EXECUTION_STRATEGY;
        this.frameworkModuleName = DEFAULT_FRAMEWORK_MODULE_NAME;
        this.controllerTypeName = DEFAULT_CONTROLLER_TYPE_NAME;
        this.progressMailboxType = DEFAULT_PROGRESS_MAILBOX_TYPE;
        this.progressThroughput = DEFAULT_PROGRESS_THROUGHPUT;
        this.finalResultDetector = FinalResultDetector.DEFAULT;
        this.pathResolver = new FileUriPathResolver();
        this.resultTimeout = null;
        this.inProcessParentClassLoader = null;
    }

    /**
     * Sets the strategy used to host the framework controller.
     *
     * @param executionStrategy in-process or isolated
     * @return This DriverConfig instance
     */
    public DriverConfig setExecutionStrategy(ExecutionStrategy executionStrategy) {
        this.executionStrategy = Objects.requireNonNull(executionStrategy, "executionStrategy");
        return this;
    }

    /**
     * Sets the file name of the framework module expected next to every test module.
     *
     * @param frameworkModuleName the jar file name
     * @return This DriverConfig instance
     */
    public DriverConfig setFrameworkModuleName(String frameworkModuleName) {
        this.frameworkModuleName = Objects.requireNonNull(frameworkModuleName, "frameworkModuleName");
        return this;
    }

    /**
     * Sets the fully qualified name of the framework controller type.
     * Action types are looked up as nested classes of this type.
     *
     * @param controllerTypeName the binary class name
     * @return This DriverConfig instance
     */
    public DriverConfig setControllerTypeName(String controllerTypeName) {
        this.controllerTypeName = Objects.requireNonNull(controllerTypeName, "controllerTypeName");
        return this;
    }

    /**
     * Sets the queue implementation used to buffer progress notifications.
     *
     * @param progressMailboxType the mailbox type
     * @return This DriverConfig instance
     */
    public DriverConfig setProgressMailboxType(MailboxType progressMailboxType) {
        this.progressMailboxType = Objects.requireNonNull(progressMailboxType, "progressMailboxType");
        return this;
    }

    /**
     * Sets the maximum number of progress notifications delivered per runner activation.
     *
     * @param progressThroughput the batch size, at least 1
     * @return This DriverConfig instance
     */
    public DriverConfig setProgressThroughput(int progressThroughput) {
        if (progressThroughput < 1) {
            throw new IllegalArgumentException("progressThroughput must be at least 1, got: " + progressThroughput);
        }
        this.progressThroughput = progressThroughput;
        return this;
    }

    /**
     * Sets the predicate that recognises the final result among run notifications.
     *
     * @param finalResultDetector the detector
     * @return This DriverConfig instance
     */
    public DriverConfig setFinalResultDetector(FinalResultDetector finalResultDetector) {
        this.finalResultDetector = Objects.requireNonNull(finalResultDetector, "finalResultDetector");
        return this;
    }

    /**
     * Sets the resolver used to turn module location descriptors into paths.
     *
     * @param pathResolver the resolver
     * @return This DriverConfig instance
     */
    public DriverConfig setPathResolver(PathResolver pathResolver) {
        this.pathResolver = Objects.requireNonNull(pathResolver, "pathResolver");
        return this;
    }

    /**
     * Sets how long to wait for the terminal result of an action.
     * A null timeout waits indefinitely.
     *
     * @param resultTimeout the timeout, or null
     * @return This DriverConfig instance
     */
    public DriverConfig setResultTimeout(Duration resultTimeout) {
        this.resultTimeout = resultTimeout;
        return this;
    }

    /**
     * Sets the parent class loader for in-process execution contexts.
     * When unset, the class loader that loaded the driver is used.
     *
     * @param inProcessParentClassLoader the parent loader, or null for the default
     * @return This DriverConfig instance
     */
    public DriverConfig setInProcessParentClassLoader(ClassLoader inProcessParentClassLoader) {
        this.inProcessParentClassLoader = inProcessParentClassLoader;
        return this;
    }

    public ExecutionStrategy getExecutionStrategy() {
        return executionStrategy;
    }

    public String getFrameworkModuleName() {
        return frameworkModuleName;
    }

    public String getControllerTypeName() {
        return controllerTypeName;
    }

    public MailboxType getProgressMailboxType() {
        return progressMailboxType;
    }

    public int getProgressThroughput() {
        return progressThroughput;
    }

    public FinalResultDetector getFinalResultDetector() {
        return finalResultDetector;
    }

    public PathResolver getPathResolver() {
        return pathResolver;
    }

    public Duration getResultTimeout() {
        return resultTimeout;
    }

    public ClassLoader getInProcessParentClassLoader() {
        return inProcessParentClassLoader != null
                ? inProcessParentClassLoader
                : DriverConfig.class.getClassLoader();
    }

    @Override
    public String toString() {
        return "DriverConfig{" +
                "executionStrategy=" + executionStrategy +
                ", frameworkModuleName='" + frameworkModuleName + '\'' +
                ", controllerTypeName='" + controllerTypeName + '\'' +
                ", progressMailboxType=" + progressMailboxType +
                ", progressThroughput=" + progressThroughput +
                ", resultTimeout=" + resultTimeout +
                '}';
    }
}
