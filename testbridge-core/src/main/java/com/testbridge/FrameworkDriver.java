package com.testbridge;

import java.util.Map;

/**
 * Drives the lifecycle of a single test module through the test framework it was built against.
 *
 * <p>A driver loads exactly one module. All operations other than {@link #load} require
 * a successful load first and fail with {@link InvalidDriverStateException} otherwise.
 * Apart from {@link #stopRun(boolean)}, which may be issued while {@link #run} is in flight,
 * callers must not invoke operations concurrently.
 */
public interface FrameworkDriver extends AutoCloseable {

    /**
     * Returns the ID used to prefix every test identifier the framework creates.
     *
     * @return the ID, possibly empty
     */
    String getId();

    /**
     * Sets the ID used to prefix test identifiers. Must be called before {@link #load}.
     *
     * @param id the ID; null or empty means identifiers are not prefixed
     */
    void setId(String id);

    /**
     * Loads the tests in a module.
     *
     * @param modulePath location of the test module, a path or a file URI
     * @param settings framework settings, passed once to the framework controller
     * @return an XML string describing the loaded tests
     * @throws PathResolutionException if the location cannot be resolved
     * @throws ModuleLoadException if the module or its framework cannot be read
     * @throws FrameworkIncompatibleException if the framework contract does not match
     */
    String load(String modulePath, Map<String, Object> settings);

    /**
     * Counts the test cases selected by a filter.
     *
     * @param filter the XML test filter
     * @return the number of test cases
     */
    int countTestCases(String filter);

    /**
     * Executes the tests selected by a filter.
     *
     * @param listener receives progress notifications during the run
     * @param filter the XML test filter
     * @return an XML string representing the result
     */
    String run(TestEventListener listener, String filter);

    /**
     * Returns information about the tests selected by a filter.
     *
     * @param filter the XML test filter
     * @return an XML string representing the tests
     */
    String explore(String filter);

    /**
     * Cancels the ongoing test run. If no run is in flight the framework ignores the call.
     *
     * @param force if true, abort running test threads, otherwise let the current test complete
     */
    void stopRun(boolean force);

    /**
     * Releases the execution context. The driver cannot be used afterwards.
     */
    @Override
    void close();
}
