package com.testbridge;

/**
 * Receives progress notifications while a test run is in flight.
 *
 * <p>Fragments are opaque XML-shaped strings produced by the test framework.
 * They arrive in the order the framework emitted them, one call at a time.
 */
@FunctionalInterface
public interface TestEventListener {

    /**
     * Called once per progress notification.
     *
     * @param fragment the event payload
     */
    void onTestEvent(String fragment);
}
