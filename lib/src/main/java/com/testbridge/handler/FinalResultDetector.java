package com.testbridge.handler;

/**
 * Recognises the message that carries the final result of a test run.
 * Every other run notification is treated as progress.
 */
@FunctionalInterface
public interface FinalResultDetector {

    /**
     * Matches a message whose root element is {@code test-run}, or {@code test-suite}
     * with {@code type="Assembly"}.
     */
    FinalResultDetector DEFAULT = message ->
            hasRootElement(message, "test-run")
                    || (hasRootElement(message, "test-suite") && startTag(message).contains("type=\"Assembly\""));

    /**
     * Checks whether a run notification is the final result.
     *
     * @param message the notification
     * @return true if this message is the terminal result of the run
     */
    boolean isFinalResult(String message);

    /**
     * Creates a detector that matches a single root element name.
     *
     * @param elementName the element name, without angle brackets
     * @return the detector
     */
    static FinalResultDetector rootElement(String elementName) {
        return message -> hasRootElement(message, elementName);
    }

    private static boolean hasRootElement(String message, String elementName) {
        if (message == null) {
            return false;
        }
        String trimmed = message.stripLeading();
        int end = elementName.length() + 1;
        if (!trimmed.startsWith("<" + elementName)) {
            return false;
        }
        if (trimmed.length() == end) {
            return false;
        }
        char next = trimmed.charAt(end);
        return next == '>' || next == '/' || Character.isWhitespace(next);
    }

    private static String startTag(String message) {
        String trimmed = message.stripLeading();
        int close = trimmed.indexOf('>');
        return close < 0 ? trimmed : trimmed.substring(0, close);
    }
}
