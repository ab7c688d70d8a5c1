package io.eventlog.util;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Formatting of exceptions for persistence in failure records.
 */
public final class Errors {
    /** Column limit for stored error messages and traces. */
    public static final int MAX_ERROR_LENGTH = 4000;

    private Errors() {
    }

    /**
     * Returns the exception message, falling back to its class name when the message is empty.
     */
    public static String message(Throwable error) {
        if (error == null) {
            return null;
        }
        String message = error.getMessage();
        String text = message == null || message.isEmpty()
                ? error.getClass().getName()
                : error.getClass().getSimpleName() + ": " + message;
        return truncate(text);
    }

    /**
     * Returns the full stack trace, truncated to {@link #MAX_ERROR_LENGTH} characters.
     */
    public static String stackTrace(Throwable error) {
        if (error == null) {
            return null;
        }
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return truncate(out.toString());
    }

    public static String truncate(String text) {
        if (text == null || text.length() <= MAX_ERROR_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
