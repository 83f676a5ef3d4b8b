package com.e2eq.restcore.util;

import io.quarkus.logging.Log;
import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Consistent exception logging for repositories and exception mappers.
 */
public class ExceptionLoggingUtils {

    /**
     * Log exception with full stack trace at ERROR level
     *
     * @param exception the exception to log, may be null
     * @param message the message format string, {@link String#format} style
     * @param args optional arguments for message formatting
     */
    public static void logError(Throwable exception, String message, Object... args) {
        String formatted = format(message, args);
        if (exception == null) {
            Log.error(formatted);
            return;
        }
        Log.errorf("%s: %s%n%s", formatted, describe(exception), getStackTrace(exception));
    }

    /**
     * Log exception with full stack trace at WARN level
     */
    public static void logWarn(Throwable exception, String message, Object... args) {
        String formatted = format(message, args);
        if (exception == null) {
            Log.warn(formatted);
            return;
        }
        Log.warnf("%s: %s%n%s", formatted, describe(exception), getStackTrace(exception));
    }

    public static void logDebug(Throwable exception, String message, Object... args) {
        if (!Log.isDebugEnabled()) {
            return;
        }
        String formatted = format(message, args);
        if (exception == null) {
            Log.debug(formatted);
            return;
        }
        Log.debugf("%s: %s%n%s", formatted, describe(exception), getStackTrace(exception));
    }

    /**
     * Get stack trace as string
     *
     * @param exception the exception
     * @return stack trace as string, empty for null
     */
    public static String getStackTrace(Throwable exception) {
        if (exception == null) {
            return "";
        }
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        exception.printStackTrace(pw);
        return sw.toString();
    }

    /**
     * Log an exception that was handled by falling back to a default, at DEBUG level.
     *
     * @param exception the exception that was ignored
     * @param context where it happened, e.g. the operation name
     */
    public static void logIgnoredException(Throwable exception, String context) {
        if (Log.isDebugEnabled() && exception != null) {
            Log.debugf(exception, "Exception ignored in %s: %s", context, describe(exception));
        }
    }

    static String format(String message, Object... args) {
        if (message == null) {
            return "";
        }
        return args == null || args.length == 0 ? message : String.format(message, args);
    }

    private static String describe(Throwable exception) {
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName();
    }
}
