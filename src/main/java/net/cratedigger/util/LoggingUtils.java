package net.cratedigger.util;

import java.util.Arrays;
import org.slf4j.Logger;

/**
 * Helpers for logging warnings and errors with an optional cause appended as
 * the trailing SLF4J argument.
 */
public final class LoggingUtils {

    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable cause, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        logger.error(message, withCause(cause, args));
    }

    public static void warn(Logger logger, Throwable cause, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        logger.warn(message, withCause(cause, args));
    }

    private static Object[] withCause(Throwable cause, Object[] args) {
        Object[] base = args == null ? new Object[0] : args;
        if (cause == null) {
            return base;
        }
        Object[] combined = Arrays.copyOf(base, base.length + 1);
        combined[base.length] = cause;
        return combined;
    }
}
