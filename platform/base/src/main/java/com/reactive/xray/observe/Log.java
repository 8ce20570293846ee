package com.reactive.xray.observe;

/**
 * Unified logging API for the whole project.
 *
 * NO third-party types in this interface.
 * SLF4J details are hidden in the implementation; the logger name is the
 * calling class, so output reads as if each class held its own logger.
 *
 * Usage:
 *   import static com.reactive.xray.observe.Log.*;
 *
 *   info("Segment emitted: {}", segmentId);
 *   warn("Emitter unavailable: {}", detail);
 *   error("Failed to open segment", exception);
 */
public final class Log {

    private static final LogImpl impl = new LogImpl();

    private Log() {}

    // ========================================================================
    // Debug
    // ========================================================================

    public static boolean isDebugEnabled() {
        return impl.isDebugEnabled();
    }

    public static void debug(String message) {
        impl.debug(message);
    }

    public static void debug(String format, Object arg) {
        impl.debug(format, arg);
    }

    public static void debug(String format, Object arg1, Object arg2) {
        impl.debug(format, arg1, arg2);
    }

    // ========================================================================
    // Always-On Logging (Production)
    // ========================================================================

    public static void info(String message) {
        impl.info(message);
    }

    public static void info(String format, Object arg) {
        impl.info(format, arg);
    }

    public static void info(String format, Object arg1, Object arg2) {
        impl.info(format, arg1, arg2);
    }

    public static void info(String format, Object... args) {
        impl.info(format, args);
    }

    public static void warn(String message) {
        impl.warn(message);
    }

    public static void warn(String format, Object arg) {
        impl.warn(format, arg);
    }

    public static void warn(String format, Object arg1, Object arg2) {
        impl.warn(format, arg1, arg2);
    }

    public static void warn(String format, Object... args) {
        impl.warn(format, args);
    }

    public static void error(String message) {
        impl.error(message);
    }

    public static void error(String message, Throwable t) {
        impl.error(message, t);
    }

    public static void error(String format, Object... args) {
        impl.error(format, args);
    }
}
