package com.reactive.xray.observe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * SLF4J-backed implementation of {@link Log}.
 *
 * ALL SLF4J types are confined to this class.
 */
final class LogImpl {

    private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);
    private static final ConcurrentMap<Class<?>, Logger> LOGGERS = new ConcurrentHashMap<>();

    private static final String LOG_CLASS = Log.class.getName();
    private static final String IMPL_CLASS = LogImpl.class.getName();

    // ========================================================================
    // Debug
    // ========================================================================

    boolean isDebugEnabled() {
        return getCallerLogger().isDebugEnabled();
    }

    void debug(String message) {
        getCallerLogger().debug(message);
    }

    void debug(String format, Object arg) {
        getCallerLogger().debug(format, arg);
    }

    void debug(String format, Object arg1, Object arg2) {
        getCallerLogger().debug(format, arg1, arg2);
    }

    // ========================================================================
    // Info (always logged)
    // ========================================================================

    void info(String message) {
        getCallerLogger().info(message);
    }

    void info(String format, Object arg) {
        getCallerLogger().info(format, arg);
    }

    void info(String format, Object arg1, Object arg2) {
        getCallerLogger().info(format, arg1, arg2);
    }

    void info(String format, Object... args) {
        getCallerLogger().info(format, args);
    }

    // ========================================================================
    // Warn (always logged)
    // ========================================================================

    void warn(String message) {
        getCallerLogger().warn(message);
    }

    void warn(String format, Object arg) {
        getCallerLogger().warn(format, arg);
    }

    void warn(String format, Object arg1, Object arg2) {
        getCallerLogger().warn(format, arg1, arg2);
    }

    void warn(String format, Object... args) {
        getCallerLogger().warn(format, args);
    }

    // ========================================================================
    // Error (always logged)
    // ========================================================================

    void error(String message) {
        getCallerLogger().error(message);
    }

    void error(String message, Throwable t) {
        getCallerLogger().error(message, t);
    }

    void error(String format, Object... args) {
        getCallerLogger().error(format, args);
    }

    // ========================================================================
    // Helper
    // ========================================================================

    private Logger getCallerLogger() {
        Class<?> callerClass = WALKER.walk(frames -> frames
                .map(StackWalker.StackFrame::getDeclaringClass)
                .filter(c -> !c.getName().equals(LOG_CLASS) && !c.getName().equals(IMPL_CLASS))
                .findFirst()
                .orElse(LogImpl.class));

        return LOGGERS.computeIfAbsent(callerClass, LoggerFactory::getLogger);
    }
}
