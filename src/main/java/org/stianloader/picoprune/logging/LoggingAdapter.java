package org.stianloader.picoprune.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Logging facade used by every picoprune component.
 *
 * <p>picoprune is mostly used as a command line tool, but the resolver and the removal
 * classes are usable as a library too. In order not to force a logging backend onto library
 * users, all logging is routed through this class. The default implementation uses SLF4J as the
 * log sink if it exists on the classpath, otherwise it falls back to JUL as defined by
 * {@link java.util.logging.Logger}.
 *
 * <p>Messages use SLF4J-style "{}" placeholders. Arguments that do not map to a placeholder
 * are appended to the end of the message and leftover placeholders are kept as-is.
 * If the last argument is a {@link Throwable}, its stacktrace is logged.
 */
public abstract class LoggingAdapter {

    /**
     * The currently active default logger.
     */
    @NotNull
    static LoggingAdapter currentInstance;

    static {
        LoggingAdapter instance;
        try {
            Class.forName("org.slf4j.LoggerFactory");
            instance = new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            instance = new JULLogAdapter();
        }
        currentInstance = instance;
    }

    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.currentInstance;
    }

    /**
     * Obtains the logger that does not depend on SLF4J, regardless of whether SLF4J is present.
     *
     * @return A {@link java.util.logging} backed adapter.
     */
    @NotNull
    public static LoggingAdapter getJULLogger() {
        return new JULLogAdapter();
    }

    public static void setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter.currentInstance = Objects.requireNonNull(instance);
    }

    public abstract void debug(Class<?> clazz, String message, Object... args);
    public abstract void error(Class<?> clazz, String message, Object... args);
    public abstract void info(Class<?> clazz, String message, Object... args);
    public abstract void warn(Class<?> clazz, String message, Object... args);
}
