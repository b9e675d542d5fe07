package org.stianloader.picoprune.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

class JULLogAdapter extends LoggingAdapter {

    @NotNull
    @Contract(pure = true)
    static String formatMessage(@NotNull String message, Object... args) {
        StringBuilder builder = new StringBuilder();
        String remainder = message;
        for (int i = 0; i < args.length; i++) {
            Object arg = args[i];
            int placeholder = remainder.indexOf("{}");
            if (placeholder != -1 && !(i == (args.length - 1) && arg instanceof Throwable)) {
                builder.append(remainder, 0, placeholder).append(Objects.toString(arg));
                remainder = remainder.substring(placeholder + 2);
                continue;
            }
            builder.append(remainder);
            remainder = "";
            if (arg instanceof Throwable) {
                StringWriter sw = new StringWriter();
                ((Throwable) arg).printStackTrace(new PrintWriter(sw));
                builder.append('\n').append(sw);
            } else {
                builder.append(' ').append(Objects.toString(arg));
            }
        }
        builder.append(remainder);
        return builder.toString();
    }

    private static void log(Class<?> clazz, Level level, String message, Object... args) {
        Logger logger = Logger.getLogger(clazz.getName());
        if (logger.isLoggable(level)) {
            logger.log(level, JULLogAdapter.formatMessage(message, args));
        }
    }

    @Override
    public void debug(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.FINE, message, args);
    }

    @Override
    public void error(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.SEVERE, message, args);
    }

    @Override
    public void info(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.INFO, message, args);
    }

    @Override
    public void warn(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.WARNING, message, args);
    }
}
