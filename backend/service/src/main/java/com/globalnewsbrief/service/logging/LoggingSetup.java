package com.globalnewsbrief.service.logging;

import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public final class LoggingSetup {
    public static final String BASE_LOGGER = "com.globalnewsbrief";

    private LoggingSetup() {
    }

    /**
     * Replaces the root handlers with a single stderr handler at {@code level}, writing JSON lines
     * when {@code json} is set and the JDK's plain format otherwise.
     */
    public static Handler configure(Level level, boolean json) {
        Logger root = Logger.getLogger("");
        for (Handler handler : root.getHandlers()) {
            root.removeHandler(handler);
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(level);
        handler.setFormatter(json ? new JsonLogFormatter() : new SimpleFormatter());
        root.addHandler(handler);
        root.setLevel(level);
        Logger.getLogger(BASE_LOGGER).setLevel(level);
        return handler;
    }

    public static Level parseLevel(String value, Level fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Level.parse(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
