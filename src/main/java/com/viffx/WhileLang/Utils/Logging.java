package com.viffx.WhileLang.Utils;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Logging {
    public static final String ROOT = "com.viffx.WhileLang";

    // Held strongly so the configured level survives garbage collection
    private static final Logger ROOT_LOGGER = Logger.getLogger(ROOT);

    private Logging() {}

    public static void initFormat() {
        System.setProperty("java.util.logging.SimpleFormatter.format",
                           "[%1$tH:%1$tM:%1$tS.%1$tL %4$s %3$s] %5$s%6$s%n");
    }

    /**
     * Sends the parser trace (shifts, reductions, failures) to standard error.
     */
    public static void enableTrace() {
        Handler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        ROOT_LOGGER.setLevel(Level.FINE);
        ROOT_LOGGER.setUseParentHandlers(false);
        for (Handler old : ROOT_LOGGER.getHandlers()) {
            ROOT_LOGGER.removeHandler(old);
        }
        ROOT_LOGGER.addHandler(handler);
    }
}
