package com.pseudoparser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLF4J logger factory for the parser. Keeps SLF4J from logging its own
 * initialization.
 */
public final class ParserLogger {
    static {
        System.setProperty("slf4j.internal.verbosity", "WARN");
    }

    private ParserLogger() {
        // Utility class
    }

    /**
     * @param clazz Class for which the logger will be used
     * @return an SLF4J Logger instance
     */
    public static Logger getLogger(Class<?> clazz) {
        return LoggerFactory.getLogger(clazz);
    }
}
