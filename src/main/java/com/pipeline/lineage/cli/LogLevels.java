package com.pipeline.lineage.cli;

import java.util.Locale;
import java.util.Set;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

/**
 * Applies the {@code --log-level} option to the Logback root logger.
 */
public final class LogLevels {

    private static final Set<String> NAMES = Set.of("TRACE", "DEBUG", "INFO", "WARN", "WARNING", "ERROR", "OFF");

    private LogLevels() {
    }

    public static boolean isValid(String name) {
        return name != null && NAMES.contains(name.strip().toUpperCase(Locale.ROOT));
    }

    public static void apply(String name) {
        String normalized = name == null ? "INFO" : name.strip().toUpperCase(Locale.ROOT);
        if (normalized.equals("WARNING")) {
            normalized = "WARN";
        }
        if (LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME) instanceof Logger root) {
            root.setLevel(Level.toLevel(normalized, Level.INFO));
        }
    }
}
