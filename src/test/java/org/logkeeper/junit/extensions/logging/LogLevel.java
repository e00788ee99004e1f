package org.logkeeper.junit.extensions.logging;

/**
 * Levels that {@link LogWatchExtension} can watch.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
