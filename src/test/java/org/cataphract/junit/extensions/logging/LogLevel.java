package org.cataphract.junit.extensions.logging;

/**
 * Log levels the watch extension can reason about.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
