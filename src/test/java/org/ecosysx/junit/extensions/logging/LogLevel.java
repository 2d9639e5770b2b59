package org.ecosysx.junit.extensions.logging;

import ch.qos.logback.classic.Level;

public enum LogLevel {
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR);

    private final Level logback;

    LogLevel(Level logback) {
        this.logback = logback;
    }

    Level toLogback() {
        return logback;
    }
}
