package org.ecosysx.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colours the level column of console output: ERROR red, WARN yellow, INFO cyan.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String RESET = "\u001B[0m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String colour = colourFor(event.getLevel());
        return colour == null ? in : colour + in + RESET;
    }

    static String colourFor(Level level) {
        switch (level.toInt()) {
            case Level.ERROR_INT:
                return "\u001B[31m";
            case Level.WARN_INT:
                return "\u001B[33m";
            case Level.INFO_INT:
                return "\u001B[36m";
            default:
                return null;
        }
    }
}
