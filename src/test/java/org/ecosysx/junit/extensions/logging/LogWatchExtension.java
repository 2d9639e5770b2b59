package org.ecosysx.junit.extensions.logging;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

/**
 * Fails a test that logs at WARN or above unless the event is covered by {@link AllowLog} or
 * {@link ExpectLog}, and fails it when an {@link ExpectLog} never matched.
 * <p>
 * Annotations on the test class and the test method are combined. Allowed and expected events are
 * captured but not written to the console.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeEach(ExtensionContext context) {
        List<AllowLog> allows = new ArrayList<>();
        List<ExpectLog> expects = new ArrayList<>();
        context.getTestClass().ifPresent(c -> collect(c, allows, expects));
        context.getTestMethod().ifPresent(m -> collect(m, allows, expects));

        CapturingFilter filter = new CapturingFilter(allows, expects);
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove("filter", CapturingFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        List<String> problems = new ArrayList<>();
        for (Captured event : filter.events) {
            if (!event.covered && event.level.isGreaterOrEqual(Level.WARN)) {
                problems.add("Unexpected log: " + event);
            }
        }
        for (ExpectLog expect : filter.expects) {
            boolean seen = filter.events.stream().anyMatch(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern()));
            if (!seen) {
                problems.add("Missing expected log: [" + expect.level() + "] " + expect.messagePattern());
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static void collect(AnnotatedElement element, List<AllowLog> allows, List<ExpectLog> expects) {
        allows.addAll(List.of(element.getAnnotationsByType(AllowLog.class)));
        expects.addAll(List.of(element.getAnnotationsByType(ExpectLog.class)));
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static boolean matches(Captured event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level.isGreaterOrEqual(level.toLogback())
                && Pattern.matches(loggerPattern, event.logger)
                && Pattern.compile(messagePattern, Pattern.DOTALL).matcher(event.message).matches();
    }

    private static final class Captured {
        final String logger;
        final Level level;
        final String message;
        final boolean covered;

        Captured(String logger, Level level, String message, boolean covered) {
            this.logger = logger;
            this.level = level;
            this.message = message;
            this.covered = covered;
        }

        @Override
        public String toString() {
            return "[" + level + "] " + logger + " - " + message;
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        final List<AllowLog> allows;
        final List<ExpectLog> expects;
        final List<Captured> events = new CopyOnWriteArrayList<>();

        CapturingFilter(List<AllowLog> allows, List<ExpectLog> expects) {
            this.allows = allows;
            this.expects = expects;
        }

        @Override
        public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
            // Logback also consults turbo filters for isXxxEnabled() checks, which carry no format.
            if (format == null || !level.isGreaterOrEqual(Level.INFO)) {
                return FilterReply.NEUTRAL;
            }
            String message = MessageFormatter.arrayFormat(format, params).getMessage();
            Captured probe = new Captured(logger.getName(), level, message, false);
            boolean covered = allows.stream().anyMatch(a -> matches(probe, a.level(), a.loggerPattern(), a.messagePattern()))
                    || expects.stream().anyMatch(e -> matches(probe, e.level(), e.loggerPattern(), e.messagePattern()));
            events.add(new Captured(logger.getName(), level, message, covered));
            return covered ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
