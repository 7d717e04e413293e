package org.demangler.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Watches the logs of each test through a Logback turbo filter.
 * <p>
 * A test fails if it logs at WARN or above without a matching {@link AllowLog}, or if an
 * {@link ExpectLog} is not satisfied. Expectations may target DEBUG events: the filter sees
 * every event before the logger level is applied.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter();
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        AllowLog[] allows = allowLogs(context);
        ExpectLog[] expects = context.getRequiredTestMethod().getAnnotationsByType(ExpectLog.class);
        List<CapturedEvent> events = filter.events();

        List<String> problems = new ArrayList<>();
        for (CapturedEvent event : events) {
            if (event.level.isGreaterOrEqual(Level.WARN) && !isAllowed(event, allows) && !isExpected(event, expects)) {
                problems.add("Unexpected log: " + event);
            }
        }
        for (ExpectLog expect : expects) {
            long count = events.stream().filter(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (count < expect.occurrences()) {
                problems.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static AllowLog[] allowLogs(ExtensionContext context) {
        List<AllowLog> allows = new ArrayList<>();
        context.getTestClass().ifPresent(c -> allows.addAll(List.of(c.getAnnotationsByType(AllowLog.class))));
        context.getTestMethod().ifPresent(m -> allows.addAll(List.of(m.getAnnotationsByType(AllowLog.class))));
        return allows.toArray(new AllowLog[0]);
    }

    private static boolean isAllowed(CapturedEvent event, AllowLog[] allows) {
        for (AllowLog allow : allows) {
            if (matches(event, allow.level(), allow.loggerPattern(), allow.messagePattern())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isExpected(CapturedEvent event, ExpectLog[] expects) {
        for (ExpectLog expect : expects) {
            if (matches(event, expect.level(), expect.loggerPattern(), expect.messagePattern())) {
                return true;
            }
        }
        return false;
    }

    private static boolean matches(CapturedEvent event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level.isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, event.loggerName)
                && Pattern.matches(messagePattern, event.message);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format, Object[] params, Throwable t) {
            // Logback also consults turbo filters for isXxxEnabled() checks, which carry no format.
            if (format != null && level.isGreaterOrEqual(Level.DEBUG)) {
                events.add(new CapturedEvent(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage()));
            }
            return FilterReply.NEUTRAL;
        }

        List<CapturedEvent> events() {
            return new ArrayList<>(events);
        }
    }

    private static final class CapturedEvent {
        final String loggerName;
        final Level level;
        final String message;

        CapturedEvent(String loggerName, Level level, String message) {
            this.loggerName = loggerName;
            this.level = level;
            this.message = message != null ? message : "";
        }

        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }
}
