package org.elogsync.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test when it logs at WARN or above (configurable with {@link FailOnLog}) unless the log
 * is covered by {@link AllowLog} or {@link ExpectLog}; also fails when an {@link ExpectLog} is not
 * met. Logs from every thread are watched, so worker threads are covered too.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE =
        ExtensionContext.Namespace.create(LogWatchExtension.class.getName());

    @Override
    public void beforeAll(ExtensionContext context) {
        WatchFilter filter = new WatchFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        WatchFilter filter = filter(context);
        if (filter != null) {
            filter.rules = resolveRules(context);
            filter.events.clear();
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        WatchFilter filter = filter(context);
        if (filter == null) {
            return;
        }
        Rules rules = resolveRules(context);
        List<Event> events = new ArrayList<>(filter.events);
        filter.events.clear();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (Event e : events) {
                if (e.level.isGreaterOrEqual(toLogback(rules.minLevel)) && !rules.tolerates(e)) {
                    problems.add("Unexpected log: [" + e.level + "] " + e.logger + " - " + e.message);
                }
            }
        }
        for (ExpectLog expect : rules.expects) {
            long found = events.stream()
                .filter(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern()))
                .count();
            if (found < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                    expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), found));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).remove("filter", WatchFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static WatchFilter filter(ExtensionContext context) {
        return context.getStore(NAMESPACE).get("filter", WatchFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        Optional<AnnotatedElement> element = context.getElement();
        Optional<Class<?>> testClass = context.getTestClass();
        FailOnLog fail = element.map(el -> el.getAnnotation(FailOnLog.class))
            .orElse(testClass.map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));

        List<AllowLog> allows = new ArrayList<>();
        List<ExpectLog> expects = new ArrayList<>();
        testClass.ifPresent(c -> {
            allows.addAll(List.of(c.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(c.getAnnotationsByType(ExpectLog.class)));
        });
        element.filter(el -> !(el instanceof Class<?>)).ifPresent(el -> {
            allows.addAll(List.of(el.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(el.getAnnotationsByType(ExpectLog.class)));
        });
        return new Rules(fail != null ? fail.level() : LogLevel.WARN, fail != null && fail.disabled(), allows, expects);
    }

    private static boolean matches(Event e, LogLevel level, String loggerPattern, String messagePattern) {
        return e.level.isGreaterOrEqual(toLogback(level))
            && Pattern.matches(loggerPattern, e.logger)
            && Pattern.compile(messagePattern, Pattern.DOTALL).matcher(e.message).matches();
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class WatchFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        WatchFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            if (format == null || !level.isGreaterOrEqual(toLogback(rules.minLevel))) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            // Tolerated logs are kept out of the test output.
            return rules.tolerates(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }

    private record Event(String logger, Level level, String message) {
        Event {
            message = message != null ? message : "";
        }
    }

    private record Rules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {
        boolean tolerates(Event e) {
            for (AllowLog allow : allows) {
                if (matches(e, allow.level(), allow.loggerPattern(), allow.messagePattern())) {
                    return true;
                }
            }
            for (ExpectLog expect : expects) {
                if (matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern())) {
                    return true;
                }
            }
            return false;
        }
    }
}
