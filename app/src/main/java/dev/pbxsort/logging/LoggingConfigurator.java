package dev.pbxsort.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import dev.pbxsort.config.LogFormat;
import org.slf4j.LoggerFactory;

/**
 * Applies the run's logging options to the logback setup loaded from {@code logback.xml}: the console encoder
 * format and the root level.
 */
public final class LoggingConfigurator {

    private static final String TEXT_PATTERN = "%-5level %msg%n";
    private static final String VERBOSE_TEXT_PATTERN =
            "%d{HH:mm:ss.SSS} %-5level %logger{36} [%X{" + SimpleJsonLayout.MDC_PROJECT_FILE + "}] - %msg%n";

    private LoggingConfigurator() {
    }

    public static void configure(LogFormat format, boolean warningsEnabled, boolean verbose) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(levelFor(warningsEnabled, verbose));
        for (var iterator = root.iteratorForAppenders(); iterator.hasNext(); ) {
            Appender<ILoggingEvent> appender = iterator.next();
            if (appender instanceof OutputStreamAppender<ILoggingEvent> outputStreamAppender) {
                switch (format) {
                    case JSON -> applyJsonEncoder(context, outputStreamAppender);
                    case TEXT -> applyTextEncoder(context, outputStreamAppender, verbose ? VERBOSE_TEXT_PATTERN : TEXT_PATTERN);
                }
            }
        }
    }

    static Level levelFor(boolean warningsEnabled, boolean verbose) {
        if (verbose) {
            return Level.DEBUG;
        }
        return warningsEnabled ? Level.INFO : Level.ERROR;
    }

    private static void applyJsonEncoder(LoggerContext context,
                                         OutputStreamAppender<ILoggingEvent> appender) {
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
        encoder.setContext(context);
        encoder.setLayout(layout);
        encoder.start();
        restartAppender(appender, encoder);
    }

    private static void applyTextEncoder(LoggerContext context,
                                         OutputStreamAppender<ILoggingEvent> appender,
                                         String pattern) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(pattern);
        encoder.start();
        restartAppender(appender, encoder);
    }

    private static void restartAppender(OutputStreamAppender<ILoggingEvent> appender, Encoder<ILoggingEvent> encoder) {
        boolean running = appender.isStarted();
        if (running) {
            appender.stop();
        }
        appender.setEncoder(encoder);
        if (running) {
            appender.start();
        }
    }
}
