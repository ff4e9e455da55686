package io.arrestx.extractor.logging;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import io.arrestx.extractor.config.LogFormat;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Selects the console encoding for the run and owns the logging context key that carries the report being
 * extracted.
 *
 * <p>Both encodings surface {@link #DOCUMENT_KEY}: the text pattern prints it in brackets after the level and the
 * JSON layout writes it as a top-level {@code document} field. Appenders attached to the root logger and to the
 * application logger are switched; each appender is switched once even when attached to both.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    /** MDC key holding the source name of the report currently being extracted. */
    public static final String DOCUMENT_KEY = "document";

    static final String APPLICATION_LOGGER = "io.arrestx.extractor";
    static final String TEXT_PATTERN =
            "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%X{" + DOCUMENT_KEY + ":-}] %logger{36} - %msg%n";

    private LoggingConfigurator() {
    }

    /**
     * @return number of appenders whose encoder was replaced; zero when Logback is not the bound backend
     */
    public static int configure(LogFormat format) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            return 0;
        }
        List<OutputStreamAppender<ILoggingEvent>> appenders = streamAppenders(context);
        for (OutputStreamAppender<ILoggingEvent> appender : appenders) {
            swapEncoder(appender, format == LogFormat.JSON ? jsonEncoder(context) : textEncoder(context));
        }
        LOGGER.debug("Console logging set to {} on {} appender(s)", format, appenders.size());
        return appenders.size();
    }

    private static List<OutputStreamAppender<ILoggingEvent>> streamAppenders(LoggerContext context) {
        Set<Appender<ILoggingEvent>> seen = new LinkedHashSet<>();
        for (String name : List.of(Logger.ROOT_LOGGER_NAME, APPLICATION_LOGGER)) {
            Iterator<Appender<ILoggingEvent>> iterator = context.getLogger(name).iteratorForAppenders();
            iterator.forEachRemaining(seen::add);
        }
        List<OutputStreamAppender<ILoggingEvent>> result = new ArrayList<>();
        for (Appender<ILoggingEvent> appender : seen) {
            if (appender instanceof OutputStreamAppender<ILoggingEvent> streamAppender) {
                result.add(streamAppender);
            }
        }
        return result;
    }

    private static Encoder<ILoggingEvent> jsonEncoder(LoggerContext context) {
        JsonLinesLayout layout = new JsonLinesLayout();
        layout.setContext(context);
        layout.start();
        LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
        encoder.setContext(context);
        encoder.setLayout(layout);
        encoder.start();
        return encoder;
    }

    private static Encoder<ILoggingEvent> textEncoder(LoggerContext context) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }

    private static void swapEncoder(OutputStreamAppender<ILoggingEvent> appender, Encoder<ILoggingEvent> encoder) {
        Encoder<ILoggingEvent> previous = appender.getEncoder();
        boolean running = appender.isStarted();
        if (running) {
            appender.stop();
        }
        appender.setEncoder(encoder);
        if (previous != null && previous != encoder) {
            previous.stop();
        }
        if (running) {
            appender.start();
        }
    }
}
