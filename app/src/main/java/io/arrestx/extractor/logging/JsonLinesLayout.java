package io.arrestx.extractor.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Logback layout writing one JSON object per event: timestamp, level, logger, thread and message, then the report
 * being extracted as {@code document}, any other MDC entries under {@code mdc} and the stack trace of an attached
 * exception.
 */
public class JsonLinesLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    @Override
    public String doLayout(ILoggingEvent event) {
        StringWriter out = new StringWriter(256);
        try (JsonGenerator generator = JSON_FACTORY.createGenerator(out)) {
            generator.writeStartObject();
            generator.writeStringField("timestamp",
                    ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
            generator.writeStringField("level", event.getLevel().toString());
            generator.writeStringField("logger", event.getLoggerName());
            generator.writeStringField("thread", event.getThreadName());
            generator.writeStringField("message", event.getFormattedMessage());
            Map<String, String> mdc = event.getMDCPropertyMap();
            if (mdc != null && mdc.containsKey(LoggingConfigurator.DOCUMENT_KEY)) {
                generator.writeStringField(LoggingConfigurator.DOCUMENT_KEY, mdc.get(LoggingConfigurator.DOCUMENT_KEY));
            }
            writeOtherMdc(generator, mdc);
            IThrowableProxy throwable = event.getThrowableProxy();
            if (throwable != null) {
                generator.writeStringField("exception", ThrowableProxyUtil.asString(throwable));
            }
            generator.writeEndObject();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to render log event", ex);
        }
        return out.append(CoreConstants.LINE_SEPARATOR).toString();
    }

    private static void writeOtherMdc(JsonGenerator generator, Map<String, String> mdc) throws IOException {
        if (mdc == null || mdc.isEmpty()) {
            return;
        }
        boolean opened = false;
        for (Map.Entry<String, String> entry : mdc.entrySet()) {
            if (LoggingConfigurator.DOCUMENT_KEY.equals(entry.getKey())) {
                continue;
            }
            if (!opened) {
                generator.writeObjectFieldStart("mdc");
                opened = true;
            }
            generator.writeStringField(entry.getKey(), entry.getValue());
        }
        if (opened) {
            generator.writeEndObject();
        }
    }
}
