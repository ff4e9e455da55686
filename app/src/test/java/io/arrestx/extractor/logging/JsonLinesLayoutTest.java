package io.arrestx.extractor.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonLinesLayoutTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final LoggerContext context = new LoggerContext();

    @Test
    void formatsEventAsJson() throws Exception {
        JsonLinesLayout layout = startedLayout();
        LoggingEvent event = event("Extracted \"3\" record(s)");

        String json = layout.doLayout(event);

        assertThat(json).endsWith(System.lineSeparator());
        JsonNode node = mapper.readTree(json);
        assertThat(node.get("message").asText()).isEqualTo("Extracted \"3\" record(s)");
        assertThat(node.get("logger").asText()).isEqualTo("io.arrestx.extractor.engine.ExtractionEngine");
        assertThat(node.get("level").asText()).isEqualTo("INFO");
        assertThat(node.get("thread").asText()).isEqualTo("main");
        assertThat(node.get("timestamp").asText()).isEqualTo("1970-01-01T00:00:00Z");
        assertThat(node.has("mdc")).isFalse();
        assertThat(node.has("document")).isFalse();
        assertThat(node.has("exception")).isFalse();
    }

    @Test
    void includesMdcAndException() throws Exception {
        JsonLinesLayout layout = startedLayout();
        LoggingEvent event = event("write failed");
        event.setMDCPropertyMap(Map.of(LoggingConfigurator.DOCUMENT_KEY, "report.pdf", "run", "7"));
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("disk full")));

        JsonNode node = mapper.readTree(layout.doLayout(event));

        assertThat(node.get("document").asText()).isEqualTo("report.pdf");
        assertThat(node.get("mdc").get("run").asText()).isEqualTo("7");
        assertThat(node.get("mdc").has(LoggingConfigurator.DOCUMENT_KEY)).isFalse();
        assertThat(node.get("exception").asText()).contains("IllegalStateException").contains("disk full");
    }

    private JsonLinesLayout startedLayout() {
        context.start();
        JsonLinesLayout layout = new JsonLinesLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private LoggingEvent event(String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("io.arrestx.extractor.engine.ExtractionEngine");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}
