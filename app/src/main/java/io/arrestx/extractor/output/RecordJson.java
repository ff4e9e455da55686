package io.arrestx.extractor.output;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.arrestx.extractor.model.PageSpan;
import java.io.IOException;

/**
 * Shared Jackson setup for record output: snake_case property names, ISO-8601 dates, empty optionals as
 * {@code null} and page spans as two-element arrays.
 */
final class RecordJson {

    private RecordJson() {
    }

    static ObjectMapper mapper() {
        SimpleModule pageSpans = new SimpleModule("page-span");
        pageSpans.addSerializer(PageSpan.class, new PageSpanSerializer());
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .registerModule(new Jdk8Module())
                .registerModule(new JavaTimeModule())
                .registerModule(pageSpans);
    }

    private static final class PageSpanSerializer extends StdSerializer<PageSpan> {

        private PageSpanSerializer() {
            super(PageSpan.class);
        }

        @Override
        public void serialize(PageSpan value, JsonGenerator generator, SerializerProvider provider)
                throws IOException {
            generator.writeStartArray();
            generator.writeNumber(value.firstPage());
            generator.writeNumber(value.lastPage());
            generator.writeEndArray();
        }
    }
}
