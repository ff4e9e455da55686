package io.arrestx.extractor.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.arrestx.extractor.model.ArrestRecord;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes all records as one JSON array.
 */
public class JsonRecordWriter implements RecordWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonRecordWriter.class);

    private final ObjectWriter writer;

    public JsonRecordWriter(boolean pretty) {
        ObjectMapper mapper = RecordJson.mapper();
        this.writer = pretty ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    }

    @Override
    public void write(List<ArrestRecord> records, String sourceFile, Path path) {
        Objects.requireNonNull(path, "path");
        List<RecordView> views = records.stream().map(record -> RecordView.of(record, sourceFile)).toList();
        try {
            OutputFiles.prepareParent(path);
            try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                writer.writeValue(out, views);
            }
        } catch (IOException ex) {
            LOGGER.error("Failed to write JSON to {}", path, ex);
            throw new OutputException("Failed to write JSON to " + path, ex);
        }
        LOGGER.info("Wrote {} record(s) to {}", views.size(), path);
    }

    @Override
    public String format() {
        return "json";
    }
}
