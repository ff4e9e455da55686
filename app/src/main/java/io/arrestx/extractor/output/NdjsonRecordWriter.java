package io.arrestx.extractor.output;

import com.fasterxml.jackson.databind.ObjectWriter;
import io.arrestx.extractor.model.ArrestRecord;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one compact JSON object per line.
 */
public class NdjsonRecordWriter implements RecordWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(NdjsonRecordWriter.class);

    private final ObjectWriter writer = RecordJson.mapper().writer();

    @Override
    public void write(List<ArrestRecord> records, String sourceFile, Path path) {
        Objects.requireNonNull(path, "path");
        try {
            OutputFiles.prepareParent(path);
            try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                for (ArrestRecord record : records) {
                    out.write(writer.writeValueAsString(RecordView.of(record, sourceFile)));
                    out.newLine();
                }
            }
        } catch (IOException ex) {
            LOGGER.error("Failed to write NDJSON to {}", path, ex);
            throw new OutputException("Failed to write NDJSON to " + path, ex);
        }
        LOGGER.info("Wrote {} line(s) to {}", records.size(), path);
    }

    @Override
    public String format() {
        return "ndjson";
    }
}
