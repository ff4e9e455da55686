package io.arrestx.extractor.output;

import io.arrestx.extractor.model.ArrestRecord;
import java.nio.file.Path;
import java.util.List;

/**
 * Serializes extracted records to a file, creating parent directories as needed.
 */
public interface RecordWriter {

    /**
     * @param sourceFile name of the report the records came from, written alongside every record
     * @throws OutputException when the file cannot be written
     */
    void write(List<ArrestRecord> records, String sourceFile, Path path);

    String format();
}
