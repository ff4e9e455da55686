package io.arrestx.extractor.output;

import com.univocity.parsers.common.TextWritingException;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;
import io.arrestx.extractor.model.ArrestRecord;
import io.arrestx.extractor.model.Charge;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one row per charge; records without charges produce no rows. Address lines are joined with
 * {@code " | "}.
 */
public class CsvRecordWriter implements RecordWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(CsvRecordWriter.class);

    static final List<String> COLUMNS = List.of(
            "name", "identifier", "book_in_date", "booking_no", "description", "address", "source_file");
    private static final String ADDRESS_SEPARATOR = " | ";
    private static final String ROW_END = "\r\n";

    @Override
    public void write(List<ArrestRecord> records, String sourceFile, Path path) {
        Objects.requireNonNull(path, "path");
        int rows = 0;
        try {
            OutputFiles.prepareParent(path);
            try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                CsvWriter csv = new CsvWriter(out, createSettings());
                csv.writeHeaders();
                for (ArrestRecord record : records) {
                    String address = String.join(ADDRESS_SEPARATOR, record.address());
                    for (Charge charge : record.charges()) {
                        csv.writeRow(
                                record.name(),
                                record.identifier().orElse(""),
                                record.bookInDate().map(LocalDate::toString).orElse(""),
                                charge.bookingNo(),
                                charge.description(),
                                address,
                                sourceFile == null ? "" : sourceFile);
                        rows++;
                    }
                }
                csv.flush();
            }
        } catch (IOException | TextWritingException ex) {
            LOGGER.error("Failed to write CSV to {}", path, ex);
            throw new OutputException("Failed to write CSV to " + path, ex);
        }
        LOGGER.info("Wrote {} row(s) to {}", rows, path);
    }

    @Override
    public String format() {
        return "csv";
    }

    static CsvWriterSettings createSettings() {
        CsvWriterSettings settings = new CsvWriterSettings();
        settings.getFormat().setLineSeparator(ROW_END);
        settings.getFormat().setDelimiter(',');
        settings.getFormat().setQuote('"');
        settings.getFormat().setQuoteEscape('"');
        settings.setIgnoreLeadingWhitespaces(false);
        settings.setIgnoreTrailingWhitespaces(false);
        settings.setNormalizeLineEndingsWithinQuotes(false);
        settings.setHeaders(COLUMNS.toArray(new String[0]));
        return settings;
    }
}
