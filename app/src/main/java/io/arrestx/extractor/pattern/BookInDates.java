package io.arrestx.extractor.pattern;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * Parses the report's {@code M/D/YYYY} dates. Impossible calendar dates are rejected rather than adjusted.
 */
public final class BookInDates {

    private static final DateTimeFormatter REPORT_FORMAT = DateTimeFormatter.ofPattern("M/d/uuuu")
            .withResolverStyle(ResolverStyle.STRICT);

    private BookInDates() {
    }

    public static Optional<LocalDate> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(raw.trim(), REPORT_FORMAT));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }
}
