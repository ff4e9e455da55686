package io.arrestx.extractor.pattern;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of classifying one line: the winning {@link LineKind} plus whatever the recognizer captured.
 */
public record LineClassification(
        LineKind kind,
        String text,
        Optional<NameMatch> name,
        Optional<IdDateMatch> idDate,
        Optional<BookingMatch> booking
) {

    public LineClassification {
        Objects.requireNonNull(kind, "kind");
        text = text == null ? "" : text;
        name = name == null ? Optional.empty() : name;
        idDate = idDate == null ? Optional.empty() : idDate;
        booking = booking == null ? Optional.empty() : booking;
    }

    public static LineClassification plain(LineKind kind, String text) {
        return new LineClassification(kind, text, Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static LineClassification ofName(LineKind kind, String text, NameMatch name) {
        return new LineClassification(kind, text, Optional.of(name), Optional.empty(), Optional.empty());
    }

    public static LineClassification ofNameAndIdDate(String text, NameMatch name, IdDateMatch idDate) {
        return new LineClassification(LineKind.NAME_ID_DATE, text, Optional.of(name), Optional.of(idDate), Optional.empty());
    }

    public static LineClassification ofIdDate(String text, IdDateMatch idDate) {
        return new LineClassification(LineKind.ID_DATE, text, Optional.empty(), Optional.of(idDate), Optional.empty());
    }

    public static LineClassification ofBooking(String text, BookingMatch booking) {
        return new LineClassification(LineKind.BOOKING, text, Optional.empty(), Optional.empty(), Optional.of(booking));
    }

    public boolean tolerant() {
        return name.map(NameMatch::tolerant).orElse(false);
    }

    /**
     * Text in front of the given offset, trimmed.
     */
    public String before(int offset) {
        return text.substring(0, Math.min(Math.max(offset, 0), text.length())).trim();
    }

    /**
     * Text after the given offset, trimmed.
     */
    public String after(int offset) {
        return offset >= text.length() ? "" : text.substring(Math.max(offset, 0)).trim();
    }
}
