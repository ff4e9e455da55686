package io.arrestx.extractor.pattern;

import java.util.Objects;

/**
 * A booking number that opens a charge, followed by the (possibly empty) charge description.
 */
public record BookingMatch(String bookingNo, String description) {

    public BookingMatch {
        Objects.requireNonNull(bookingNo, "bookingNo");
        description = description == null ? "" : description.trim();
    }
}
