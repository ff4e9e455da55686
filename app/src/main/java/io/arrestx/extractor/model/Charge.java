package io.arrestx.extractor.model;

import java.util.Objects;

/**
 * Single booking charge owned by an {@link ArrestRecord}.
 */
public record Charge(String bookingNo, String description) {

    public Charge {
        Objects.requireNonNull(bookingNo, "bookingNo");
        description = description == null ? "" : description;
    }
}
