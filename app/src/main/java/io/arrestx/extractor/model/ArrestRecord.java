package io.arrestx.extractor.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable arrest record recovered from a book-in report.
 *
 * <p>{@code name} is kept exactly as printed ("LAST, FIRST MIDDLE"), {@code nameNormalized} is the derived
 * "First Middle Last" form. Identifier and book-in date are never fabricated: when the text does not carry them
 * they stay empty and a warning is recorded instead.
 */
public record ArrestRecord(
        String name,
        String nameNormalized,
        List<String> address,
        Optional<String> identifier,
        Optional<LocalDate> bookInDate,
        List<Charge> charges,
        PageSpan sourcePageSpan,
        List<String> parseWarnings
) {

    public ArrestRecord {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        nameNormalized = nameNormalized == null ? "" : nameNormalized;
        address = address == null ? List.of() : List.copyOf(address);
        identifier = identifier == null ? Optional.empty() : identifier;
        bookInDate = bookInDate == null ? Optional.empty() : bookInDate;
        charges = charges == null ? List.of() : List.copyOf(charges);
        Objects.requireNonNull(sourcePageSpan, "sourcePageSpan");
        parseWarnings = parseWarnings == null ? List.of() : List.copyOf(parseWarnings);
    }

    public Optional<Charge> lastCharge() {
        return charges.isEmpty() ? Optional.empty() : Optional.of(charges.get(charges.size() - 1));
    }

    /**
     * Copy with address, charges and warnings replaced; identity fields and page span are kept.
     */
    public ArrestRecord withContent(List<String> newAddress, List<Charge> newCharges, List<String> newWarnings) {
        return new ArrestRecord(name, nameNormalized, newAddress, identifier, bookInDate, newCharges,
                sourcePageSpan, newWarnings);
    }
}
