package io.arrestx.extractor.pattern;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Identifier and book-in date found together, with their span in the scanned text. Reports with a CID column
 * print that number between the two; it is kept apart so it never replaces the identifier.
 */
public record IdDateMatch(String identifier, Optional<String> cid, String rawDate, int start, int end) {

    public IdDateMatch {
        Objects.requireNonNull(identifier, "identifier");
        cid = cid == null ? Optional.empty() : cid;
        Objects.requireNonNull(rawDate, "rawDate");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid identifier/date match boundaries");
        }
    }

    public IdDateMatch(String identifier, String rawDate, int start, int end) {
        this(identifier, Optional.empty(), rawDate, start, end);
    }

    static IdDateMatch of(Matcher matcher, int start, int end) {
        return new IdDateMatch(matcher.group("id"), Optional.ofNullable(matcher.group("cid")), matcher.group("date"),
                start, end);
    }
}
