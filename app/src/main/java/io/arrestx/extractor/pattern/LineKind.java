package io.arrestx.extractor.pattern;

/**
 * Classification of a single report line, most specific first.
 */
public enum LineKind {
    NAME_ID_DATE,
    NAME,
    BOOKING,
    MALFORMED_BOOKING,
    ID_DATE,
    IDENTIFIER_ONLY,
    DATE_ONLY,
    EMBEDDED_NAME,
    TEXT,
    NOISE;

    public boolean startsNewPerson() {
        return this == NAME_ID_DATE || this == NAME;
    }
}
