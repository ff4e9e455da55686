package io.arrestx.extractor.model;

/**
 * Fixed warning texts attached when a sealed record lacks a field.
 */
public final class RecordWarnings {

    public static final String MISSING_IDENTIFIER = "Missing identifier";
    public static final String MISSING_BOOK_IN_DATE = "Missing book-in date";
    public static final String NO_CHARGES = "No charges found";
    public static final String MISSING_ADDRESS = "Missing address";

    private RecordWarnings() {
    }
}
