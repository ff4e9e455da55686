package io.arrestx.extractor.engine;

/**
 * The only configuration the extraction engine consumes.
 *
 * @param strictNames        accept upper-case names only; when false the tolerant mixed-case patterns are tried too
 * @param allowTwoLineIdDate accept identifier and book-in date on separate consecutive lines
 * @param stallCeiling       iterations without progress tolerated before a line is force-skipped
 */
public record ParserOptions(boolean strictNames, boolean allowTwoLineIdDate, int stallCeiling) {

    public static final int DEFAULT_STALL_CEILING = 500;

    public ParserOptions {
        if (stallCeiling < 1) {
            throw new IllegalArgumentException("stallCeiling must be at least 1");
        }
    }

    public static ParserOptions defaults() {
        return new ParserOptions(true, true, DEFAULT_STALL_CEILING);
    }
}
