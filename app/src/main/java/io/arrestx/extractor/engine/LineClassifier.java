package io.arrestx.extractor.engine;

import io.arrestx.extractor.pattern.LineClassification;
import io.arrestx.extractor.pattern.LineKind;
import io.arrestx.extractor.pattern.PatternLibrary;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies the {@link PatternLibrary} to one line using the recognizer order of the current state and returns the
 * first (highest priority) match. The last recognizer of every order always matches.
 */
public class LineClassifier {

    private static final Map<ParserState, List<LineKind>> ORDER = new EnumMap<>(ParserState.class);

    static {
        ORDER.put(ParserState.SEEK_NAME, List.of(
                LineKind.NAME_ID_DATE, LineKind.NAME, LineKind.ID_DATE, LineKind.NOISE));
        ORDER.put(ParserState.CAPTURE_ADDRESS, List.of(
                LineKind.NAME_ID_DATE, LineKind.NAME, LineKind.BOOKING, LineKind.MALFORMED_BOOKING,
                LineKind.ID_DATE, LineKind.IDENTIFIER_ONLY, LineKind.DATE_ONLY, LineKind.TEXT));
        ORDER.put(ParserState.SEEK_ID_DATE, List.of(
                LineKind.NAME_ID_DATE, LineKind.NAME, LineKind.BOOKING, LineKind.MALFORMED_BOOKING,
                LineKind.ID_DATE, LineKind.IDENTIFIER_ONLY, LineKind.DATE_ONLY, LineKind.TEXT));
        ORDER.put(ParserState.CAPTURE_CHARGES, List.of(
                LineKind.NAME_ID_DATE, LineKind.NAME, LineKind.BOOKING, LineKind.MALFORMED_BOOKING,
                LineKind.EMBEDDED_NAME, LineKind.TEXT));
    }

    private final PatternLibrary patterns;
    private final boolean allowTwoLineIdDate;

    public LineClassifier(PatternLibrary patterns, boolean allowTwoLineIdDate) {
        this.patterns = Objects.requireNonNull(patterns, "patterns");
        this.allowTwoLineIdDate = allowTwoLineIdDate;
    }

    public LineClassification classify(String line, ParserState state) {
        String text = line == null ? "" : line.trim();
        for (LineKind kind : order(state)) {
            if (!allowTwoLineIdDate && (kind == LineKind.IDENTIFIER_ONLY || kind == LineKind.DATE_ONLY)) {
                continue;
            }
            Optional<LineClassification> match = patterns.recognize(kind, text);
            if (match.isPresent()) {
                return match.get();
            }
        }
        return LineClassification.plain(LineKind.TEXT, text);
    }

    public static List<LineKind> order(ParserState state) {
        return ORDER.get(Objects.requireNonNull(state, "state"));
    }
}
