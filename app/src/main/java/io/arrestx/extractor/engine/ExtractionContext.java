package io.arrestx.extractor.engine;

import io.arrestx.extractor.model.SourceLine;
import io.arrestx.extractor.pattern.IdDateMatch;
import io.arrestx.extractor.pattern.PatternLibrary;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-scan state threaded through every {@link TransitionAction}: the flattened input, the scan position and the
 * accumulator. A new context is created for every document, so nothing here outlives one scan.
 */
public final class ExtractionContext {

    private final List<SourceLine> lines;
    private final PatternLibrary patterns;
    private final RecordAccumulator accumulator;
    private int index;
    private int lineLeftForNextRecord = -1;

    ExtractionContext(List<SourceLine> lines, PatternLibrary patterns, RecordAccumulator accumulator) {
        this.lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        this.patterns = Objects.requireNonNull(patterns, "patterns");
        this.accumulator = Objects.requireNonNull(accumulator, "accumulator");
    }

    public int index() {
        return index;
    }

    public boolean hasCurrentLine() {
        return index < lines.size();
    }

    public SourceLine currentLine() {
        return lines.get(index);
    }

    public Optional<SourceLine> peek(int offset) {
        int target = index + offset;
        if (target < 0 || target >= lines.size()) {
            return Optional.empty();
        }
        return Optional.of(lines.get(target));
    }

    public boolean nextLineIsBooking() {
        return peek(1).map(line -> patterns.isBookingLine(line.text())).orElse(false);
    }

    public boolean nextLineIsName() {
        return peek(1).map(line -> patterns.matchName(line.text().trim()).isPresent()).orElse(false);
    }

    /**
     * Marks the current line as not taken by any record, so a name on the following line may claim it.
     */
    public void leaveForNextRecord() {
        lineLeftForNextRecord = index;
    }

    /**
     * Identifier and date printed on the line directly above the current one, provided no record took them.
     */
    public Optional<IdDateMatch> idDateLeftAbove() {
        if (index == 0 || lineLeftForNextRecord != index - 1) {
            return Optional.empty();
        }
        return peek(-1).flatMap(line -> patterns.findIdDate(line.text()));
    }

    public PatternLibrary patterns() {
        return patterns;
    }

    public RecordAccumulator accumulator() {
        return accumulator;
    }

    void advance() {
        index++;
    }
}
