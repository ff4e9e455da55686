package io.arrestx.extractor.engine;

import io.arrestx.extractor.model.ArrestRecord;
import io.arrestx.extractor.model.SourceLine;
import io.arrestx.extractor.pattern.LineClassification;
import io.arrestx.extractor.pattern.PatternLibrary;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequential scan over page-tagged lines. Each line is classified for the current state and dispatched through the
 * {@link TransitionTable}; the {@link ProgressGuard} forces the index forward if a transition never consumes.
 *
 * <p>Instances are immutable and may be shared; all scan state lives in a per-call {@link ExtractionContext}.
 */
public class ExtractionStateMachine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionStateMachine.class);

    private final PatternLibrary patterns;
    private final ParserOptions options;
    private final LineClassifier classifier;
    private final TransitionTable table;

    public ExtractionStateMachine(ParserOptions options) {
        this(options, StandardTransitions.table());
    }

    public ExtractionStateMachine(ParserOptions options, TransitionTable table) {
        this.options = Objects.requireNonNull(options, "options");
        this.table = Objects.requireNonNull(table, "table");
        this.patterns = new PatternLibrary(!options.strictNames());
        this.classifier = new LineClassifier(patterns, options.allowTwoLineIdDate());
    }

    public List<ArrestRecord> run(List<SourceLine> lines) {
        if (lines == null || lines.isEmpty()) {
            return List.of();
        }
        RecordAccumulator accumulator = new RecordAccumulator(new RecordFinalizer(patterns));
        ExtractionContext context = new ExtractionContext(lines, patterns, accumulator);
        ProgressGuard guard = new ProgressGuard(options.stallCeiling());
        ParserState state = ParserState.SEEK_NAME;

        while (context.hasCurrentLine()) {
            SourceLine line = context.currentLine();
            accumulator.atPage(line.page());
            if (guard.observe(context.index())) {
                String message = "Scanner stalled in " + state + " on line " + (context.index() + 1)
                        + "; line skipped: " + line.text();
                LOGGER.warn(message);
                accumulator.recordStall(message);
                context.advance();
                continue;
            }
            LineClassification classification = classifier.classify(line.text(), state);
            Step step = table.action(state, classification.kind()).apply(context, classification);
            if (LOGGER.isDebugEnabled() && step.next() != state) {
                LOGGER.debug("Line {} ({}) moved {} -> {}", context.index() + 1, classification.kind(), state,
                        step.next());
            }
            state = step.next();
            if (step.consumed()) {
                context.advance();
            }
        }
        accumulator.sealCurrent();
        return accumulator.records();
    }

    public PatternLibrary patterns() {
        return patterns;
    }
}
