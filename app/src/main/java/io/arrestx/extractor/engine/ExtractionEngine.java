package io.arrestx.extractor.engine;

import io.arrestx.extractor.model.ArrestRecord;
import io.arrestx.extractor.model.SourceDocument;
import io.arrestx.extractor.model.SourceLine;
import io.arrestx.extractor.model.SourcePage;
import io.arrestx.extractor.postprocess.RecordReclassifier;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the line-to-record engine: flattens pages, runs the state machine and the reclassification pass.
 * Never throws for malformed data; null or empty input yields an empty list.
 */
public class ExtractionEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionEngine.class);

    private final ExtractionStateMachine machine;
    private final RecordReclassifier reclassifier;

    public ExtractionEngine(ParserOptions options) {
        this(new ExtractionStateMachine(options));
    }

    public ExtractionEngine(ExtractionStateMachine machine) {
        this.machine = Objects.requireNonNull(machine, "machine");
        this.reclassifier = new RecordReclassifier(machine.patterns());
    }

    public List<ArrestRecord> extract(SourceDocument document) {
        if (document == null) {
            return List.of();
        }
        return extractLines(document.flatten());
    }

    public List<ArrestRecord> extract(List<SourcePage> pages) {
        return extractLines(SourceDocument.flatten(pages));
    }

    private List<ArrestRecord> extractLines(List<SourceLine> lines) {
        if (lines.isEmpty()) {
            LOGGER.debug("No lines to extract from");
            return List.of();
        }
        List<ArrestRecord> records = reclassifier.reclassify(machine.run(lines));
        long warned = records.stream().filter(record -> !record.parseWarnings().isEmpty()).count();
        LOGGER.info("Extracted {} record(s) from {} line(s); {} with warnings", records.size(), lines.size(), warned);
        return records;
    }
}
