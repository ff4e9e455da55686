package io.arrestx.extractor.strategy;

import io.arrestx.extractor.engine.ExtractionEngine;
import io.arrestx.extractor.model.ArrestRecord;
import io.arrestx.extractor.model.SourceDocument;
import io.arrestx.extractor.model.SourcePage;
import io.arrestx.extractor.preprocess.LinePreprocessor;
import java.util.List;
import java.util.Objects;

/**
 * Plain-text strategy: header filtering and whitespace cleanup followed by the line-to-record engine.
 */
public class TextStateMachineStrategy implements ExtractionStrategy {

    public static final String NAME = "text-state-machine";

    private final LinePreprocessor preprocessor;
    private final ExtractionEngine engine;

    public TextStateMachineStrategy(LinePreprocessor preprocessor, ExtractionEngine engine) {
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor");
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ArrestRecord> extract(SourceDocument document) {
        if (document == null || document.pages().isEmpty()) {
            throw new ExtractionException("Document has no text pages");
        }
        List<SourcePage> pages = preprocessor.preprocess(document.pages());
        return engine.extract(pages);
    }
}
