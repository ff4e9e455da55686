package io.arrestx.extractor.strategy;

import io.arrestx.extractor.logging.LoggingConfigurator;
import io.arrestx.extractor.model.ArrestRecord;
import io.arrestx.extractor.model.SourceDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Tries ranked strategies in order and keeps the records of the first one that yields any.
 */
public class StrategyChain {

    private static final Logger LOGGER = LoggerFactory.getLogger(StrategyChain.class);

    private final List<ExtractionStrategy> strategies;

    public StrategyChain(List<ExtractionStrategy> strategies) {
        Objects.requireNonNull(strategies, "strategies");
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one extraction strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    public ExtractionOutcome extract(SourceDocument document) {
        Objects.requireNonNull(document, "document");
        MDC.put(LoggingConfigurator.DOCUMENT_KEY, document.sourceName());
        try {
            List<String> failures = new ArrayList<>();
            for (ExtractionStrategy strategy : strategies) {
                try {
                    List<ArrestRecord> records = strategy.extract(document);
                    if (records != null && !records.isEmpty()) {
                        LOGGER.info("Strategy {} produced {} record(s) for {}", strategy.name(), records.size(),
                                document.sourceName());
                        return new ExtractionOutcome(document.sourceName(), Optional.of(strategy.name()), records,
                                failures);
                    }
                    LOGGER.info("Strategy {} produced no records for {}", strategy.name(), document.sourceName());
                } catch (ExtractionException ex) {
                    LOGGER.warn("Strategy {} failed for {}: {}", strategy.name(), document.sourceName(),
                            ex.getMessage(), ex);
                    failures.add(strategy.name() + ": " + ex.getMessage());
                }
            }
            LOGGER.warn("No strategy produced records for {}", document.sourceName());
            return ExtractionOutcome.empty(document.sourceName(), failures);
        } finally {
            MDC.remove(LoggingConfigurator.DOCUMENT_KEY);
        }
    }
}
