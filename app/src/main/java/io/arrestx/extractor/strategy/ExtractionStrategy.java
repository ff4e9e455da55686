package io.arrestx.extractor.strategy;

import io.arrestx.extractor.model.ArrestRecord;
import io.arrestx.extractor.model.SourceDocument;
import java.util.List;

/**
 * One whole-document way of turning a report into records. Strategies are ranked and tried in order by the
 * {@link StrategyChain}.
 */
public interface ExtractionStrategy {

    String name();

    /**
     * @throws ExtractionException when the strategy cannot handle the document at all
     */
    List<ArrestRecord> extract(SourceDocument document);
}
