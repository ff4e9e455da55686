package io.arrestx.extractor.strategy;

import io.arrestx.extractor.model.ArrestRecord;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of running the strategy chain over one document.
 *
 * @param strategyName strategy that produced the records, empty when none did
 * @param failures     one message per strategy that threw, in the order they were tried
 */
public record ExtractionOutcome(String sourceName, Optional<String> strategyName, List<ArrestRecord> records,
                                List<String> failures) {

    public ExtractionOutcome {
        Objects.requireNonNull(sourceName, "sourceName");
        strategyName = strategyName == null ? Optional.empty() : strategyName;
        records = records == null ? List.of() : List.copyOf(records);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static ExtractionOutcome empty(String sourceName, List<String> failures) {
        return new ExtractionOutcome(sourceName, Optional.empty(), List.of(), failures);
    }

    public boolean succeeded() {
        return strategyName.isPresent();
    }
}
