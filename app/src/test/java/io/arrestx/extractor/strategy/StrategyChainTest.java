package io.arrestx.extractor.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.arrestx.extractor.engine.ExtractionEngine;
import io.arrestx.extractor.engine.ParserOptions;
import io.arrestx.extractor.logging.LoggingConfigurator;
import io.arrestx.extractor.model.ArrestRecord;
import io.arrestx.extractor.model.PageSpan;
import io.arrestx.extractor.model.SourceDocument;
import io.arrestx.extractor.preprocess.DefaultLinePreprocessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class StrategyChainTest {

    private static final SourceDocument DOCUMENT = SourceDocument.of("report.txt", List.of(
            "Daily Booked In Report",
            "AGUILAR, JUAN 1234567 10/15/2025",
            "123 MAIN ST",
            "25-0240350 NO VALID DL"));

    @Test
    void firstStrategyWithRecordsWins() {
        FixedStrategy empty = new FixedStrategy("empty", List.of());
        FixedStrategy text = new FixedStrategy("text", List.of(record("DOE, JANE")));
        FixedStrategy never = new FixedStrategy("never", List.of(record("ROE, RICHARD")));

        ExtractionOutcome outcome = new StrategyChain(List.of(empty, text, never)).extract(DOCUMENT);

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.strategyName()).contains("text");
        assertThat(outcome.records()).extracting(ArrestRecord::name).containsExactly("DOE, JANE");
        assertThat(never.calls).isZero();
    }

    @Test
    void failingStrategyIsRecordedAndSkipped() {
        ExtractionStrategy failing = new ExtractionStrategy() {
            @Override
            public String name() {
                return "layout";
            }

            @Override
            public List<ArrestRecord> extract(SourceDocument document) {
                throw new ExtractionException("no layout information");
            }
        };

        ExtractionOutcome outcome = new StrategyChain(List.of(failing, new FixedStrategy("text",
                List.of(record("DOE, JANE"))))).extract(DOCUMENT);

        assertThat(outcome.strategyName()).contains("text");
        assertThat(outcome.failures()).containsExactly("layout: no layout information");
    }

    @Test
    void emptyOutcomeWhenNoStrategyYieldsRecords() {
        ExtractionOutcome outcome = new StrategyChain(List.of(new FixedStrategy("empty", List.of())))
                .extract(DOCUMENT);

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.records()).isEmpty();
        assertThat(outcome.sourceName()).isEqualTo("report.txt");
    }

    @Test
    void documentNameIsInLoggingContextOnlyWhileExtracting() {
        FixedStrategy strategy = new FixedStrategy("text", List.of(record("DOE, JANE")));

        new StrategyChain(List.of(strategy)).extract(DOCUMENT);

        assertThat(strategy.seenDocumentContext).containsExactly("report.txt");
        assertThat(MDC.get(LoggingConfigurator.DOCUMENT_KEY)).isNull();
    }

    @Test
    void rejectsEmptyStrategyList() {
        assertThatThrownBy(() -> new StrategyChain(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void textStrategyRunsPreprocessorAndEngine() {
        TextStateMachineStrategy strategy = new TextStateMachineStrategy(new DefaultLinePreprocessor(),
                new ExtractionEngine(ParserOptions.defaults()));

        ExtractionOutcome outcome = new StrategyChain(List.of(strategy)).extract(DOCUMENT);

        assertThat(outcome.strategyName()).contains(TextStateMachineStrategy.NAME);
        assertThat(outcome.records()).singleElement().satisfies(record -> {
            assertThat(record.name()).isEqualTo("AGUILAR, JUAN");
            assertThat(record.address()).containsExactly("123 MAIN ST");
            assertThat(record.charges()).hasSize(1);
        });
    }

    @Test
    void textStrategyRejectsDocumentWithoutPages() {
        TextStateMachineStrategy strategy = new TextStateMachineStrategy(new DefaultLinePreprocessor(),
                new ExtractionEngine(ParserOptions.defaults()));

        ExtractionOutcome outcome = new StrategyChain(List.of(strategy))
                .extract(new SourceDocument("blank.txt", List.of()));

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.failures()).hasSize(1);
        assertThat(outcome.failures().get(0)).startsWith(TextStateMachineStrategy.NAME);
    }

    private static ArrestRecord record(String name) {
        return new ArrestRecord(name, "", List.of(), Optional.empty(), Optional.empty(), List.of(),
                PageSpan.single(1), List.of());
    }

    private static final class FixedStrategy implements ExtractionStrategy {

        private final String name;
        private final List<ArrestRecord> records;
        private final List<String> seenDocumentContext = new ArrayList<>();
        private int calls;

        private FixedStrategy(String name, List<ArrestRecord> records) {
            this.name = name;
            this.records = records;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public List<ArrestRecord> extract(SourceDocument document) {
            calls++;
            seenDocumentContext.add(MDC.get(LoggingConfigurator.DOCUMENT_KEY));
            return records;
        }
    }
}
