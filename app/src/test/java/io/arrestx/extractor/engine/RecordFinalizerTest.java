package io.arrestx.extractor.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.arrestx.extractor.model.ArrestRecord;
import io.arrestx.extractor.model.Charge;
import io.arrestx.extractor.model.PageSpan;
import io.arrestx.extractor.model.RecordWarnings;
import io.arrestx.extractor.pattern.PatternLibrary;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class RecordFinalizerTest {

    private final RecordFinalizer finalizer = new RecordFinalizer(PatternLibrary.strictOnly());

    @Test
    void completeDraftSealsWithoutWarnings() {
        RecordDraft draft = new RecordDraft("DOE, JANE", "Jane Doe", 2);
        draft.identifier = "1234567";
        draft.bookInDate = LocalDate.of(2025, 10, 15);
        draft.address.add("123 MAIN ST");
        draft.charges.add(new RecordDraft.DraftCharge("25-0240350", "NO VALID DL"));
        draft.touch(3);

        ArrestRecord record = finalizer.seal(draft);

        assertThat(record.parseWarnings()).isEmpty();
        assertThat(record.sourcePageSpan()).isEqualTo(new PageSpan(2, 3));
        assertThat(record.charges()).containsExactly(new Charge("25-0240350", "NO VALID DL"));
    }

    @Test
    void missingFieldsBecomeWarningsInsteadOfValues() {
        ArrestRecord record = finalizer.seal(new RecordDraft("DOE, JANE", "Jane Doe", 1));

        assertThat(record.identifier()).isEmpty();
        assertThat(record.bookInDate()).isEmpty();
        assertThat(record.parseWarnings()).containsExactly(
                RecordWarnings.MISSING_IDENTIFIER,
                RecordWarnings.MISSING_BOOK_IN_DATE,
                RecordWarnings.NO_CHARGES,
                RecordWarnings.MISSING_ADDRESS);
    }

    @Test
    void dropsChargesWithInvalidBookingNumbers() {
        RecordDraft draft = new RecordDraft("DOE, JANE", "Jane Doe", 1);
        draft.charges.add(new RecordDraft.DraftCharge("25-12", "BAD"));
        draft.charges.add(new RecordDraft.DraftCharge("25-0240350", ""));

        ArrestRecord record = finalizer.seal(draft);

        assertThat(record.charges()).containsExactly(new Charge("25-0240350", ""));
        assertThat(record.parseWarnings())
                .contains("Malformed booking number dropped: 25-12", "Empty description for booking 25-0240350")
                .doesNotContain(RecordWarnings.NO_CHARGES);
    }

    @Test
    void duplicateWarningsAreKeptOnce() {
        RecordDraft draft = new RecordDraft("DOE, JANE", "Jane Doe", 1);
        draft.warnings.add("Orphan text with no open charge: X");
        draft.warnings.add("Orphan text with no open charge: X");

        assertThat(finalizer.seal(draft).parseWarnings())
                .filteredOn(warning -> warning.startsWith("Orphan"))
                .hasSize(1);
    }
}
