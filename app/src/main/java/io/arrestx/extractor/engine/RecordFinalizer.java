package io.arrestx.extractor.engine;

import io.arrestx.extractor.model.ArrestRecord;
import io.arrestx.extractor.model.Charge;
import io.arrestx.extractor.model.PageSpan;
import io.arrestx.extractor.model.RecordWarnings;
import io.arrestx.extractor.pattern.PatternLibrary;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Validates a draft and seals it into an immutable {@link ArrestRecord}. Never throws for data defects; each one
 * becomes an entry in the record's warnings.
 */
class RecordFinalizer {

    private final PatternLibrary patterns;

    RecordFinalizer(PatternLibrary patterns) {
        this.patterns = Objects.requireNonNull(patterns, "patterns");
    }

    ArrestRecord seal(RecordDraft draft) {
        List<Charge> charges = new ArrayList<>();
        for (RecordDraft.DraftCharge charge : draft.charges) {
            if (!patterns.isValidBookingNumber(charge.bookingNo)) {
                draft.warnings.add("Malformed booking number dropped: " + charge.bookingNo);
                continue;
            }
            String description = charge.description.toString().trim();
            if (description.isEmpty()) {
                draft.warnings.add("Empty description for booking " + charge.bookingNo);
            }
            charges.add(new Charge(charge.bookingNo, description));
        }
        if (draft.identifier == null) {
            draft.warnings.add(RecordWarnings.MISSING_IDENTIFIER);
        }
        if (draft.bookInDate == null) {
            draft.warnings.add(RecordWarnings.MISSING_BOOK_IN_DATE);
        }
        if (charges.isEmpty()) {
            draft.warnings.add(RecordWarnings.NO_CHARGES);
        }
        if (draft.address.isEmpty()) {
            draft.warnings.add(RecordWarnings.MISSING_ADDRESS);
        }
        return new ArrestRecord(draft.name,
                draft.nameNormalized,
                draft.address,
                Optional.ofNullable(draft.identifier),
                Optional.ofNullable(draft.bookInDate),
                charges,
                new PageSpan(draft.firstPage, draft.lastPage),
                new ArrayList<>(draft.warnings));
    }
}
