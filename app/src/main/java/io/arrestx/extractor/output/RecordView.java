package io.arrestx.extractor.output;

import io.arrestx.extractor.model.ArrestRecord;
import io.arrestx.extractor.model.Charge;
import io.arrestx.extractor.model.PageSpan;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Serialized shape of one record: the record fields plus the report it was read from.
 */
record RecordView(
        String name,
        String nameNormalized,
        List<String> address,
        Optional<String> identifier,
        Optional<LocalDate> bookInDate,
        List<Charge> charges,
        PageSpan sourcePageSpan,
        List<String> parseWarnings,
        String sourceFile
) {

    static RecordView of(ArrestRecord record, String sourceFile) {
        return new RecordView(record.name(), record.nameNormalized(), record.address(), record.identifier(),
                record.bookInDate(), record.charges(), record.sourcePageSpan(), record.parseWarnings(),
                sourceFile == null ? "" : sourceFile);
    }
}
