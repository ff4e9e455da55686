package io.arrestx.extractor.engine;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable record under construction. Only ever reachable through the {@link RecordAccumulator}.
 */
final class RecordDraft {

    final String name;
    final String nameNormalized;
    final List<String> address = new ArrayList<>();
    final List<DraftCharge> charges = new ArrayList<>();
    final Set<String> warnings = new LinkedHashSet<>();
    String identifier;
    LocalDate bookInDate;
    int firstPage;
    int lastPage;

    RecordDraft(String name, String nameNormalized, int page) {
        this.name = name;
        this.nameNormalized = nameNormalized;
        this.firstPage = page;
        this.lastPage = page;
    }

    void touch(int page) {
        firstPage = Math.min(firstPage, page);
        lastPage = Math.max(lastPage, page);
    }

    static final class DraftCharge {

        final String bookingNo;
        final StringBuilder description = new StringBuilder();

        DraftCharge(String bookingNo, String description) {
            this.bookingNo = bookingNo;
            append(description);
        }

        void append(String text) {
            if (text == null || text.isBlank()) {
                return;
            }
            if (description.length() > 0) {
                description.append(' ');
            }
            description.append(text.trim());
        }
    }
}
