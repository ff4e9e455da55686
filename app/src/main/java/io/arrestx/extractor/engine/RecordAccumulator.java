package io.arrestx.extractor.engine;

import io.arrestx.extractor.model.ArrestRecord;
import io.arrestx.extractor.pattern.BookInDates;
import io.arrestx.extractor.pattern.IdDateMatch;
import io.arrestx.extractor.pattern.NameMatch;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the record currently being built, its open charge and the list of sealed records.
 *
 * <p>Every mutation touches the page set by {@link #atPage(int)} so the sealed record knows which pages it spans.
 * Operations that need an open record are ignored when there is none.
 */
public final class RecordAccumulator {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecordAccumulator.class);

    static final int ADDRESS_LIMIT = 3;
    static final String UNPARSED_NAME = "UNPARSED";

    private final RecordFinalizer finalizer;
    private final List<ArrestRecord> sealed = new ArrayList<>();
    private RecordDraft current;
    private RecordDraft.DraftCharge openCharge;
    private int page;

    RecordAccumulator(RecordFinalizer finalizer) {
        this.finalizer = Objects.requireNonNull(finalizer, "finalizer");
    }

    void atPage(int page) {
        this.page = page;
    }

    public boolean hasOpenRecord() {
        return current != null;
    }

    public void open(NameMatch name) {
        open(name.raw(), name.normalized());
        if (name.tolerant()) {
            warn("Name matched only the tolerant pattern: " + name.raw());
        }
    }

    private void open(String rawName, String normalizedName) {
        if (current != null) {
            sealCurrent();
        }
        current = new RecordDraft(rawName, normalizedName, page);
        LOGGER.debug("Opened record {} on page {}", rawName, page);
    }

    public Optional<String> identifier() {
        return current == null ? Optional.empty() : Optional.ofNullable(current.identifier);
    }

    public Optional<LocalDate> bookInDate() {
        return current == null ? Optional.empty() : Optional.ofNullable(current.bookInDate);
    }

    public boolean hasIdentifierAndDate() {
        return identifier().isPresent() && bookInDate().isPresent();
    }

    public void acceptIdDate(IdDateMatch match) {
        match.cid().ifPresent(cid -> LOGGER.debug("Read CID {} next to identifier {}", cid,
                match.identifier()));
        acceptIdentifier(match.identifier());
        acceptDate(match.rawDate());
    }

    public void acceptIdentifier(String identifier) {
        if (current == null || identifier == null) {
            return;
        }
        touch();
        if (current.identifier == null) {
            current.identifier = identifier;
        } else if (!current.identifier.equals(identifier)) {
            warn("Conflicting identifier ignored: " + identifier);
        }
    }

    public void acceptDate(String rawDate) {
        if (current == null || rawDate == null) {
            return;
        }
        touch();
        Optional<LocalDate> parsed = BookInDates.parse(rawDate);
        if (parsed.isEmpty()) {
            warn("Invalid book-in date ignored: " + rawDate);
            return;
        }
        if (current.bookInDate == null) {
            current.bookInDate = parsed.get();
        } else if (!current.bookInDate.equals(parsed.get())) {
            warn("Conflicting book-in date ignored: " + rawDate);
        }
    }

    public void appendAddress(String text) {
        if (current == null || text == null || text.isBlank()) {
            return;
        }
        touch();
        if (current.address.size() >= ADDRESS_LIMIT) {
            warn("Address line beyond limit of " + ADDRESS_LIMIT + " dropped: " + text.trim());
            return;
        }
        current.address.add(text.trim());
    }

    public void openCharge(String bookingNo, String description) {
        if (current == null) {
            return;
        }
        touch();
        openCharge = new RecordDraft.DraftCharge(bookingNo, description);
        current.charges.add(openCharge);
    }

    public void closeCharge() {
        openCharge = null;
    }

    /**
     * Appends wrapped text to the open charge, or records an orphan warning when no charge is open.
     *
     * @return whether the text was kept
     */
    public boolean continueCharge(String text) {
        if (current == null || text == null || text.isBlank()) {
            return false;
        }
        touch();
        if (openCharge == null) {
            warn("Orphan text with no open charge: " + text.trim());
            return false;
        }
        openCharge.append(text);
        return true;
    }

    public void warn(String message) {
        if (current == null) {
            LOGGER.debug("Dropping warning without open record: {}", message);
            return;
        }
        current.warnings.add(message);
    }

    /**
     * Seals the open record, if any, and appends it to the output. A sealed draft is never seen again.
     */
    public void sealCurrent() {
        if (current == null) {
            return;
        }
        RecordDraft draft = current;
        current = null;
        openCharge = null;
        ArrestRecord record = finalizer.seal(draft);
        sealed.add(record);
        LOGGER.debug("Sealed record {} with {} charge(s) and {} warning(s)",
                record.name(), record.charges().size(), record.parseWarnings().size());
    }

    /**
     * Attaches a stall diagnostic to the open record, or to a synthetic record sealed on the spot.
     */
    void recordStall(String message) {
        if (current != null) {
            warn(message);
            return;
        }
        open(UNPARSED_NAME, "Unparsed");
        warn(message);
        sealCurrent();
    }

    public List<ArrestRecord> records() {
        return Collections.unmodifiableList(new ArrayList<>(sealed));
    }

    private void touch() {
        current.touch(page);
    }
}
