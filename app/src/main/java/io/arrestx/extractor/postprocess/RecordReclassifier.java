package io.arrestx.extractor.postprocess;

import io.arrestx.extractor.model.ArrestRecord;
import io.arrestx.extractor.model.Charge;
import io.arrestx.extractor.model.RecordWarnings;
import io.arrestx.extractor.pattern.BookingMatch;
import io.arrestx.extractor.pattern.PatternLibrary;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second pass over sealed records that moves text misplaced by the line scan between address and charges.
 *
 * <ul>
 *     <li>address entries shaped like a booking line become charges, ahead of the existing ones;</li>
 *     <li>an address-shaped tail of the last charge description moves into the address while fewer than
 *     three address lines are present.</li>
 * </ul>
 * Text is only moved, never invented or dropped; whitespace is collapsed on the way, and a "missing address" or
 * "no charges" warning that the move made obsolete is removed.
 */
public class RecordReclassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecordReclassifier.class);
    private static final int ADDRESS_LIMIT = 3;

    private final PatternLibrary patterns;

    public RecordReclassifier(PatternLibrary patterns) {
        this.patterns = Objects.requireNonNull(patterns, "patterns");
    }

    public List<ArrestRecord> reclassify(List<ArrestRecord> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        List<ArrestRecord> result = new ArrayList<>(records.size());
        for (ArrestRecord record : records) {
            result.add(reclassify(record));
        }
        return List.copyOf(result);
    }

    public ArrestRecord reclassify(ArrestRecord record) {
        List<String> address = new ArrayList<>();
        List<Charge> movedCharges = new ArrayList<>();
        for (String line : record.address()) {
            String text = collapse(line);
            if (text.isEmpty()) {
                continue;
            }
            Optional<BookingMatch> booking = patterns.matchBooking(text);
            if (booking.isPresent()) {
                LOGGER.debug("Moving booking-shaped address line of {} into charges: {}", record.name(), text);
                movedCharges.add(new Charge(booking.get().bookingNo(), booking.get().description()));
            } else {
                address.add(text);
            }
        }

        List<Charge> charges = new ArrayList<>(movedCharges);
        for (Charge charge : record.charges()) {
            charges.add(new Charge(charge.bookingNo(), collapse(charge.description())));
        }

        if (!charges.isEmpty() && address.size() < ADDRESS_LIMIT) {
            int last = charges.size() - 1;
            Charge charge = charges.get(last);
            OptionalInt suffix = patterns.findAddressSuffix(charge.description());
            if (suffix.isPresent()) {
                String description = charge.description().substring(0, suffix.getAsInt()).trim();
                String moved = charge.description().substring(suffix.getAsInt()).trim();
                LOGGER.debug("Moving address tail of {} out of charge {}: {}", record.name(), charge.bookingNo(), moved);
                charges.set(last, new Charge(charge.bookingNo(), description));
                address.add(moved);
            }
        }
        return record.withContent(address, charges, settledWarnings(record, address, charges));
    }

    /**
     * Drops the "missing" warnings that no longer hold after text was moved.
     */
    private static List<String> settledWarnings(ArrestRecord record, List<String> address, List<Charge> charges) {
        List<String> warnings = new ArrayList<>(record.parseWarnings());
        if (!address.isEmpty()) {
            warnings.remove(RecordWarnings.MISSING_ADDRESS);
        }
        if (!charges.isEmpty()) {
            warnings.remove(RecordWarnings.NO_CHARGES);
        }
        return warnings;
    }

    static String collapse(String text) {
        return text == null ? "" : text.trim().replaceAll("\\s+", " ");
    }
}
