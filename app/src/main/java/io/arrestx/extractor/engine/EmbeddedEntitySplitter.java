package io.arrestx.extractor.engine;

import io.arrestx.extractor.pattern.BookingMatch;
import io.arrestx.extractor.pattern.IdDateMatch;
import io.arrestx.extractor.pattern.NameMatch;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits text in which a new person's name appears after content of the previous person.
 *
 * <p>Text in front of the name finishes the open charge of the current record. The current record is then sealed,
 * a new one is opened with the matched name, and the text behind the name is searched for the identifier and
 * book-in date of the new person. Whatever remains becomes the first address line of the new record, or a charge
 * when it is shaped like a booking line.
 */
public class EmbeddedEntitySplitter {

    private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddedEntitySplitter.class);

    public Step split(ExtractionContext context, String text, NameMatch name) {
        RecordAccumulator accumulator = context.accumulator();
        String prefix = text.substring(0, Math.min(name.start(), text.length())).trim();
        String suffix = name.end() >= text.length() ? "" : text.substring(name.end()).trim();
        LOGGER.debug("Embedded name {} on line {}", name.raw(), context.index() + 1);

        if (!prefix.isEmpty()) {
            accumulator.continueCharge(prefix);
        }
        accumulator.sealCurrent();
        accumulator.open(name);

        boolean chargeOpened;
        Optional<IdDateMatch> idDate = context.patterns().findIdDate(suffix);
        if (idDate.isPresent()) {
            IdDateMatch match = idDate.get();
            accumulator.acceptIdDate(match);
            accumulator.appendAddress(suffix.substring(0, match.start()).trim());
            chargeOpened = absorbTrailing(context, suffix.substring(match.end()).trim());
        } else {
            chargeOpened = absorbTrailing(context, suffix);
        }
        return Step.advance(chargeOpened ? ParserState.CAPTURE_CHARGES : ParserState.CAPTURE_ADDRESS);
    }

    /**
     * Places text that trails an identifier and date: a booking-shaped remainder opens a charge, anything else is
     * address text.
     *
     * @return whether a charge was opened
     */
    static boolean absorbTrailing(ExtractionContext context, String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        Optional<BookingMatch> booking = context.patterns().matchBooking(text);
        if (booking.isPresent()) {
            context.accumulator().openCharge(booking.get().bookingNo(), booking.get().description());
            return true;
        }
        context.accumulator().appendAddress(text);
        return false;
    }
}
