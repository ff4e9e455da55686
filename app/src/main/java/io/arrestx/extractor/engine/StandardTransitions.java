package io.arrestx.extractor.engine;

import io.arrestx.extractor.pattern.BookingMatch;
import io.arrestx.extractor.pattern.IdDateMatch;
import io.arrestx.extractor.pattern.LineClassification;
import io.arrestx.extractor.pattern.LineKind;
import io.arrestx.extractor.pattern.NameMatch;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The transition table used for book-in reports.
 *
 * <p>A name at the start of a line always ends the record being built: every capture state seals it and hands
 * the same line back to {@link ParserState#SEEK_NAME}, so each new person enters through the same rules.
 */
public final class StandardTransitions {

    private static final Logger LOGGER = LoggerFactory.getLogger(StandardTransitions.class);

    static final String INCOMPLETE_RECORD = "Incomplete record: next name reached before any charge";
    static final String MALFORMED_BOOKING_PREFIX = "Malformed booking line dropped: ";

    private final EmbeddedEntitySplitter splitter;

    private StandardTransitions(EmbeddedEntitySplitter splitter) {
        this.splitter = splitter;
    }

    public static TransitionTable table() {
        return table(new EmbeddedEntitySplitter());
    }

    public static TransitionTable table(EmbeddedEntitySplitter splitter) {
        StandardTransitions transitions = new StandardTransitions(splitter);
        TransitionTable.Builder builder = TransitionTable.builder();
        transitions.seekName(builder);
        transitions.addressPhase(builder, ParserState.CAPTURE_ADDRESS);
        transitions.addressPhase(builder, ParserState.SEEK_ID_DATE);
        transitions.capturingCharges(builder);
        return builder.build();
    }

    private void seekName(TransitionTable.Builder builder) {
        builder.on(ParserState.SEEK_NAME, LineKind.NAME_ID_DATE, this::openWithIdDate)
                .on(ParserState.SEEK_NAME, LineKind.NAME, this::openFromName)
                .on(ParserState.SEEK_NAME, LineKind.ID_DATE, (context, line) -> {
                    context.leaveForNextRecord();
                    return Step.advance(ParserState.SEEK_NAME);
                })
                .on(ParserState.SEEK_NAME, LineKind.NOISE, (context, line) -> {
                    LOGGER.debug("Skipping line {} while looking for a name: {}", context.index() + 1, line.text());
                    return Step.advance(ParserState.SEEK_NAME);
                });
    }

    private void addressPhase(TransitionTable.Builder builder, ParserState state) {
        builder.on(state, (context, line) -> endIncomplete(context), LineKind.NAME_ID_DATE, LineKind.NAME)
                .on(state, LineKind.BOOKING, this::startCharge)
                .on(state, LineKind.MALFORMED_BOOKING, this::dropMalformed)
                .on(state, LineKind.ID_DATE, (context, line) -> consumeIdDate(context, line, state))
                .on(state, LineKind.IDENTIFIER_ONLY, (context, line) -> {
                    context.accumulator().acceptIdentifier(line.text());
                    return afterPartialIdDate(context);
                })
                .on(state, LineKind.DATE_ONLY, (context, line) -> {
                    context.accumulator().acceptDate(line.text());
                    return afterPartialIdDate(context);
                })
                .on(state, LineKind.TEXT, (context, line) -> {
                    context.accumulator().appendAddress(line.text());
                    return Step.advance(state);
                });
    }

    private void capturingCharges(TransitionTable.Builder builder) {
        ParserState state = ParserState.CAPTURE_CHARGES;
        builder.on(state, (context, line) -> endRecord(context), LineKind.NAME_ID_DATE, LineKind.NAME)
                .on(state, LineKind.BOOKING, this::startCharge)
                .on(state, LineKind.MALFORMED_BOOKING, this::dropMalformed)
                .on(state, LineKind.EMBEDDED_NAME,
                        (context, line) -> splitter.split(context, line.text(), line.name().orElseThrow()))
                .on(state, LineKind.TEXT, (context, line) -> {
                    if (heldForNextRecord(context, line)) {
                        return Step.advance(state);
                    }
                    context.accumulator().continueCharge(line.text());
                    return Step.advance(state);
                });
    }

    private Step openWithIdDate(ExtractionContext context, LineClassification line) {
        NameMatch name = line.name().orElseThrow();
        IdDateMatch idDate = line.idDate().orElseThrow();
        RecordAccumulator accumulator = context.accumulator();
        accumulator.open(name);
        accumulator.acceptIdDate(idDate);
        boolean chargeOpened = EmbeddedEntitySplitter.absorbTrailing(context, line.after(idDate.end()));
        return Step.advance(chargeOpened ? ParserState.CAPTURE_CHARGES : ParserState.CAPTURE_ADDRESS);
    }

    private Step openFromName(ExtractionContext context, LineClassification line) {
        RecordAccumulator accumulator = context.accumulator();
        accumulator.open(line.name().orElseThrow());
        context.idDateLeftAbove().ifPresent(accumulator::acceptIdDate);
        return Step.advance(ParserState.CAPTURE_ADDRESS);
    }

    private Step endIncomplete(ExtractionContext context) {
        context.accumulator().warn(INCOMPLETE_RECORD);
        return endRecord(context);
    }

    private Step endRecord(ExtractionContext context) {
        context.accumulator().sealCurrent();
        return Step.redispatch(ParserState.SEEK_NAME);
    }

    private Step startCharge(ExtractionContext context, LineClassification line) {
        BookingMatch booking = line.booking().orElseThrow();
        Optional<NameMatch> embedded = context.patterns().findEmbeddedName(booking.description());
        if (embedded.isPresent()) {
            context.accumulator().openCharge(booking.bookingNo(), "");
            return splitter.split(context, booking.description(), embedded.get());
        }
        context.accumulator().openCharge(booking.bookingNo(), booking.description());
        return Step.advance(ParserState.CAPTURE_CHARGES);
    }

    private Step dropMalformed(ExtractionContext context, LineClassification line) {
        RecordAccumulator accumulator = context.accumulator();
        accumulator.warn(MALFORMED_BOOKING_PREFIX + line.text());
        accumulator.closeCharge();
        return Step.advance(ParserState.CAPTURE_CHARGES);
    }

    private Step consumeIdDate(ExtractionContext context, LineClassification line, ParserState state) {
        RecordAccumulator accumulator = context.accumulator();
        IdDateMatch idDate = line.idDate().orElseThrow();
        if (accumulator.hasIdentifierAndDate()) {
            if (heldForNextRecord(context, line)) {
                return Step.advance(state);
            }
            accumulator.acceptIdDate(idDate);
            accumulator.appendAddress(line.before(idDate.start()));
            accumulator.appendAddress(line.after(idDate.end()));
            return Step.advance(state);
        }
        accumulator.acceptIdDate(idDate);
        accumulator.appendAddress(line.before(idDate.start()));
        if (EmbeddedEntitySplitter.absorbTrailing(context, line.after(idDate.end()))) {
            return Step.advance(ParserState.CAPTURE_CHARGES);
        }
        return Step.advance(context.nextLineIsBooking() ? ParserState.CAPTURE_CHARGES : ParserState.SEEK_ID_DATE);
    }

    private Step afterPartialIdDate(ExtractionContext context) {
        boolean ready = context.accumulator().hasIdentifierAndDate() && context.nextLineIsBooking();
        return Step.advance(ready ? ParserState.CAPTURE_CHARGES : ParserState.SEEK_ID_DATE);
    }

    /**
     * A line holding nothing but an identifier and date, directly above a name, belongs to that name.
     */
    private static boolean heldForNextRecord(ExtractionContext context, LineClassification line) {
        if (!context.nextLineIsName()) {
            return false;
        }
        Optional<IdDateMatch> idDate = context.patterns().findIdDate(line.text());
        if (idDate.isEmpty() || !line.before(idDate.get().start()).isEmpty() || !line.after(idDate.get().end()).isEmpty()) {
            return false;
        }
        context.leaveForNextRecord();
        return true;
    }
}
