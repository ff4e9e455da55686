package io.arrestx.extractor.engine;

import java.util.Objects;

/**
 * Outcome of one transition: the next state and whether the current line was consumed.
 * A step that does not consume hands the same line to the next state.
 */
public record Step(ParserState next, boolean consumed) {

    public Step {
        Objects.requireNonNull(next, "next");
    }

    public static Step advance(ParserState next) {
        return new Step(next, true);
    }

    public static Step redispatch(ParserState next) {
        return new Step(next, false);
    }
}
