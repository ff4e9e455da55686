package io.arrestx.extractor.engine;

import io.arrestx.extractor.pattern.LineKind;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable (state, line kind) to action mapping driving the {@link ExtractionStateMachine}.
 *
 * <p>Pairs without an explicit action fall back to skipping the line in the current state.
 */
public final class TransitionTable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransitionTable.class);

    private final Map<ParserState, Map<LineKind, TransitionAction>> actions;

    private TransitionTable(Map<ParserState, Map<LineKind, TransitionAction>> actions) {
        this.actions = actions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public TransitionAction action(ParserState state, LineKind kind) {
        TransitionAction action = actions.getOrDefault(state, Map.of()).get(kind);
        if (action != null) {
            return action;
        }
        return (context, line) -> {
            LOGGER.debug("No transition for {} on {}; skipping line {}", state, kind, context.index() + 1);
            return Step.advance(state);
        };
    }

    public boolean defines(ParserState state, LineKind kind) {
        return actions.getOrDefault(state, Map.of()).containsKey(kind);
    }

    public static final class Builder {

        private final Map<ParserState, Map<LineKind, TransitionAction>> actions = new EnumMap<>(ParserState.class);

        private Builder() {
        }

        public Builder on(ParserState state, LineKind kind, TransitionAction action) {
            Objects.requireNonNull(action, "action");
            actions.computeIfAbsent(state, ignored -> new EnumMap<>(LineKind.class)).put(kind, action);
            return this;
        }

        public Builder on(ParserState state, TransitionAction action, LineKind... kinds) {
            for (LineKind kind : kinds) {
                on(state, kind, action);
            }
            return this;
        }

        public TransitionTable build() {
            Map<ParserState, Map<LineKind, TransitionAction>> copy = new EnumMap<>(ParserState.class);
            actions.forEach((state, byKind) -> copy.put(state, Collections.unmodifiableMap(new EnumMap<>(byKind))));
            return new TransitionTable(Collections.unmodifiableMap(copy));
        }
    }
}
