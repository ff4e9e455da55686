package io.arrestx.extractor.engine;

import io.arrestx.extractor.pattern.LineClassification;

/**
 * Action bound to a (state, line kind) pair in the {@link TransitionTable}.
 */
@FunctionalInterface
public interface TransitionAction {

    Step apply(ExtractionContext context, LineClassification line);
}
