package io.arrestx.extractor.model;

import java.util.Objects;

/**
 * One text line of the flattened input, tagged with its position and page.
 */
public record SourceLine(int index, int page, String text) {

    public SourceLine {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
        text = Objects.requireNonNullElse(text, "");
    }
}
