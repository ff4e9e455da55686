package io.arrestx.extractor.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered text lines of one page, top to bottom.
 */
public record SourcePage(int number, List<String> lines) {

    public SourcePage {
        if (number < 0) {
            throw new IllegalArgumentException("page number must not be negative");
        }
        lines = lines == null ? List.of() : lines.stream().filter(Objects::nonNull).toList();
    }
}
