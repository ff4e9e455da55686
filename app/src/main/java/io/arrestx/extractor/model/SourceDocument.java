package io.arrestx.extractor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single report as handed over by the text extraction collaborator.
 */
public record SourceDocument(String sourceName, List<SourcePage> pages) {

    public SourceDocument {
        sourceName = sourceName == null ? "" : sourceName;
        pages = pages == null ? List.of() : pages.stream().filter(Objects::nonNull).toList();
    }

    public static SourceDocument of(String sourceName, List<String> lines) {
        return new SourceDocument(sourceName, List.of(new SourcePage(1, lines)));
    }

    /**
     * Flattens the pages into a single page-tagged line sequence.
     */
    public List<SourceLine> flatten() {
        return flatten(pages);
    }

    public static List<SourceLine> flatten(List<SourcePage> pages) {
        if (pages == null || pages.isEmpty()) {
            return Collections.emptyList();
        }
        List<SourceLine> lines = new ArrayList<>();
        for (SourcePage page : pages) {
            if (page == null) {
                continue;
            }
            for (String text : page.lines()) {
                lines.add(new SourceLine(lines.size(), page.number(), text));
            }
        }
        return lines;
    }

    public int lineCount() {
        return pages.stream().mapToInt(page -> page.lines().size()).sum();
    }
}
