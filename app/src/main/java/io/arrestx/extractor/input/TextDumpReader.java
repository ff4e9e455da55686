package io.arrestx.extractor.input;

import io.arrestx.extractor.model.SourceDocument;
import io.arrestx.extractor.model.SourcePage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a UTF-8 text dump of a report. Pages are separated by form feed characters; pages are numbered from 1.
 */
public class TextDumpReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(TextDumpReader.class);
    private static final String PAGE_BREAK = "\f";

    public SourceDocument read(Path path) {
        Objects.requireNonNull(path, "path");
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read text dump " + path, ex);
        }
        SourceDocument document = parse(path.getFileName().toString(), content);
        LOGGER.info("Read {} page(s), {} line(s) from {}", document.pages().size(), document.lineCount(), path);
        return document;
    }

    public SourceDocument parse(String sourceName, String content) {
        if (content == null || content.isEmpty()) {
            return new SourceDocument(sourceName, List.of());
        }
        String[] chunks = content.split(PAGE_BREAK, -1);
        List<SourcePage> pages = new ArrayList<>(chunks.length);
        for (int i = 0; i < chunks.length; i++) {
            List<String> lines = chunks[i].lines().toList();
            if (i == chunks.length - 1 && i > 0 && lines.stream().allMatch(String::isBlank)) {
                break;
            }
            pages.add(new SourcePage(i + 1, lines));
        }
        return new SourceDocument(sourceName, pages);
    }
}
