package io.arrestx.extractor.preprocess;

import io.arrestx.extractor.model.SourcePage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default implementation: drops report headers, footers and blank lines, collapses whitespace and splits
 * {@code " | "} separated columns into separate lines. Page numbers are kept.
 */
public class DefaultLinePreprocessor implements LinePreprocessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultLinePreprocessor.class);

    public static final List<String> DEFAULT_HEADER_PATTERNS = List.of(
            "^Daily Booked In Report$",
            "^Inmates Booked In\\b.*",
            "^Inmate Name\\s+Identifier\\s+CID\\s+Book In Date\\s+Booking No\\.\\s+Description$",
            "^Page:?\\s*\\d+(?:\\s+of\\s+\\d+)?$",
            "^\\d+\\s+of\\s+\\d+$",
            "^[-\\s]{5,}$",
            "^Report Date:.*");

    private static final Set<String> SPLIT_HEADER_TOKENS = Set.of(
            "INMATE NAME", "IDENTIFIER", "CID", "BOOK IN DATE", "BOOKING NO.", "DESCRIPTION",
            "INMATE", "NAME", "BOOK", "IN", "DATE", "BOOKING", "NO.", "PAGE:");

    private static final String COLUMN_SEPARATOR = " | ";

    private final List<Pattern> headerPatterns;

    public DefaultLinePreprocessor() {
        this(DEFAULT_HEADER_PATTERNS);
    }

    public DefaultLinePreprocessor(List<String> headerPatterns) {
        Objects.requireNonNull(headerPatterns, "headerPatterns");
        this.headerPatterns = headerPatterns.stream()
                .map(pattern -> Pattern.compile(pattern, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    @Override
    public List<SourcePage> preprocess(List<SourcePage> pages) {
        if (pages == null || pages.isEmpty()) {
            return Collections.emptyList();
        }
        List<SourcePage> cleaned = new ArrayList<>(pages.size());
        for (SourcePage page : pages) {
            if (page == null) {
                continue;
            }
            List<String> lines = new ArrayList<>();
            for (String raw : page.lines()) {
                for (String column : columns(raw)) {
                    String line = collapse(column);
                    if (line.isEmpty()) {
                        continue;
                    }
                    if (isHeaderOrFooter(line)) {
                        LOGGER.debug("Skipping header/footer on page {}: {}", page.number(), line);
                        continue;
                    }
                    lines.add(line);
                }
            }
            cleaned.add(new SourcePage(page.number(), lines));
        }
        return cleaned;
    }

    public boolean isHeaderOrFooter(String line) {
        String text = collapse(line);
        if (SPLIT_HEADER_TOKENS.contains(text.toUpperCase(Locale.ROOT))) {
            return true;
        }
        return headerPatterns.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }

    private static List<String> columns(String line) {
        if (line == null) {
            return List.of();
        }
        if (!line.contains(COLUMN_SEPARATOR)) {
            return List.of(line);
        }
        return List.of(line.split(Pattern.quote(COLUMN_SEPARATOR)));
    }

    private static String collapse(String text) {
        return text == null ? "" : text.trim().replaceAll("\\s+", " ");
    }
}
