package io.arrestx.extractor.pattern;

import java.util.Objects;

/**
 * A recognized "LAST, FIRST MIDDLE" signature and its location inside the line.
 */
public record NameMatch(String last, String firstMiddle, int start, int end, boolean tolerant) {

    public NameMatch {
        last = Objects.requireNonNull(last, "last").trim();
        firstMiddle = Objects.requireNonNull(firstMiddle, "firstMiddle").trim();
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid name match boundaries");
        }
    }

    /**
     * The name as printed on the report.
     */
    public String raw() {
        return last + ", " + firstMiddle;
    }

    /**
     * "First Middle Last" in title case.
     */
    public String normalized() {
        return titleCase(firstMiddle) + " " + titleCase(last);
    }

    static String titleCase(String value) {
        StringBuilder builder = new StringBuilder(value.length());
        boolean startOfWord = true;
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (Character.isLetter(ch)) {
                builder.append(startOfWord
                        ? Character.toUpperCase(ch)
                        : Character.toLowerCase(ch));
                startOfWord = false;
            } else {
                builder.append(ch);
                startOfWord = true;
            }
        }
        return builder.toString().replaceAll("\\s+", " ");
    }
}
