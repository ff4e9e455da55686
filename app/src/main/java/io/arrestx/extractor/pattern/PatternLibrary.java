package io.arrestx.extractor.pattern;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed set of line recognizers for book-in report text.
 *
 * <p>All patterns are compiled once and the library holds no mutable state, so one instance can be shared by any
 * number of concurrent scans. Name recognizers come in a strict (upper-case only) and a tolerant (mixed case)
 * variant; the tolerant one is consulted only when enabled and only after the strict one failed, and the
 * resulting {@link NameMatch#tolerant()} flag lets callers downgrade confidence.
 */
public final class PatternLibrary {

    private static final String UPPER = "A-Z";
    private static final String MIXED = "A-Za-z";
    private static final String ID = "(?<id>\\d{5,8})";
    private static final String DATE = "(?<date>\\d{1,2}/\\d{1,2}/\\d{4})";

    private static final String CID = "(?:(?:\\s*(?i:CID|C\\.?I\\.?D\\.?)\\s*|\\s+)(?<cid>\\d{4,10}))?";
    private static final String ID_CID_DATE = ID + CID + "\\s+" + DATE;

    private static final Pattern ID_DATE = Pattern.compile(
            "(?<![\\d\\-/])(?:(?i:IDENTIFIER)\\s*)?" + ID_CID_DATE + "(?![\\d/])");
    private static final Pattern IDENTIFIER_ONLY = Pattern.compile("^" + ID + "$");
    private static final Pattern DATE_ONLY = Pattern.compile("^" + DATE + "$");
    private static final Pattern BOOKING = Pattern.compile("^(?<booking>\\d{2}-\\d{6,7})(?:\\s+(?<desc>.*))?$");
    private static final Pattern BOOKING_NUMBER = Pattern.compile("^\\d{2}-\\d{6,7}$");
    private static final Pattern MALFORMED_BOOKING = Pattern.compile("^\\d{1,3}-\\d+(?:\\s|$)");

    private static final String STREET_TYPES = "ST|AVE|BLVD|DR|LN|RD|CT|WAY|CIR|TRL|PKWY|HWY|FWY|PL|LOOP";
    private static final String CITY_PREFIXES = "FORT|FT|SAN|LOS|LAS|NEW|NORTH|SOUTH|EAST|WEST|GRAND|EL|LA|ST|PORT|LAKE|MOUNT|MT|CEDAR|HALTOM|RICHLAND|WHITE";
    private static final Pattern STREET_ZIP_SUFFIX = Pattern.compile(
            "(?:^|(?<=\\s))\\d+\\s+[A-Za-z0-9 .,#\\-']*?\\b[A-Z]{2},?\\s+\\d{5}(?:-\\d{4})?$");
    private static final Pattern STREET_TYPE_SUFFIX = Pattern.compile(
            "(?:^|(?<=\\s))\\d+\\s+(?:[A-Z0-9.'\\-]+\\s+){0,3}(?:" + STREET_TYPES + ")\\.?$");
    private static final Pattern CITY_STATE_ZIP_SUFFIX = Pattern.compile(
            "(?:^|(?<=\\s))(?:(?:" + CITY_PREFIXES + ")\\s+)?[A-Z][A-Z.'\\-]*,?\\s+[A-Z]{2}\\s+\\d{5}(?:-\\d{4})?$");

    private final NamePatterns strict = new NamePatterns(UPPER);
    private final NamePatterns tolerant = new NamePatterns(MIXED);
    private final boolean tolerantNames;

    public PatternLibrary(boolean tolerantNames) {
        this.tolerantNames = tolerantNames;
    }

    public static PatternLibrary strictOnly() {
        return new PatternLibrary(false);
    }

    public boolean tolerantNames() {
        return tolerantNames;
    }

    /**
     * Runs the recognizer for one line kind against a whole line.
     */
    public Optional<LineClassification> recognize(LineKind kind, String line) {
        String text = line == null ? "" : line.trim();
        return switch (kind) {
            case NAME_ID_DATE -> matchNameWithIdDate(text);
            case NAME -> matchName(text).map(name -> LineClassification.ofName(LineKind.NAME, text, name));
            case BOOKING -> matchBooking(text).map(booking -> LineClassification.ofBooking(text, booking));
            case MALFORMED_BOOKING -> isMalformedBooking(text)
                    ? Optional.of(LineClassification.plain(LineKind.MALFORMED_BOOKING, text))
                    : Optional.empty();
            case ID_DATE -> findIdDate(text).map(match -> LineClassification.ofIdDate(text, match));
            case IDENTIFIER_ONLY -> IDENTIFIER_ONLY.matcher(text).matches()
                    ? Optional.of(LineClassification.plain(LineKind.IDENTIFIER_ONLY, text))
                    : Optional.empty();
            case DATE_ONLY -> DATE_ONLY.matcher(text).matches()
                    ? Optional.of(LineClassification.plain(LineKind.DATE_ONLY, text))
                    : Optional.empty();
            case EMBEDDED_NAME -> findEmbeddedName(text)
                    .map(name -> LineClassification.ofName(LineKind.EMBEDDED_NAME, text, name));
            case TEXT, NOISE -> Optional.of(LineClassification.plain(kind, text));
        };
    }

    public Optional<NameMatch> matchName(String line) {
        Optional<NameMatch> match = strict.fullName(line, false);
        if (match.isEmpty() && tolerantNames) {
            match = tolerant.fullName(line, true);
        }
        return match;
    }

    public Optional<LineClassification> matchNameWithIdDate(String line) {
        Optional<LineClassification> match = strict.nameWithIdDate(line, false);
        if (match.isEmpty() && tolerantNames) {
            match = tolerant.nameWithIdDate(line, true);
        }
        return match;
    }

    /**
     * Finds a name signature anywhere in the text, provided it starts the text or follows whitespace.
     */
    public Optional<NameMatch> findEmbeddedName(String text) {
        Optional<NameMatch> match = strict.embedded(text, false);
        if (match.isEmpty() && tolerantNames) {
            match = tolerant.embedded(text, true);
        }
        return match;
    }

    public Optional<IdDateMatch> findIdDate(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = ID_DATE.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(IdDateMatch.of(matcher, matcher.start(), matcher.end()));
    }

    public Optional<BookingMatch> matchBooking(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = BOOKING.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new BookingMatch(matcher.group("booking"), matcher.group("desc")));
    }

    public boolean isBookingLine(String line) {
        return matchBooking(line).isPresent();
    }

    public boolean isMalformedBooking(String line) {
        return line != null && MALFORMED_BOOKING.matcher(line).find() && !isBookingLine(line);
    }

    public boolean isValidBookingNumber(String bookingNo) {
        return bookingNo != null && BOOKING_NUMBER.matcher(bookingNo).matches();
    }

    public boolean isIdentifierOnly(String line) {
        return line != null && IDENTIFIER_ONLY.matcher(line.trim()).matches();
    }

    public boolean isDateOnly(String line) {
        return line != null && DATE_ONLY.matcher(line.trim()).matches();
    }

    /**
     * Locates an address-shaped tail inside longer text. Only proper suffixes count: when the whole text is
     * address-shaped nothing is reported.
     *
     * @return offset where the address suffix begins
     */
    public OptionalInt findAddressSuffix(String text) {
        if (text == null || text.isBlank()) {
            return OptionalInt.empty();
        }
        for (Pattern pattern : new Pattern[] {STREET_ZIP_SUFFIX, STREET_TYPE_SUFFIX, CITY_STATE_ZIP_SUFFIX}) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find() && !text.substring(0, matcher.start()).isBlank()) {
                return OptionalInt.of(matcher.start());
            }
        }
        return OptionalInt.empty();
    }

    private static final class NamePatterns {

        private final Pattern fullName;
        private final Pattern nameWithIdDate;
        private final Pattern embeddedBeforeIdDate;
        private final Pattern embedded;

        private NamePatterns(String letters) {
            String first = "[" + letters + "]";
            String spaced = "[" + letters + "\\-.' ]";
            String token = first + "[" + letters + "\\-.']*";
            this.fullName = Pattern.compile("^(?<last>" + first + spaced + "*),\\s+(?<firstmid>" + first + spaced + "*)$");
            this.nameWithIdDate = Pattern.compile("^(?<last>" + first + spaced + "*),\\s+(?<firstmid>" + first + spaced + "*?)"
                    + "\\s+" + ID_CID_DATE + "(?:\\s+(?<rest>.*))?$");
            this.embeddedBeforeIdDate = Pattern.compile("(?<![^\\s])(?<last>" + token + "),\\s+(?<firstmid>" + token
                    + "(?:\\s+" + token + ")*?)(?=\\s+\\d{5,8}(?:\\s+\\d{4,10})?\\s+\\d{1,2}/\\d{1,2}/\\d{4})");
            this.embedded = Pattern.compile("(?<![^\\s])(?<last>" + token + "),\\s+(?<firstmid>" + token + ")(?![A-Za-z\\-.'])");
        }

        Optional<NameMatch> fullName(String line, boolean tolerant) {
            if (line == null) {
                return Optional.empty();
            }
            Matcher matcher = fullName.matcher(line);
            if (!matcher.matches()) {
                return Optional.empty();
            }
            return Optional.of(toName(matcher, tolerant));
        }

        Optional<LineClassification> nameWithIdDate(String line, boolean tolerant) {
            if (line == null) {
                return Optional.empty();
            }
            Matcher matcher = nameWithIdDate.matcher(line);
            if (!matcher.matches()) {
                return Optional.empty();
            }
            IdDateMatch idDate = IdDateMatch.of(matcher, matcher.start("id"), matcher.end("date"));
            return Optional.of(LineClassification.ofNameAndIdDate(line, toName(matcher, tolerant), idDate));
        }

        Optional<NameMatch> embedded(String text, boolean tolerant) {
            if (text == null) {
                return Optional.empty();
            }
            Matcher matcher = embeddedBeforeIdDate.matcher(text);
            if (matcher.find()) {
                return Optional.of(toName(matcher, tolerant));
            }
            matcher = embedded.matcher(text);
            if (matcher.find()) {
                return Optional.of(toName(matcher, tolerant));
            }
            return Optional.empty();
        }

        private static NameMatch toName(Matcher matcher, boolean tolerant) {
            return new NameMatch(matcher.group("last"), matcher.group("firstmid"),
                    matcher.start("last"), matcher.end("firstmid"), tolerant);
        }
    }
}
