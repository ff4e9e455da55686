package io.arrestx.extractor.pattern;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class PatternLibraryTest {

    private final PatternLibrary strict = PatternLibrary.strictOnly();
    private final PatternLibrary tolerant = new PatternLibrary(true);

    @Test
    void matchesUpperCaseNameWithMiddleName() {
        Optional<NameMatch> match = strict.matchName("ADAMS, NINA KISHA");

        assertThat(match).isPresent();
        assertThat(match.get().raw()).isEqualTo("ADAMS, NINA KISHA");
        assertThat(match.get().normalized()).isEqualTo("Nina Kisha Adams");
        assertThat(match.get().tolerant()).isFalse();
    }

    @Test
    void acceptsHyphenApostropheAndPeriodInNames() {
        Optional<NameMatch> match = strict.matchName("O'BRIEN-SMITH, MARY J.");

        assertThat(match).isPresent();
        assertThat(match.get().normalized()).isEqualTo("Mary J. O'Brien-Smith");
    }

    @Test
    void mixedCaseNamesNeedTolerantMatching() {
        assertThat(strict.matchName("Adams, Nina")).isEmpty();

        Optional<NameMatch> match = tolerant.matchName("Adams, Nina");
        assertThat(match).isPresent();
        assertThat(match.get().tolerant()).isTrue();
    }

    @Test
    void tolerantLibraryStillPrefersStrictMatch() {
        assertThat(tolerant.matchName("ADAMS, NINA")).get().extracting(NameMatch::tolerant).isEqualTo(false);
    }

    @Test
    void rejectsAddressLineWithZipAsName() {
        assertThat(strict.matchName("ORLANDO, FL 32801")).isEmpty();
    }

    @Test
    void matchesNameIdentifierAndDateOnOneLine() {
        Optional<LineClassification> match = strict.matchNameWithIdDate("AGUILAR, JUAN 1234567 10/15/2025");

        assertThat(match).isPresent();
        assertThat(match.get().kind()).isEqualTo(LineKind.NAME_ID_DATE);
        assertThat(match.get().name()).get().extracting(NameMatch::raw).isEqualTo("AGUILAR, JUAN");
        assertThat(match.get().idDate()).get().extracting(IdDateMatch::identifier).isEqualTo("1234567");
        assertThat(match.get().idDate()).get().extracting(IdDateMatch::rawDate).isEqualTo("10/15/2025");
    }

    @Test
    void findsIdentifierAndDateAnywhereInLine() {
        String text = "APT 4 1234567 10/15/2025 ORLANDO";
        Optional<IdDateMatch> match = strict.findIdDate(text);

        assertThat(match).isPresent();
        assertThat(match.get().identifier()).isEqualTo("1234567");
        assertThat(text.substring(0, match.get().start()).trim()).isEqualTo("APT 4");
        assertThat(text.substring(match.get().end()).trim()).isEqualTo("ORLANDO");
    }

    @Test
    void keepsFirstNumberAsIdentifierWhenCidColumnIsPresent() {
        Optional<IdDateMatch> match = strict.findIdDate("1234567 654321 10/15/2025");

        assertThat(match).isPresent();
        assertThat(match.get().identifier()).isEqualTo("1234567");
        assertThat(match.get().cid()).contains("654321");
        assertThat(match.get().rawDate()).isEqualTo("10/15/2025");
        assertThat(strict.findIdDate("1234567 10/15/2025").orElseThrow().cid()).isEmpty();
    }

    @Test
    void readsLabelledIdentifierCidAndDate() {
        String text = "123 MAIN ST IDENTIFIER 1234567 CID 654321 10/15/2025";
        Optional<IdDateMatch> match = strict.findIdDate(text);

        assertThat(match).isPresent();
        assertThat(match.get().identifier()).isEqualTo("1234567");
        assertThat(match.get().cid()).contains("654321");
        assertThat(text.substring(0, match.get().start()).trim()).isEqualTo("123 MAIN ST");
    }

    @Test
    void nameLineMayCarryCidBetweenIdentifierAndDate() {
        Optional<LineClassification> match = strict.matchNameWithIdDate("AGUILAR, JUAN 1234567 654321 10/15/2025");

        assertThat(match).isPresent();
        assertThat(match.get().name()).get().extracting(NameMatch::raw).isEqualTo("AGUILAR, JUAN");
        assertThat(match.get().idDate()).get().extracting(IdDateMatch::identifier).isEqualTo("1234567");
        assertThat(strict.findEmbeddedName("NO VALID DL WYATT, JOSH 9876543 1234 10/12/2025"))
                .get().extracting(NameMatch::raw).isEqualTo("WYATT, JOSH");
    }

    @Test
    void doesNotTakeBookingDigitsForIdentifier() {
        assertThat(strict.findIdDate("25-0240350 10/15/2025")).isEmpty();
    }

    @Test
    void splitsBookingNumberFromDescription() {
        Optional<BookingMatch> match = strict.matchBooking("25-0240350 NO VALID DL");

        assertThat(match).contains(new BookingMatch("25-0240350", "NO VALID DL"));
        assertThat(strict.matchBooking("25-024035")).contains(new BookingMatch("25-024035", ""));
    }

    @Test
    void recognizesMalformedBookingShape() {
        assertThat(strict.isMalformedBooking("25-12 BAD")).isTrue();
        assertThat(strict.isMalformedBooking("25-0240350 NO VALID DL")).isFalse();
        assertThat(strict.isMalformedBooking("123 MAIN ST")).isFalse();
        assertThat(strict.isValidBookingNumber("25-12")).isFalse();
        assertThat(strict.isValidBookingNumber("25-0240350")).isTrue();
    }

    @Test
    void recognizesIdentifierOnlyAndDateOnlyLines() {
        assertThat(strict.isIdentifierOnly("1234567")).isTrue();
        assertThat(strict.isIdentifierOnly("1234")).isFalse();
        assertThat(strict.isDateOnly("10/15/2025")).isTrue();
        assertThat(strict.isDateOnly("10/15/25")).isFalse();
    }

    @Test
    void findsAddressSuffixInsideChargeText() {
        String street = "NO VALID DL 123 MAIN ST";
        assertThat(strict.findAddressSuffix(street)).hasValue(street.indexOf("123"));

        String city = "THEFT PROP FORT WORTH, TX 76102";
        assertThat(strict.findAddressSuffix(city)).hasValue(city.indexOf("FORT"));

        assertThat(strict.findAddressSuffix("123 MAIN ST")).isEmpty();
        assertThat(strict.findAddressSuffix("DRIVING WHILE INTOXICATED")).isEmpty();
    }

    @Test
    void embeddedNameKeepsMiddleNamesBeforeIdentifier() {
        String text = "NO VALID DL WYATT, JOSH LEE 9876543 10/12/2025";
        Optional<NameMatch> match = strict.findEmbeddedName(text);

        assertThat(match).isPresent();
        assertThat(match.get().raw()).isEqualTo("WYATT, JOSH LEE");
        assertThat(text.substring(0, match.get().start()).trim()).isEqualTo("NO VALID DL");
    }

    @Test
    void embeddedNameMustFollowWhitespace() {
        assertThat(strict.findEmbeddedName("POSS CS PG1,<1G")).isEmpty();
        assertThat(strict.findEmbeddedName("X-WYATT,JOSH")).isEmpty();
    }

    @Test
    void textAndNoiseAlwaysRecognized() {
        assertThat(strict.recognize(LineKind.TEXT, "anything")).isPresent();
        assertThat(strict.recognize(LineKind.NOISE, "")).isPresent();
        assertThat(strict.recognize(LineKind.BOOKING, "anything")).isEmpty();
    }
}
