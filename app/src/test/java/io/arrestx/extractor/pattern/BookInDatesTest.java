package io.arrestx.extractor.pattern;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class BookInDatesTest {

    @Test
    void parsesSingleAndDoubleDigitParts() {
        assertThat(BookInDates.parse("10/15/2025")).contains(LocalDate.of(2025, 10, 15));
        assertThat(BookInDates.parse("1/5/2025")).contains(LocalDate.of(2025, 1, 5));
    }

    @Test
    void rejectsImpossibleDates() {
        assertThat(BookInDates.parse("2/30/2025")).isEmpty();
        assertThat(BookInDates.parse("13/01/2025")).isEmpty();
        assertThat(BookInDates.parse(" ")).isEmpty();
    }
}
