package com.signalwatch.scan.extract;

import com.signalwatch.scan.model.DateDiscrepancy;
import com.signalwatch.scan.model.DateRange;
import com.signalwatch.scan.model.FactContext;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

import static org.assertj.core.api.Assertions.assertThat;

class DateFactExtractorTest {
    private final DateFactExtractor extractor = new DateFactExtractor();

    @Test
    void readsNumericIncorporationDateDayFirst() {
        SortedSet<LocalDate> dates = extractor.extract("Date of incorporation: 04/03/1998", FactContext.INCORPORATION);

        assertThat(dates).containsExactly(LocalDate.of(1998, 3, 4));
        assertThat(extractor.extractIncorporationDate("Date of incorporation: 04/03/1998"))
            .contains(LocalDate.of(1998, 3, 4));
    }

    @Test
    void discardsImplausibleYears() {
        assertThat(extractor.extract("Valid until 31/12/9999")).isEmpty();
        assertThat(extractor.extract("Founded 01/01/1700")).isEmpty();
    }

    @Test
    void collectsEveryDistinctDateAscending() {
        String text = """
            Incorporated on 10 May 1999.
            Accounts made up to 31/03/2001 and filed June 5, 2001.
            Repeated: 10 May 1999
            """;

        assertThat(extractor.extract(text, FactContext.INCORPORATION))
            .containsExactly(LocalDate.of(1999, 5, 10), LocalDate.of(2001, 3, 31), LocalDate.of(2001, 6, 5));
    }

    @Test
    void swapsDayAndMonthOnlyWhenDayFirstIsImpossible() {
        assertThat(DatePhraseParser.parse("05/13/2020")).isEqualTo(LocalDate.of(2020, 5, 13));
        assertThat(DatePhraseParser.parse("05/06/2020")).isEqualTo(LocalDate.of(2020, 6, 5));
        assertThat(DatePhraseParser.parse("13/25/2020")).isNull();
    }

    @Test
    void expandsTwoDigitYearsAroundPivot() {
        assertThat(DatePhraseParser.parse("02/01/22")).isEqualTo(LocalDate.of(2022, 1, 2));
        assertThat(DatePhraseParser.parse("01/01/70")).isEqualTo(LocalDate.of(1970, 1, 1));
    }

    @Test
    void monthAndYearResolveToFirstOfMonth() {
        assertThat(DatePhraseParser.parse("effective March 2004")).isEqualTo(LocalDate.of(2004, 3, 1));
    }

    @Test
    void scopesDatesByContextPhrase() {
        String text = "The company changed its name on 3rd of February 2010. Registered on 1 January 2000.";

        Map<FactContext, SortedSet<LocalDate>> scoped = extractor.extractWithContext(text);

        assertThat(scoped.get(FactContext.NAME_CHANGE)).containsExactly(LocalDate.of(2010, 2, 3));
        assertThat(scoped.get(FactContext.REGISTRATION)).containsExactly(LocalDate.of(2000, 1, 1));
        assertThat(scoped).doesNotContainKey(FactContext.INCORPORATION);
        assertThat(extractor.extractNameChangeDate(text)).contains(LocalDate.of(2010, 2, 3));
    }

    @Test
    void findsStatementsEvenWithoutReadableDate() {
        assertThat(extractor.findContextStatements("Date of incorporation: see overleaf"))
            .containsExactly(FactContext.INCORPORATION);
        assertThat(extractor.findContextStatements("nothing relevant here")).isEmpty();
    }

    @Test
    void extractsRangesWhereBothEndsParse() {
        List<DateRange> ranges = extractor.extractDateRanges("Period from 01/01/2020 to 31/12/2020 inclusive");

        assertThat(ranges).hasSize(1);
        assertThat(ranges.get(0).start()).isEqualTo(LocalDate.of(2020, 1, 1));
        assertThat(ranges.get(0).end()).isEqualTo(LocalDate.of(2020, 12, 31));
        assertThat(extractor.extractDateRanges("from now to later")).isEmpty();
    }

    @Test
    void compareDatesIsReflexiveAndSymmetric() {
        LocalDate a = LocalDate.of(2020, 1, 1);
        LocalDate b = LocalDate.of(2020, 1, 4);

        assertThat(extractor.compareDates(a, a, 0)).isTrue();
        assertThat(extractor.compareDates(a, b, 0)).isFalse();
        assertThat(extractor.compareDates(a, b, 3)).isEqualTo(extractor.compareDates(b, a, 3)).isTrue();
        assertThat(extractor.compareDates(a, b, 2)).isFalse();
        assertThat(extractor.compareDates(a, null, 10)).isFalse();
    }

    @Test
    void reportsSignedDifferenceForEachMismatch() {
        List<DateDiscrepancy> mismatches = extractor.findMismatches(
            LocalDate.of(2020, 1, 1),
            List.of(LocalDate.of(2020, 1, 2), LocalDate.of(2020, 1, 1), LocalDate.of(2019, 12, 30)),
            0
        );

        assertThat(mismatches).extracting(DateDiscrepancy::differenceDays).containsExactly(1L, -2L);
        assertThat(mismatches.get(0).expected()).isEqualTo(LocalDate.of(2020, 1, 1));
    }

    @Test
    void validatesNonDecreasingSequences() {
        LocalDate first = LocalDate.of(2001, 1, 1);
        LocalDate second = LocalDate.of(2002, 1, 1);

        assertThat(extractor.validateSequence(List.of())).isTrue();
        assertThat(extractor.validateSequence(List.of(first, first, second))).isTrue();
        assertThat(extractor.validateSequence(List.of(second, first))).isFalse();
        assertThat(extractor.validateSequence(Arrays.asList(first, null))).isFalse();
    }

    @Test
    void formatsInNamedStyles() {
        LocalDate date = LocalDate.of(2021, 3, 5);

        assertThat(extractor.formatDate(date, "uk")).isEqualTo("05/03/2021");
        assertThat(extractor.formatDate(date, "us")).isEqualTo("03/05/2021");
        assertThat(extractor.formatDate(date, "long")).isEqualTo("05 March 2021");
        assertThat(extractor.formatDate(date, "whatever")).isEqualTo("2021-03-05");
    }
}
