package com.signalwatch.scan.service;

import com.signalwatch.config.ScannerProperties;
import com.signalwatch.scan.http.CompaniesHouseClient;
import com.signalwatch.scan.model.CompanySearchFilters;
import com.signalwatch.scan.model.CompanyStatus;
import com.signalwatch.scan.model.CompanySummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompanySearchServiceTest {
    @Mock
    private CompaniesHouseClient client;

    private ScannerProperties properties;
    private CompanySearchService service;

    @BeforeEach
    void setUp() {
        properties = new ScannerProperties();
        service = new CompanySearchService(properties);
    }

    @Test
    void appliesClientSideFiltersAfterQuerySearch() {
        when(client.search("widgets", "active", 10)).thenReturn(List.of(
            summary("00000001", LocalDate.of(2001, 1, 1), null, "1 Road, Leeds", "62020", "ltd"),
            summary("00000002", LocalDate.of(1995, 1, 1), null, "2 Road, Leeds", "62020", "ltd"),
            summary("00000003", LocalDate.of(2003, 1, 1), null, "3 Road, York", "62020", "ltd"),
            summary("00000004", LocalDate.of(2004, 1, 1), null, "4 Road, leeds", "47110", "ltd"),
            summary("00000005", LocalDate.of(2005, 1, 1), null, "5 Road, Leeds", "62020", "plc")
        ));
        CompanySearchFilters filters = new CompanySearchFilters(
            "widgets", null, null, "active", 2000, 2010, "LEEDS", List.of("62020"), List.of("ltd"), null, null, 10
        );

        List<CompanySummary> matches = service.findCompanies(client, filters);

        assertThat(matches).extracting(CompanySummary::companyNumber).containsExactly("00000001");
    }

    @Test
    void dissolvedRangeRequiresDissolutionDate() {
        CompanySearchFilters filters = new CompanySearchFilters(
            null, null, null, null, null, null, null, null, null, LocalDate.of(2020, 1, 1), LocalDate.of(2020, 12, 31), null
        );

        assertThat(service.matches(summary("1", null, LocalDate.of(2020, 6, 1), null, null, null), filters)).isTrue();
        assertThat(service.matches(summary("2", null, LocalDate.of(2021, 6, 1), null, null, null), filters)).isFalse();
        assertThat(service.matches(summary("3", null, null, null, null, null), filters)).isFalse();
    }

    @Test
    void alphabeticalRangeSearchesEachLetterAndDeduplicates() {
        when(client.search("A", null, 3)).thenReturn(List.of(summary("00000001"), summary("00000002")));
        when(client.search("B", null, 3)).thenReturn(List.of(summary("00000002"), summary("00000003"), summary("00000004")));
        CompanySearchFilters filters = new CompanySearchFilters(
            null, "a", "c", null, null, null, null, null, null, null, null, 3
        );

        List<CompanySummary> matches = service.findCompanies(client, filters);

        assertThat(matches).extracting(CompanySummary::companyNumber).containsExactly("00000001", "00000002", "00000003");
        verify(client, never()).search(eq("C"), any(), anyInt());
    }

    @Test
    void letterRangeIsCappedAndValidated() {
        properties.getSearch().setMaxLetters(3);

        assertThat(service.letters("a", "z")).containsExactly("A", "B", "C");
        assertThat(service.letters(null, "z")).isEmpty();
        assertThatThrownBy(() -> service.letters("d", "b")).isInstanceOf(InvalidScanRequestException.class);
        assertThatThrownBy(() -> service.letters("1", "b")).isInstanceOf(InvalidScanRequestException.class);
    }

    private static CompanySummary summary(String number) {
        return summary(number, null, null, null, null, null);
    }

    private static CompanySummary summary(
        String number,
        LocalDate created,
        LocalDate dissolved,
        String address,
        String sicCode,
        String type
    ) {
        return new CompanySummary(
            number,
            "Company " + number,
            CompanyStatus.ACTIVE,
            created,
            dissolved,
            type,
            address,
            sicCode == null ? List.of() : List.of(sicCode)
        );
    }
}
