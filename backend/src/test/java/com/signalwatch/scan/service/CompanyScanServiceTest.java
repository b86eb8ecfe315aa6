package com.signalwatch.scan.service;

import com.signalwatch.config.ScannerProperties;
import com.signalwatch.scan.detect.MismatchDetector;
import com.signalwatch.scan.extract.DocumentTextReader;
import com.signalwatch.scan.extract.RegexFactExtractor;
import com.signalwatch.scan.http.CompaniesHouseClient;
import com.signalwatch.scan.http.CompanyNotFoundException;
import com.signalwatch.scan.http.ScanCancelledException;
import com.signalwatch.scan.http.UpstreamUnavailableException;
import com.signalwatch.scan.model.CompanyRecord;
import com.signalwatch.scan.model.CompanyStatus;
import com.signalwatch.scan.model.DocumentContent;
import com.signalwatch.scan.model.FilingDocument;
import com.signalwatch.scan.model.FilingDocumentType;
import com.signalwatch.scan.model.MismatchType;
import com.signalwatch.scan.model.ScanResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompanyScanServiceTest {
    @Mock
    private CompaniesHouseClient client;

    private ScannerProperties properties;
    private ExecutorService executor;
    private CompanyScanService service;

    private final CompanyRecord record = new CompanyRecord(
        "01234567", "ACME WIDGETS LIMITED", CompanyStatus.ACTIVE, LocalDate.of(1999, 5, 10),
        null, null, Set.of(), "ltd", List.of()
    );

    @BeforeEach
    void setUp() {
        properties = new ScannerProperties();
        executor = Executors.newFixedThreadPool(2);
        service = new CompanyScanService(properties, new DocumentTextReader(), new MismatchDetector(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void scansRelevantDocumentsAndReportsMismatches() {
        when(client.getProfile("01234567")).thenReturn(record);
        when(client.getFilingHistory("01234567")).thenReturn(List.of(
            filing("inc-1", FilingDocumentType.INCORPORATION),
            filing("acc-1", FilingDocumentType.OTHER),
            filing("bad-1", FilingDocumentType.NAME_CHANGE)
        ));
        when(client.downloadDocument("inc-1")).thenReturn(text("inc-1", "Date of incorporation: 12/05/1999"));
        when(client.downloadDocument("bad-1")).thenThrow(new UpstreamUnavailableException("storage down"));

        ScanResult result = service.scanCompany(client, "1234567", new RegexFactExtractor(), true, false);

        assertThat(result.isError()).isFalse();
        assertThat(result.companyNumber()).isEqualTo("01234567");
        assertThat(result.documentsScanned()).isEqualTo(1);
        assertThat(result.mismatches().mismatches()).singleElement()
            .satisfies(mismatch -> assertThat(mismatch.type()).isEqualTo(MismatchType.DATE_MISMATCH));
        assertThat(result.warnings()).containsExactly("document_unavailable:bad-1:UPSTREAM_UNAVAILABLE");
        assertThat(result.provenance().extractor()).isEqualTo("regex");
        assertThat(result.provenance().activeDirectorsOnly()).isTrue();
        verify(client, never()).downloadDocument("acc-1");
    }

    @Test
    void missingFilingHistoryStillCompletes() {
        when(client.getProfile("01234567")).thenReturn(record);
        when(client.getFilingHistory("01234567")).thenThrow(new CompanyNotFoundException("no filing history"));

        ScanResult result = service.scanCompany(client, "01234567", new RegexFactExtractor(), false, false);

        assertThat(result.documentsScanned()).isZero();
        assertThat(result.mismatches().isEmpty()).isTrue();
        assertThat(result.warnings()).containsExactly("filing_history_unavailable:NOT_FOUND");
    }

    @Test
    void deniedDocumentBecomesWarning() {
        when(client.getProfile("01234567")).thenReturn(record);
        when(client.getFilingHistory("01234567")).thenReturn(List.of(
            filing("inc-1", FilingDocumentType.INCORPORATION),
            filing("noc-1", FilingDocumentType.NAME_CHANGE)
        ));
        when(client.downloadDocument("inc-1")).thenReturn(text("inc-1", "Date of incorporation: 10/05/1999"));
        when(client.downloadDocument("noc-1"))
            .thenThrow(new InvalidScanRequestException("Companies House rejected the API key (HTTP 403)"));

        ScanResult result = service.scanCompany(client, "01234567", new RegexFactExtractor(), false, false);

        assertThat(result.isError()).isFalse();
        assertThat(result.documentsScanned()).isEqualTo(1);
        assertThat(result.warnings()).containsExactly("document_unavailable:noc-1:INVALID_INPUT");
    }

    @Test
    void cancelledDocumentFailsTheCompany() {
        when(client.getProfile("01234567")).thenReturn(record);
        when(client.getFilingHistory("01234567")).thenReturn(List.of(filing("inc-1", FilingDocumentType.INCORPORATION)));
        when(client.downloadDocument("inc-1")).thenThrow(new ScanCancelledException("scan_deadline_exceeded"));

        assertThatThrownBy(() -> service.scanCompany(client, "01234567", new RegexFactExtractor(), false, false))
            .isInstanceOf(ScanCancelledException.class);
    }

    @Test
    void missingProfileFailsTheCompany() {
        when(client.getProfile("01234567")).thenThrow(new CompanyNotFoundException("Registry has no company 01234567"));

        assertThatThrownBy(() -> service.scanCompany(client, "01234567", new RegexFactExtractor(), true, false))
            .isInstanceOf(CompanyNotFoundException.class);
        verify(client, never()).getFilingHistory(anyString());
    }

    @Test
    void documentSelectionIsCapped() {
        properties.getRegistry().setMaxDocumentsPerCompany(1);

        List<FilingDocument> selected = service.selectRelevant(List.of(
            filing("a", FilingDocumentType.OTHER),
            filing("b", FilingDocumentType.ANNUAL_RETURN),
            filing("c", FilingDocumentType.INCORPORATION)
        ));

        assertThat(selected).extracting(FilingDocument::documentId).containsExactly("b");
    }

    private static FilingDocument filing(String documentId, FilingDocumentType type) {
        return new FilingDocument(documentId, "01234567", type, type.value(), null, LocalDate.of(2000, 1, 1), Instant.now());
    }

    private static DocumentContent text(String documentId, String body) {
        return new DocumentContent(documentId, "text/plain", body.getBytes(StandardCharsets.UTF_8));
    }
}
