package com.signalwatch.scan.detect;

import com.signalwatch.scan.extract.RegexFactExtractor;
import com.signalwatch.scan.model.CompanyRecord;
import com.signalwatch.scan.model.CompanyStatus;
import com.signalwatch.scan.model.DocumentEvidence;
import com.signalwatch.scan.model.ExtractedFact;
import com.signalwatch.scan.model.FactContext;
import com.signalwatch.scan.model.FilingDocument;
import com.signalwatch.scan.model.FilingDocumentType;
import com.signalwatch.scan.model.Mismatch;
import com.signalwatch.scan.model.MismatchReport;
import com.signalwatch.scan.model.MismatchType;
import com.signalwatch.scan.model.PreviousCompanyName;
import com.signalwatch.scan.model.Severity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class MismatchDetectorTest {
    private final MismatchDetector detector = new MismatchDetector();
    private final RegexFactExtractor extractor = new RegexFactExtractor();

    private final CompanyRecord record = new CompanyRecord(
        "01234567",
        "ACME WIDGETS LIMITED",
        CompanyStatus.ACTIVE,
        LocalDate.of(1999, 5, 10),
        null,
        "1 High Street, London",
        Set.of("62020"),
        "ltd",
        List.of(new PreviousCompanyName("ACME HOLDINGS LIMITED", LocalDate.of(1999, 5, 10), LocalDate.of(2005, 8, 1)))
    );

    @Test
    void matchingIncorporationDateIsNotReported() {
        MismatchReport report = detector.report(record, List.of(evidence(
            "inc-1", FilingDocumentType.INCORPORATION, "The company was incorporated on 10 May 1999"
        )));

        assertThat(report.mismatches()).isEmpty();
    }

    @Test
    void differentIncorporationDateIsHighSeverity() {
        MismatchReport report = detector.report(record, List.of(evidence(
            "inc-1", FilingDocumentType.INCORPORATION, "Date of incorporation: 12/05/1999"
        )));

        assertThat(report.total()).isEqualTo(1);
        assertThat(report.high()).isEqualTo(1);
        Mismatch mismatch = report.mismatches().get(0);
        assertThat(mismatch.type()).isEqualTo(MismatchType.DATE_MISMATCH);
        assertThat(mismatch.document()).isEqualTo("inc-1");
        assertThat(mismatch.context()).isEqualTo(FactContext.INCORPORATION);
        assertThat(mismatch.date().expected()).isEqualTo(LocalDate.of(1999, 5, 10));
        assertThat(mismatch.date().found()).isEqualTo(LocalDate.of(1999, 5, 12));
        assertThat(mismatch.date().differenceDays()).isEqualTo(2);
        assertThat(mismatch.message()).contains("+2 days");
    }

    @Test
    void unscopedDatesAreNeverCompared() {
        MismatchReport report = detector.report(record, List.of(evidence(
            "ar-1", FilingDocumentType.ANNUAL_RETURN, "Made up to 31/12/2003 for the period"
        )));

        assertThat(report.mismatches()).isEmpty();
    }

    @Test
    void nameChangeDatesCompareAgainstNameHistory() {
        MismatchReport matching = detector.report(record, List.of(evidence(
            "noc-1", FilingDocumentType.NAME_CHANGE, "Date of change: 01/08/2005"
        )));
        MismatchReport differing = detector.report(record, List.of(evidence(
            "noc-2", FilingDocumentType.NAME_CHANGE, "Date of change: 03/08/2005"
        )));

        assertThat(matching.mismatches()).isEmpty();
        assertThat(differing.medium()).isEqualTo(1);
        assertThat(differing.mismatches().get(0).date().differenceDays()).isEqualTo(2);
    }

    @Test
    void filingDateComparesAgainstDocumentMetadata() {
        MismatchReport report = detector.report(record, List.of(evidence(
            "ar-1", FilingDocumentType.ANNUAL_RETURN, "Filing date: 02/02/2020", LocalDate.of(2020, 2, 1)
        )));

        assertThat(report.low()).isEqualTo(1);
        assertThat(report.mismatches().get(0).context()).isEqualTo(FactContext.FILING);
    }

    @Test
    void statedContextWithoutReadableDateIsMissingDate() {
        MismatchReport report = detector.report(record, List.of(evidence(
            "inc-1", FilingDocumentType.INCORPORATION, "Date of incorporation: illegible stamp"
        )));

        assertThat(report.mismatches()).singleElement().satisfies(mismatch -> {
            assertThat(mismatch.type()).isEqualTo(MismatchType.MISSING_DATE);
            assertThat(mismatch.severity()).isEqualTo(Severity.LOW);
            assertThat(mismatch.date().expected()).isEqualTo(LocalDate.of(1999, 5, 10));
            assertThat(mismatch.date().found()).isNull();
        });
    }

    @Test
    void unknownNameIsHighWhenNoRegisteredNameAppears() {
        MismatchReport report = detector.report(record, List.of(evidence(
            "inc-1", FilingDocumentType.INCORPORATION, "Company name: Widget Traders Ltd"
        )));

        assertThat(report.mismatches()).singleElement().satisfies(mismatch -> {
            assertThat(mismatch.type()).isEqualTo(MismatchType.NAME_MISMATCH);
            assertThat(mismatch.severity()).isEqualTo(Severity.HIGH);
            assertThat(mismatch.name().foundName()).isEqualTo("Widget Traders Ltd");
            assertThat(mismatch.name().absentVariants()).isEqualTo(2);
        });
    }

    @Test
    void unknownNameIsMediumWhenARegisteredNameAlsoAppears() {
        List<ExtractedFact> facts = List.of(
            ExtractedFact.name(FactContext.UNSCOPED, "Acme Widgets Limited", "doc-9", 0.8),
            ExtractedFact.name(FactContext.UNSCOPED, "Acme Widgits Ltd", "doc-9", 0.8)
        );

        List<Mismatch> mismatches = detector.detect(record, facts);

        assertThat(mismatches).singleElement().satisfies(mismatch -> {
            assertThat(mismatch.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(mismatch.name().absentVariants()).isEqualTo(1);
            assertThat(mismatch.name().expectedNames()).containsExactly("ACME WIDGETS LIMITED", "ACME HOLDINGS LIMITED");
        });
    }

    @Test
    void previousNamesCountAsKnown() {
        List<ExtractedFact> facts = List.of(ExtractedFact.name(FactContext.UNSCOPED, "acme  holdings limited", "doc-9", 0.8));

        assertThat(detector.detect(record, facts)).isEmpty();
    }

    @Test
    void registeredNameWithTrailingPeriodMatchesItsOwnDocument() {
        CompanyRecord services = companyNamed("ACME SERVICES LTD.");

        MismatchReport report = detector.report(services, List.of(evidence(
            services, "inc-1", FilingDocumentType.INCORPORATION, "Company name: ACME SERVICES LTD."
        )));

        assertThat(report.mismatches()).extracting(Mismatch::type).doesNotContain(MismatchType.NAME_MISMATCH);
    }

    @Test
    void changedNameWithInternalPeriodMatchesRegisteredName() {
        CompanyRecord renamed = new CompanyRecord(
            "07654321",
            "ACME CO. LIMITED",
            CompanyStatus.ACTIVE,
            LocalDate.of(2004, 1, 15),
            null,
            "2 Market Square, Leeds",
            Set.of("70229"),
            "ltd",
            List.of(new PreviousCompanyName("ACME LIMITED", LocalDate.of(2004, 1, 15), LocalDate.of(2010, 5, 1)))
        );

        MismatchReport report = detector.report(renamed, List.of(evidence(
            renamed, "noc-1", FilingDocumentType.NAME_CHANGE, "The company changed its name to ACME CO. LIMITED on 1 May 2010"
        )));

        assertThat(report.mismatches()).extracting(Mismatch::type).doesNotContain(MismatchType.NAME_MISMATCH);
    }

    @Test
    void labelledFormFieldsYieldOnlyTheCompanyName() {
        MismatchReport report = detector.report(record, List.of(evidence(
            "cs-1",
            FilingDocumentType.ANNUAL_RETURN,
            "Company name in full: ACME WIDGETS LIMITED\nCompany name: ACME WIDGETS LIMITED Company number 01234567\n"
        )));

        assertThat(report.mismatches()).extracting(Mismatch::type).doesNotContain(MismatchType.NAME_MISMATCH);
    }

    @Test
    void labelledFieldWithUnknownNameStillReportsJustTheName() {
        MismatchReport report = detector.report(record, List.of(evidence(
            "cs-1", FilingDocumentType.ANNUAL_RETURN, "Company name in full: WIDGET TRADERS LTD  Company number 01234567"
        )));

        assertThat(report.mismatches()).singleElement().satisfies(mismatch -> {
            assertThat(mismatch.type()).isEqualTo(MismatchType.NAME_MISMATCH);
            assertThat(mismatch.name().foundName()).isEqualTo("WIDGET TRADERS LTD");
        });
    }

    private static CompanyRecord companyNamed(String name) {
        return new CompanyRecord(
            "09876543", name, CompanyStatus.ACTIVE, LocalDate.of(2015, 3, 2), null, null, Set.of(), "ltd", List.of()
        );
    }

    private DocumentEvidence evidence(String documentId, FilingDocumentType type, String text) {
        return evidence(documentId, type, text, null);
    }

    private DocumentEvidence evidence(String documentId, FilingDocumentType type, String text, LocalDate filingDate) {
        return evidence(record, documentId, type, text, filingDate);
    }

    private DocumentEvidence evidence(CompanyRecord company, String documentId, FilingDocumentType type, String text) {
        return evidence(company, documentId, type, text, null);
    }

    private DocumentEvidence evidence(
        CompanyRecord company,
        String documentId,
        FilingDocumentType type,
        String text,
        LocalDate filingDate
    ) {
        FilingDocument document = new FilingDocument(
            documentId, company.companyNumber(), type, type.value(), null, filingDate, Instant.now()
        );
        return new DocumentEvidence(document, extractor.extract(text, type.extractionContext(), documentId));
    }
}
