package com.signalwatch.scan.service;

import com.signalwatch.config.ScannerProperties;
import com.signalwatch.scan.detect.MismatchDetector;
import com.signalwatch.scan.extract.DocumentTextReader;
import com.signalwatch.scan.extract.FactExtractor;
import com.signalwatch.scan.http.CompaniesHouseClient;
import com.signalwatch.scan.http.RegistryException;
import com.signalwatch.scan.http.ScanBudget;
import com.signalwatch.scan.http.ScanBudgetContext;
import com.signalwatch.scan.model.CompanyRecord;
import com.signalwatch.scan.model.DocumentContent;
import com.signalwatch.scan.model.DocumentEvidence;
import com.signalwatch.scan.model.DocumentFacts;
import com.signalwatch.scan.model.FilingDocument;
import com.signalwatch.scan.model.FilingDocumentType;
import com.signalwatch.scan.model.MismatchReport;
import com.signalwatch.scan.model.ScanProvenance;
import com.signalwatch.scan.model.ScanResult;
import com.signalwatch.scan.util.CompanyNumbers;
import com.signalwatch.scan.util.ScanErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Scans one company: profile, filing history, relevant documents, extraction and comparison.
 */
@Service
public class CompanyScanService {
    private static final Logger log = LoggerFactory.getLogger(CompanyScanService.class);

    private final ScannerProperties properties;
    private final DocumentTextReader documentTextReader;
    private final MismatchDetector mismatchDetector;
    private final ExecutorService documentExecutor;

    public CompanyScanService(
        ScannerProperties properties,
        DocumentTextReader documentTextReader,
        MismatchDetector mismatchDetector,
        @Qualifier("documentExecutor") ExecutorService documentExecutor
    ) {
        this.properties = properties;
        this.documentTextReader = documentTextReader;
        this.mismatchDetector = mismatchDetector;
        this.documentExecutor = documentExecutor;
    }

    public ScanResult scanCompany(
        CompaniesHouseClient client,
        String companyNumber,
        FactExtractor extractor,
        boolean activeDirectorsOnly,
        boolean aiExtraction
    ) {
        ScanBudgetContext.checkpoint();
        String number = CompanyNumbers.normalize(companyNumber);
        log.info("Scanning company {}", number);
        CompanyRecord record = client.getProfile(number);
        List<String> warnings = new ArrayList<>();

        List<FilingDocument> filings;
        try {
            filings = client.getFilingHistory(number);
        } catch (RegistryException | InvalidScanRequestException e) {
            log.warn("Filing history unavailable for {}: {}", number, e.getMessage());
            warnings.add("filing_history_unavailable:" + ScanErrorClassifier.fromException(e));
            filings = List.of();
        }

        List<FilingDocument> relevant = selectRelevant(filings);
        List<DocumentEvidence> evidence = readDocuments(client, relevant, extractor, warnings);
        MismatchReport report = mismatchDetector.report(record, evidence);
        log.info(
            "Scanned {}: filings={}, documents={}, mismatches={} (high={}, medium={}, low={})",
            number,
            filings.size(),
            evidence.size(),
            report.total(),
            report.high(),
            report.medium(),
            report.low()
        );
        ScanProvenance provenance = new ScanProvenance(Instant.now(), activeDirectorsOnly, aiExtraction, extractor.name());
        return ScanResult.completed(record, report, evidence.size(), warnings, provenance);
    }

    List<FilingDocument> selectRelevant(List<FilingDocument> filings) {
        int max = properties.getRegistry().getMaxDocumentsPerCompany();
        List<FilingDocument> relevant = new ArrayList<>();
        for (FilingDocument filing : filings) {
            if (relevant.size() >= max) {
                break;
            }
            if (filing.documentType() != FilingDocumentType.OTHER && filing.hasDocument()) {
                relevant.add(filing);
            }
        }
        return relevant;
    }

    private List<DocumentEvidence> readDocuments(
        CompaniesHouseClient client,
        List<FilingDocument> documents,
        FactExtractor extractor,
        List<String> warnings
    ) {
        ScanBudget budget = ScanBudgetContext.current();
        List<CompletableFuture<DocumentOutcome>> futures = new ArrayList<>();
        for (FilingDocument document : documents) {
            futures.add(CompletableFuture.supplyAsync(
                () -> {
                    try (ScanBudgetContext.Scope scope = ScanBudgetContext.activate(budget)) {
                        return readDocument(client, document, extractor);
                    }
                },
                documentExecutor
            ));
        }
        List<DocumentEvidence> evidence = new ArrayList<>();
        for (CompletableFuture<DocumentOutcome> future : futures) {
            DocumentOutcome outcome;
            try {
                outcome = future.join();
            } catch (CompletionException e) {
                for (CompletableFuture<DocumentOutcome> pending : futures) {
                    pending.cancel(true);
                }
                Throwable cause = ScanErrorClassifier.unwrap(e);
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw e;
            }
            if (outcome.warning() != null) {
                warnings.add(outcome.warning());
            }
            if (outcome.evidence() != null) {
                evidence.add(outcome.evidence());
            }
        }
        return evidence;
    }

    private DocumentOutcome readDocument(CompaniesHouseClient client, FilingDocument document, FactExtractor extractor) {
        String documentId = document.documentId();
        DocumentContent content;
        try {
            content = client.downloadDocument(documentId);
        } catch (RegistryException | InvalidScanRequestException e) {
            log.warn("Document {} of {} unavailable: {}", documentId, document.companyNumber(), e.getMessage());
            return new DocumentOutcome(null, "document_unavailable:" + documentId + ":" + ScanErrorClassifier.fromException(e));
        }
        String text;
        String warning = null;
        try {
            text = documentTextReader.read(content);
        } catch (IOException e) {
            log.warn("Document {} of {} is unreadable", documentId, document.companyNumber(), e);
            text = "";
            warning = "document_unreadable:" + documentId;
        }
        DocumentFacts facts = extractor.extract(text, document.documentType().extractionContext(), documentId);
        return new DocumentOutcome(new DocumentEvidence(document, facts), warning);
    }

    private record DocumentOutcome(DocumentEvidence evidence, String warning) {
    }
}
