package com.signalwatch.scan.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Filing history metadata for one document. The document body is fetched separately and never kept here.
 */
public record FilingDocument(
    String documentId,
    String companyNumber,
    FilingDocumentType documentType,
    String category,
    String description,
    LocalDate filingDate,
    Instant retrievedAt
) {
    public boolean hasDocument() {
        return documentId != null && !documentId.isBlank();
    }
}
