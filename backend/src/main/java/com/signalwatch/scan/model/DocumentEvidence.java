package com.signalwatch.scan.model;

/**
 * A filing document paired with the facts extracted from its text.
 */
public record DocumentEvidence(
    FilingDocument document,
    DocumentFacts facts
) {
    public String documentId() {
        return document == null ? null : document.documentId();
    }
}
