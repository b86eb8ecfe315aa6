package com.signalwatch.scan.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;

/**
 * A date or name found in a filing document. Date values are ISO-8601 ({@code yyyy-MM-dd}).
 * Confidence is a heuristic ordering, not a calibrated probability.
 */
public record ExtractedFact(
    FactKind kind,
    FactContext context,
    String value,
    String sourceDocumentId,
    double confidence
) {
    public static ExtractedFact date(FactContext context, LocalDate date, String sourceDocumentId, double confidence) {
        return new ExtractedFact(FactKind.DATE, context, date.toString(), sourceDocumentId, confidence);
    }

    public static ExtractedFact name(FactContext context, String name, String sourceDocumentId, double confidence) {
        return new ExtractedFact(FactKind.NAME, context, name, sourceDocumentId, confidence);
    }

    @JsonIgnore
    public LocalDate dateValue() {
        return kind == FactKind.DATE && value != null ? LocalDate.parse(value) : null;
    }

    @JsonIgnore
    public boolean isScopedDate() {
        return kind == FactKind.DATE && context != null && context != FactContext.UNSCOPED;
    }
}
