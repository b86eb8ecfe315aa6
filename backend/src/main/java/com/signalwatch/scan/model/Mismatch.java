package com.signalwatch.scan.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One finding. Exactly one of {@code date} / {@code name} is populated, matching {@code type}:
 * date and missing-date findings carry {@code date}, name findings carry {@code name}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Mismatch(
    MismatchType type,
    Severity severity,
    String document,
    FactContext context,
    DateDiscrepancy date,
    NameDiscrepancy name,
    String message
) {
    public static Mismatch dateMismatch(Severity severity, String document, FactContext context, DateDiscrepancy date, String message) {
        return new Mismatch(MismatchType.DATE_MISMATCH, severity, document, context, date, null, message);
    }

    public static Mismatch missingDate(String document, FactContext context, DateDiscrepancy expected, String message) {
        return new Mismatch(MismatchType.MISSING_DATE, Severity.LOW, document, context, expected, null, message);
    }

    public static Mismatch nameMismatch(Severity severity, String document, NameDiscrepancy name, String message) {
        return new Mismatch(MismatchType.NAME_MISMATCH, severity, document, null, null, name, message);
    }
}
