package com.signalwatch.scan.detect;

import com.signalwatch.scan.extract.CompanyNameExtractor;
import com.signalwatch.scan.extract.DateFactExtractor;
import com.signalwatch.scan.model.CompanyRecord;
import com.signalwatch.scan.model.DateDiscrepancy;
import com.signalwatch.scan.model.DocumentEvidence;
import com.signalwatch.scan.model.ExtractedFact;
import com.signalwatch.scan.model.FactContext;
import com.signalwatch.scan.model.FactKind;
import com.signalwatch.scan.model.FilingDocument;
import com.signalwatch.scan.model.Mismatch;
import com.signalwatch.scan.model.MismatchReport;
import com.signalwatch.scan.model.NameDiscrepancy;
import com.signalwatch.scan.model.Severity;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compares facts extracted from filing documents with the company's registry record.
 * <p>
 * Dates are compared with zero tolerance against the record field their context maps to:
 * incorporation and registration against the incorporation date, name_change against the dates the
 * previous names ceased, filing against the document's own filing date. Unscoped dates are never
 * compared. A context the document states without a parseable date is reported as missing only when
 * the record holds a value for it. Names are checked against the current and previous names.
 */
@Component
public class MismatchDetector {
    private static final int TOLERANCE_DAYS = 0;

    private final DateFactExtractor dateFactExtractor;

    public MismatchDetector() {
        this(new DateFactExtractor());
    }

    public MismatchDetector(DateFactExtractor dateFactExtractor) {
        this.dateFactExtractor = dateFactExtractor;
    }

    /**
     * Findings for facts that are not tied to filing metadata. Facts are grouped by source document;
     * filing-context facts are skipped since there is no filing date to compare them with.
     */
    public List<Mismatch> detect(CompanyRecord record, List<ExtractedFact> facts) {
        Map<String, List<ExtractedFact>> byDocument = new LinkedHashMap<>();
        for (ExtractedFact fact : facts) {
            byDocument.computeIfAbsent(fact.sourceDocumentId(), ignored -> new ArrayList<>()).add(fact);
        }
        List<Mismatch> mismatches = new ArrayList<>();
        for (Map.Entry<String, List<ExtractedFact>> entry : byDocument.entrySet()) {
            compare(record, entry.getKey(), null, entry.getValue(), Set.of(), mismatches);
        }
        return mismatches;
    }

    public MismatchReport report(CompanyRecord record, List<DocumentEvidence> evidence) {
        List<Mismatch> mismatches = new ArrayList<>();
        for (DocumentEvidence item : evidence) {
            compare(record, item.documentId(), item.document(), item.facts().facts(), item.facts().statedContexts(), mismatches);
        }
        return MismatchReport.of(mismatches);
    }

    private void compare(
        CompanyRecord record,
        String documentId,
        FilingDocument document,
        List<ExtractedFact> facts,
        Set<FactContext> statedContexts,
        List<Mismatch> out
    ) {
        Set<FactContext> contextsWithFacts = new LinkedHashSet<>();
        for (ExtractedFact fact : facts) {
            if (!fact.isScopedDate()) {
                continue;
            }
            contextsWithFacts.add(fact.context());
            List<LocalDate> expected = expectedDates(record, fact.context(), document);
            LocalDate found = fact.dateValue();
            if (expected.isEmpty() || matchesAny(expected, found)) {
                continue;
            }
            LocalDate nearest = nearest(expected, found);
            DateDiscrepancy discrepancy = new DateDiscrepancy(nearest, found, ChronoUnit.DAYS.between(nearest, found));
            out.add(Mismatch.dateMismatch(
                severityFor(fact.context()),
                documentId,
                fact.context(),
                discrepancy,
                String.format("Document states %s date %s but the register records %s (%+d days)",
                    label(fact.context()), found, nearest, discrepancy.differenceDays())
            ));
        }

        for (FactContext stated : statedContexts) {
            if (contextsWithFacts.contains(stated)) {
                continue;
            }
            List<LocalDate> expected = expectedDates(record, stated, document);
            if (expected.isEmpty()) {
                continue;
            }
            out.add(Mismatch.missingDate(
                documentId,
                stated,
                new DateDiscrepancy(expected.get(0), null, 0),
                String.format("Document refers to the %s date but no readable date was found; the register records %s",
                    label(stated), expected.get(0))
            ));
        }

        compareNames(record, documentId, facts, out);
    }

    private void compareNames(CompanyRecord record, String documentId, List<ExtractedFact> facts, List<Mismatch> out) {
        List<String> variants = record.nameVariants();
        if (variants.isEmpty()) {
            return;
        }
        Set<String> knownNames = new LinkedHashSet<>();
        for (String variant : variants) {
            knownNames.add(CompanyNameExtractor.normalize(variant));
        }
        Map<String, String> foundNames = new LinkedHashMap<>();
        for (ExtractedFact fact : facts) {
            if (fact.kind() == FactKind.NAME && fact.value() != null && !fact.value().isBlank()) {
                foundNames.putIfAbsent(CompanyNameExtractor.normalize(fact.value()), fact.value().trim());
            }
        }
        if (foundNames.isEmpty()) {
            return;
        }
        int absent = 0;
        for (String known : knownNames) {
            if (!foundNames.containsKey(known)) {
                absent++;
            }
        }
        Severity severity = absent == knownNames.size() ? Severity.HIGH : Severity.MEDIUM;
        for (Map.Entry<String, String> found : foundNames.entrySet()) {
            if (knownNames.contains(found.getKey())) {
                continue;
            }
            out.add(Mismatch.nameMismatch(
                severity,
                documentId,
                new NameDiscrepancy(variants, found.getValue(), absent),
                String.format("Document names the company \"%s\", which is not among its registered names %s",
                    found.getValue(), variants)
            ));
        }
    }

    private List<LocalDate> expectedDates(CompanyRecord record, FactContext context, FilingDocument document) {
        switch (context) {
            case INCORPORATION:
            case REGISTRATION:
                return record.incorporationDate() == null ? List.of() : List.of(record.incorporationDate());
            case NAME_CHANGE:
                return record.nameChangeDates();
            case FILING:
                return document == null || document.filingDate() == null ? List.of() : List.of(document.filingDate());
            default:
                return List.of();
        }
    }

    private boolean matchesAny(List<LocalDate> expected, LocalDate found) {
        for (LocalDate date : expected) {
            if (dateFactExtractor.compareDates(date, found, TOLERANCE_DAYS)) {
                return true;
            }
        }
        return false;
    }

    private static LocalDate nearest(List<LocalDate> expected, LocalDate found) {
        LocalDate best = expected.get(0);
        long bestDistance = Math.abs(ChronoUnit.DAYS.between(best, found));
        for (LocalDate candidate : expected) {
            long distance = Math.abs(ChronoUnit.DAYS.between(candidate, found));
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return best;
    }

    private static Severity severityFor(FactContext context) {
        switch (context) {
            case INCORPORATION:
            case REGISTRATION:
                return Severity.HIGH;
            case NAME_CHANGE:
                return Severity.MEDIUM;
            default:
                return Severity.LOW;
        }
    }

    private static String label(FactContext context) {
        return context.value().replace('_', ' ');
    }
}
