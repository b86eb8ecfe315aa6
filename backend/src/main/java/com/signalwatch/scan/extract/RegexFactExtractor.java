package com.signalwatch.scan.extract;

import com.signalwatch.scan.model.DocumentFacts;
import com.signalwatch.scan.model.ExtractedFact;
import com.signalwatch.scan.model.FactContext;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;

@Component
public class RegexFactExtractor implements FactExtractor {
    public static final String NAME = "regex";

    static final double SCOPED_DATE_CONFIDENCE = 0.9;
    static final double UNSCOPED_DATE_CONFIDENCE = 0.5;
    static final double NAME_CONFIDENCE = 0.8;

    private final DateFactExtractor dateExtractor;
    private final CompanyNameExtractor nameExtractor;

    public RegexFactExtractor() {
        this(new DateFactExtractor(), new CompanyNameExtractor());
    }

    public RegexFactExtractor(DateFactExtractor dateExtractor, CompanyNameExtractor nameExtractor) {
        this.dateExtractor = dateExtractor;
        this.nameExtractor = nameExtractor;
    }

    @Override
    public DocumentFacts extract(String text, FactContext context, String sourceDocumentId) {
        if (text == null || text.isBlank()) {
            return DocumentFacts.empty();
        }
        FactContext scope = context == FactContext.UNSCOPED ? null : context;
        List<ExtractedFact> facts = new ArrayList<>();
        SortedSet<LocalDate> scoped = dateExtractor.extractScoped(text, scope);
        for (LocalDate date : scoped) {
            facts.add(ExtractedFact.date(scope, date, sourceDocumentId, SCOPED_DATE_CONFIDENCE));
        }
        for (LocalDate date : dateExtractor.extractGeneric(text)) {
            if (!scoped.contains(date)) {
                facts.add(ExtractedFact.date(FactContext.UNSCOPED, date, sourceDocumentId, UNSCOPED_DATE_CONFIDENCE));
            }
        }
        FactContext nameContext = scope == null ? FactContext.UNSCOPED : scope;
        for (String name : nameExtractor.extractNames(text)) {
            facts.add(ExtractedFact.name(nameContext, name, sourceDocumentId, NAME_CONFIDENCE));
        }
        return new DocumentFacts(facts, statedContexts(text, scope));
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * The document's own context, when its statement phrase appears in the text.
     */
    Set<FactContext> statedContexts(String text, FactContext scope) {
        Set<FactContext> stated = EnumSet.noneOf(FactContext.class);
        if (scope != null && dateExtractor.findContextStatements(text).contains(scope)) {
            stated.add(scope);
        }
        return stated;
    }
}
