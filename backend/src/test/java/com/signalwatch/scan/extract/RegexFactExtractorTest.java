package com.signalwatch.scan.extract;

import com.signalwatch.scan.model.DocumentFacts;
import com.signalwatch.scan.model.ExtractedFact;
import com.signalwatch.scan.model.FactContext;
import com.signalwatch.scan.model.FactKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class RegexFactExtractorTest {
    private final RegexFactExtractor extractor = new RegexFactExtractor();

    @Test
    void scopesOnlyTheDocumentsOwnContext() {
        String text = """
            CERTIFICATE OF INCORPORATION
            I hereby certify that ACME WIDGETS LIMITED is this day incorporated.
            Date of incorporation: 10/05/1999
            Registered on 11/05/1999
            """;

        DocumentFacts facts = extractor.extract(text, FactContext.INCORPORATION, "doc-1");

        List<ExtractedFact> dates = facts.facts().stream().filter(f -> f.kind() == FactKind.DATE).toList();
        assertThat(dates).extracting(ExtractedFact::context, ExtractedFact::value)
            .containsExactly(
                tuple(FactContext.INCORPORATION, "1999-05-10"),
                tuple(FactContext.UNSCOPED, "1999-05-11")
            );
        assertThat(facts.facts()).filteredOn(f -> f.kind() == FactKind.NAME)
            .extracting(ExtractedFact::value)
            .containsExactly("ACME WIDGETS LIMITED");
        assertThat(facts.statedContexts()).containsExactly(FactContext.INCORPORATION);
        assertThat(facts.facts()).allMatch(f -> "doc-1".equals(f.sourceDocumentId()));
    }

    @Test
    void unscopedDocumentsYieldOnlyUnscopedFacts() {
        DocumentFacts facts = extractor.extract("Date of incorporation: 10/05/1999", null, "doc-2");

        assertThat(facts.facts()).extracting(ExtractedFact::context).containsOnly(FactContext.UNSCOPED);
        assertThat(facts.statedContexts()).isEmpty();
    }

    @Test
    void blankTextYieldsNothing() {
        assertThat(extractor.extract("  ", FactContext.FILING, "doc-3").facts()).isEmpty();
    }
}
