package com.signalwatch.scan.extract;

import com.signalwatch.scan.model.DocumentFacts;
import com.signalwatch.scan.model.FactContext;

/**
 * Turns the text of one filing document into typed facts. Implementations hold no per-call state.
 */
public interface FactExtractor {
    /**
     * @param text             document text, possibly empty
     * @param context          context implied by the document type, or null for generic extraction
     * @param sourceDocumentId recorded on every fact
     */
    DocumentFacts extract(String text, FactContext context, String sourceDocumentId);

    String name();
}
