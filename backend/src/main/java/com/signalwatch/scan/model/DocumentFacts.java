package com.signalwatch.scan.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Output of one fact extraction pass over one document.
 *
 * @param facts          extracted dates and names
 * @param statedContexts contexts whose statement phrase appears in the text, whether or not its date parsed
 */
public record DocumentFacts(
    List<ExtractedFact> facts,
    Set<FactContext> statedContexts
) {
    public DocumentFacts {
        facts = facts == null ? List.of() : List.copyOf(facts);
        statedContexts = statedContexts == null || statedContexts.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(statedContexts));
    }

    public static DocumentFacts empty() {
        return new DocumentFacts(List.of(), Set.of());
    }
}
