package com.signalwatch.scan.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalwatch.scan.model.DocumentFacts;
import com.signalwatch.scan.model.ExtractedFact;
import com.signalwatch.scan.model.FactContext;
import dev.langchain4j.model.chat.ChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Fact extraction through a chat model: one call for dates, one for company names, issued
 * concurrently.
 * <p>
 * Any failure (quota, timeout, unparseable reply) falls back to the regex extractor for the whole
 * document, so a scan never fails because the model did. Dates the model returns still go through
 * the plausible-year check.
 */
public class LlmFactExtractor implements FactExtractor {
    private static final Logger log = LoggerFactory.getLogger(LlmFactExtractor.class);

    public static final String NAME = "llm";
    static final double DATE_CONFIDENCE = 0.75;
    static final double NAME_CONFIDENCE = 0.7;

    private static final String DATE_PROMPT = """
        You extract dates from UK company registry filings.
        Return only a JSON array. Each element is an object with two fields:
        "date" in YYYY-MM-DD form, and "context", one of incorporation, name_change, registration, filing or unscoped.
        Use a scoped context only when the text explicitly states what the date is.
        Read numeric dates day first.

        Document:
        %s
        """;

    private static final String NAME_PROMPT = """
        You extract company names from UK company registry filings.
        Return only a JSON array of strings: every company name the document states for the company it concerns,
        including former names. Return [] when none is stated.

        Document:
        %s
        """;

    private final ChatModel chatModel;
    private final RegexFactExtractor fallback;
    private final ObjectMapper objectMapper;
    private final int maxDocumentChars;
    private final Executor executor;

    public LlmFactExtractor(
        ChatModel chatModel,
        RegexFactExtractor fallback,
        ObjectMapper objectMapper,
        int maxDocumentChars,
        Executor executor
    ) {
        this.chatModel = chatModel;
        this.fallback = fallback;
        this.objectMapper = objectMapper;
        this.maxDocumentChars = maxDocumentChars;
        this.executor = executor;
    }

    @Override
    public DocumentFacts extract(String text, FactContext context, String sourceDocumentId) {
        if (text == null || text.isBlank()) {
            return DocumentFacts.empty();
        }
        FactContext scope = context == FactContext.UNSCOPED ? null : context;
        String excerpt = text.length() > maxDocumentChars ? text.substring(0, maxDocumentChars) : text;
        // the name call runs on the executor while this thread asks for the dates
        CompletableFuture<List<ExtractedFact>> names = CompletableFuture.supplyAsync(
            () -> {
                try {
                    return extractNames(excerpt, scope, sourceDocumentId);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            },
            executor
        );
        try {
            List<ExtractedFact> facts = new ArrayList<>(extractDates(excerpt, scope, sourceDocumentId));
            facts.addAll(names.join());
            return new DocumentFacts(facts, fallback.statedContexts(text, scope));
        } catch (RuntimeException | IOException e) {
            names.cancel(true);
            log.warn("AI extraction failed for document {}; using regex extraction", sourceDocumentId, e);
            return fallback.extract(text, context, sourceDocumentId);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    private List<ExtractedFact> extractDates(String excerpt, FactContext scope, String sourceDocumentId) throws IOException {
        JsonNode reply = askForArray(String.format(DATE_PROMPT, excerpt));
        Set<String> seen = new LinkedHashSet<>();
        List<ExtractedFact> facts = new ArrayList<>();
        for (JsonNode item : reply) {
            LocalDate date = parseDate(item.path("date").asText(null));
            if (date == null) {
                continue;
            }
            FactContext reported = FactContext.fromValue(item.path("context").asText(null));
            // only the document's own context is scoped; anything else counts as an unscoped mention
            FactContext factContext = reported == scope && scope != null ? scope : FactContext.UNSCOPED;
            if (seen.add(factContext.value() + "|" + date)) {
                facts.add(ExtractedFact.date(factContext, date, sourceDocumentId, DATE_CONFIDENCE));
            }
        }
        return facts;
    }

    private List<ExtractedFact> extractNames(String excerpt, FactContext scope, String sourceDocumentId) throws IOException {
        JsonNode reply = askForArray(String.format(NAME_PROMPT, excerpt));
        FactContext nameContext = scope == null ? FactContext.UNSCOPED : scope;
        Set<String> names = new LinkedHashSet<>();
        for (JsonNode item : reply) {
            String name = CompanyNameExtractor.clean(item.isTextual() ? item.asText() : item.path("name").asText(null));
            if (name != null) {
                names.add(name);
            }
        }
        List<ExtractedFact> facts = new ArrayList<>();
        for (String name : names) {
            facts.add(ExtractedFact.name(nameContext, name, sourceDocumentId, NAME_CONFIDENCE));
        }
        return facts;
    }

    private JsonNode askForArray(String prompt) throws IOException {
        String reply = chatModel.chat(prompt);
        if (reply == null) {
            throw new IOException("Empty reply from chat model");
        }
        int start = reply.indexOf('[');
        int end = reply.lastIndexOf(']');
        if (start < 0 || end < start) {
            throw new IOException("Chat model reply holds no JSON array");
        }
        JsonNode node = objectMapper.readTree(reply.substring(start, end + 1));
        if (!node.isArray()) {
            throw new IOException("Chat model reply is not a JSON array");
        }
        return node;
    }

    private static LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        LocalDate date;
        try {
            date = LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            date = DatePhraseParser.parse(raw);
        }
        return DatePhraseParser.inRange(date) ? date : null;
    }
}
