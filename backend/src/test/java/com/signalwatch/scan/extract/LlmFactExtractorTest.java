package com.signalwatch.scan.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalwatch.scan.model.DocumentFacts;
import com.signalwatch.scan.model.ExtractedFact;
import com.signalwatch.scan.model.FactContext;
import com.signalwatch.scan.model.FactKind;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmFactExtractorTest {
    private static final String TEXT = "Date of incorporation: 10/05/1999\nCompany name: Acme Ltd";

    @Mock
    private ChatModel chatModel;

    private ExecutorService executor;
    private LlmFactExtractor extractor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        extractor = new LlmFactExtractor(chatModel, new RegexFactExtractor(), new ObjectMapper(), 20000, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void keepsOnlyTheDocumentsOwnContextScoped() {
        when(chatModel.chat(contains("extract dates"))).thenReturn("""
            Here you go:
            [{"date": "1999-05-10", "context": "incorporation"},
             {"date": "2001-02-03", "context": "name_change"},
             {"date": "9999-01-01", "context": "filing"},
             {"date": "not a date", "context": "incorporation"}]
            """);
        when(chatModel.chat(contains("extract company names"))).thenReturn("[\"Acme Ltd\", \"\"]");

        DocumentFacts facts = extractor.extract(TEXT, FactContext.INCORPORATION, "doc-1");

        assertThat(facts.facts()).filteredOn(f -> f.kind() == FactKind.DATE)
            .extracting(ExtractedFact::context, ExtractedFact::value)
            .containsExactly(
                tuple(FactContext.INCORPORATION, "1999-05-10"),
                tuple(FactContext.UNSCOPED, "2001-02-03")
            );
        assertThat(facts.facts()).filteredOn(f -> f.kind() == FactKind.NAME)
            .extracting(ExtractedFact::value)
            .containsExactly("Acme Ltd");
        assertThat(facts.facts()).allMatch(f -> f.confidence() < 0.8);
        assertThat(facts.statedContexts()).containsExactly(FactContext.INCORPORATION);
    }

    @Test
    void dateAndNameCallsRunConcurrently() {
        CountDownLatch nameCallStarted = new CountDownLatch(1);
        when(chatModel.chat(contains("extract company names"))).thenAnswer(invocation -> {
            nameCallStarted.countDown();
            return "[\"Acme Ltd\"]";
        });
        when(chatModel.chat(contains("extract dates"))).thenAnswer(invocation -> {
            // only returns a date once the name call is in flight
            boolean overlapped = nameCallStarted.await(5, TimeUnit.SECONDS);
            return overlapped ? "[{\"date\": \"1999-05-10\", \"context\": \"incorporation\"}]" : "[]";
        });

        DocumentFacts facts = extractor.extract(TEXT, FactContext.INCORPORATION, "doc-1");

        assertThat(facts.facts()).extracting(ExtractedFact::value).containsExactly("1999-05-10", "Acme Ltd");
        assertThat(facts.facts()).allMatch(f -> f.confidence() < 0.8);
    }

    @Test
    void fallsBackToRegexWhenModelFails() {
        when(chatModel.chat(anyString())).thenThrow(new RuntimeException("quota exceeded"));

        DocumentFacts facts = extractor.extract(TEXT, FactContext.INCORPORATION, "doc-1");

        assertThat(facts.facts()).anyMatch(f -> f.context() == FactContext.INCORPORATION
            && "1999-05-10".equals(f.value())
            && f.confidence() == RegexFactExtractor.SCOPED_DATE_CONFIDENCE);
    }

    @Test
    void fallsBackToRegexWhenReplyIsNotJson() {
        when(chatModel.chat(anyString())).thenReturn("I could not find any dates, sorry.");

        DocumentFacts facts = extractor.extract(TEXT, FactContext.INCORPORATION, "doc-1");

        assertThat(facts.facts()).extracting(ExtractedFact::value).contains("1999-05-10", "Acme Ltd");
    }
}
