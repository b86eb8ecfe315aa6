package com.signalwatch.scan.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalwatch.config.ScannerProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class LlmFactExtractorFactoryTest {
    private final ScannerProperties properties = new ScannerProperties();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final LlmFactExtractorFactory factory =
        new LlmFactExtractorFactory(properties, new RegexFactExtractor(), new ObjectMapper(), executor);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void reusesChatModelPerKeyAndModel() {
        FactExtractor first = factory.create("key-one");
        factory.create("key-one");
        factory.create("key-two");
        properties.getAi().setModelName("grok-3");
        factory.create("key-one");

        assertThat(first.name()).isEqualTo(LlmFactExtractor.NAME);
        assertThat(factory.cachedModelCount()).isEqualTo(3);
    }
}
