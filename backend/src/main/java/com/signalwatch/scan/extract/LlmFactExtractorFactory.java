package com.signalwatch.scan.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalwatch.config.ScannerProperties;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Builds chat-model backed extractors against the OpenAI-compatible xAI endpoint. Chat models are
 * reused per API key and model name.
 */
@Component
public class LlmFactExtractorFactory {
    private final ScannerProperties properties;
    private final RegexFactExtractor regexFactExtractor;
    private final ObjectMapper objectMapper;
    private final ExecutorService aiExecutor;
    private final Map<ModelKey, ChatModel> chatModels = new ConcurrentHashMap<>();

    public LlmFactExtractorFactory(
        ScannerProperties properties,
        RegexFactExtractor regexFactExtractor,
        ObjectMapper objectMapper,
        @Qualifier("aiExecutor") ExecutorService aiExecutor
    ) {
        this.properties = properties;
        this.regexFactExtractor = regexFactExtractor;
        this.objectMapper = objectMapper;
        this.aiExecutor = aiExecutor;
    }

    public FactExtractor create(String apiKey) {
        ScannerProperties.Ai ai = properties.getAi();
        ChatModel chatModel = chatModels.computeIfAbsent(
            new ModelKey(apiKey, ai.getModelName()),
            key -> OpenAiChatModel.builder()
                .baseUrl(ai.getBaseUrl())
                .apiKey(key.apiKey())
                .modelName(key.modelName())
                .timeout(Duration.ofSeconds(ai.getTimeoutSeconds()))
                .temperature(0.0)
                .maxRetries(1)
                .build()
        );
        return create(chatModel);
    }

    public FactExtractor create(ChatModel chatModel) {
        return new LlmFactExtractor(
            chatModel,
            regexFactExtractor,
            objectMapper,
            properties.getAi().getMaxDocumentChars(),
            aiExecutor
        );
    }

    int cachedModelCount() {
        return chatModels.size();
    }

    private record ModelKey(String apiKey, String modelName) {
        @Override
        public String toString() {
            return "ModelKey[" + modelName + "]";
        }
    }
}
