package com.signalwatch.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.signalwatch.scan.cache.CacheStore;
import com.signalwatch.scan.cache.GitHubObjectStore;
import com.signalwatch.scan.cache.InMemoryObjectStore;
import com.signalwatch.scan.cache.ObjectStore;
import com.signalwatch.scan.cache.ObjectStoreCacheStore;
import com.signalwatch.scan.http.RegistryRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ScanConfig {
    private static final Logger log = LoggerFactory.getLogger(ScanConfig.class);

    @Bean(name = "scanExecutor", destroyMethod = "shutdown")
    public ExecutorService scanExecutor(ScannerProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkerConcurrency());
    }

    @Bean(name = "documentExecutor", destroyMethod = "shutdown")
    public ExecutorService documentExecutor(ScannerProperties properties) {
        int size = Math.max(2, properties.getWorkerConcurrency() * properties.getDocumentConcurrency());
        return Executors.newFixedThreadPool(size);
    }

    // chat calls issued from document tasks; never waits on other pool work
    @Bean(name = "aiExecutor", destroyMethod = "shutdown")
    public ExecutorService aiExecutor(ScannerProperties properties) {
        return Executors.newFixedThreadPool(Math.max(2, properties.getWorkerConcurrency() * properties.getDocumentConcurrency()));
    }

    @Bean(name = "networkExecutor", destroyMethod = "shutdown")
    public ExecutorService networkExecutor(ScannerProperties properties) {
        return Executors.newFixedThreadPool(Math.max(2, properties.getWorkerConcurrency()));
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ScannerProperties properties) {
        int size = Math.max(4, properties.getWorkerConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        return mapper;
    }

    @Bean
    public RegistryRateLimiter registryRateLimiter(ScannerProperties properties) {
        ScannerProperties.Registry registry = properties.getRegistry();
        return new RegistryRateLimiter(
            registry.getRateLimitRequests(),
            Duration.ofSeconds(registry.getRateLimitWindowSeconds()),
            Duration.ofSeconds(registry.getMaxRateLimitWaitSeconds())
        );
    }

    @Bean
    public ObjectStore objectStore(
        ScannerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        ObjectMapper objectMapper
    ) {
        ScannerProperties.Github github = properties.getCache().getGithub();
        if (!github.isConfigured()) {
            log.info("GitHub result cache not configured; using in-memory object store");
            return new InMemoryObjectStore();
        }
        HttpClient client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .executor(httpExecutor)
            .build();
        log.info("GitHub result cache at {}/{} ({})", github.getOwner(), github.getRepository(), github.getBranch());
        return new GitHubObjectStore(github, client, objectMapper, Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
    }

    @Bean
    public CacheStore cacheStore(ObjectStore objectStore, ObjectMapper objectMapper) {
        return new ObjectStoreCacheStore(objectStore, objectMapper);
    }
}
