package com.signalwatch.scan.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.signalwatch.config.ScannerProperties;
import com.signalwatch.scan.model.ScanBatchResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Recent batch results for the web layer, bounded by entry count and age.
 */
@Component
public class ScanResultStore {
    private final Cache<String, ScanBatchResult> results;

    public ScanResultStore(ScannerProperties properties) {
        this.results = Caffeine.newBuilder()
            .maximumSize(properties.getResults().getMaxEntries())
            .expireAfterWrite(Duration.ofMinutes(properties.getResults().getTtlMinutes()))
            .build();
    }

    public String save(ScanBatchResult result) {
        String id = UUID.randomUUID().toString();
        results.put(id, result);
        return id;
    }

    public Optional<ScanBatchResult> find(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(results.getIfPresent(id.trim()));
    }
}
