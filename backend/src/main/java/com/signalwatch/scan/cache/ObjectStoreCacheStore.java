package com.signalwatch.scan.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalwatch.scan.model.ScanFingerprint;
import com.signalwatch.scan.model.ScanResult;
import com.signalwatch.scan.util.CompanyNumbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Scan results as JSON documents at {@code <company_number>/<folder>/result.json}.
 */
public class ObjectStoreCacheStore implements CacheStore {
    private static final Logger log = LoggerFactory.getLogger(ObjectStoreCacheStore.class);
    private static final String RESULT_FILE = "result.json";

    private final ObjectStore objectStore;
    private final ObjectMapper objectMapper;

    public ObjectStoreCacheStore(ObjectStore objectStore, ObjectMapper objectMapper) {
        this.objectStore = objectStore;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean exists(String companyNumber, ScanFingerprint fingerprint) {
        try {
            return objectStore.exists(key(companyNumber, fingerprint));
        } catch (CacheUnavailableException e) {
            log.warn("Cache existence check failed for {}: {}", companyNumber, e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<ScanResult> get(String companyNumber, ScanFingerprint fingerprint) {
        String key = key(companyNumber, fingerprint);
        Optional<byte[]> content;
        try {
            content = objectStore.get(key);
        } catch (CacheUnavailableException e) {
            log.warn("Cache read failed for {}; treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
        if (content.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(content.get(), ScanResult.class));
        } catch (IOException e) {
            log.warn("Cached result at {} is unreadable; treating as miss", key, e);
            return Optional.empty();
        }
    }

    @Override
    public void put(String companyNumber, ScanResult result) {
        if (result == null || result.isError() || result.provenance() == null) {
            return;
        }
        String key = key(companyNumber, result.provenance().fingerprint());
        try {
            objectStore.put(key, objectMapper.writeValueAsBytes(result));
            log.debug("Cached scan result at {}", key);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize scan result for {}", key, e);
        } catch (CacheUnavailableException e) {
            log.warn("Cache write failed for {}: {}", key, e.getMessage());
        }
    }

    static String key(String companyNumber, ScanFingerprint fingerprint) {
        return CompanyNumbers.normalize(companyNumber) + "/" + fingerprint.folder() + "/" + RESULT_FILE;
    }
}
