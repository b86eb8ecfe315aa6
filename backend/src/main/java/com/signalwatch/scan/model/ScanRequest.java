package com.signalwatch.scan.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Options for one scan. {@code registryApiKey} and {@code aiApiKey} override the configured keys when present.
 */
public record ScanRequest(
    List<String> companyNumbers,
    boolean scanNetwork,
    int networkDepth,
    boolean activeDirectorsOnly,
    boolean useAi,
    boolean useCache,
    String registryApiKey,
    String aiApiKey,
    Instant deadline
) {
    public List<String> rawCompanyNumbers() {
        if (companyNumbers == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String number : companyNumbers) {
            if (number != null && !number.isBlank()) {
                out.add(number.trim());
            }
        }
        return out;
    }

    public ScanFingerprint fingerprint() {
        return new ScanFingerprint(activeDirectorsOnly);
    }

    public ScanRequest withCompanyNumbers(List<String> numbers) {
        return new ScanRequest(numbers, scanNetwork, networkDepth, activeDirectorsOnly, useAi, useCache, registryApiKey, aiApiKey, deadline);
    }
}
