package com.signalwatch.scan.model;

import java.time.Instant;

/**
 * How a result was produced. Only {@code activeDirectorsOnly} takes part in the cache identity.
 */
public record ScanProvenance(
    Instant scannedAt,
    boolean activeDirectorsOnly,
    boolean aiExtraction,
    String extractor
) {
    public ScanFingerprint fingerprint() {
        return new ScanFingerprint(activeDirectorsOnly);
    }
}
