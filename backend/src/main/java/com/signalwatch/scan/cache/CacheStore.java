package com.signalwatch.scan.cache;

import com.signalwatch.scan.model.ScanFingerprint;
import com.signalwatch.scan.model.ScanResult;

import java.util.Optional;

/**
 * Previously computed scan results keyed by company number and scan fingerprint.
 * <p>
 * Reads never fail: an unreachable or corrupt store reads as a miss. Writes are idempotent and
 * best-effort.
 */
public interface CacheStore {
    boolean exists(String companyNumber, ScanFingerprint fingerprint);

    Optional<ScanResult> get(String companyNumber, ScanFingerprint fingerprint);

    /**
     * Stores under the fingerprint recorded in the result's provenance.
     */
    void put(String companyNumber, ScanResult result);
}
