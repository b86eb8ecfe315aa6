package com.signalwatch.scan.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of one scan request: one slot per requested company (in request order) plus the optional
 * director network. This is the shape report rendering depends on.
 */
public record ScanBatchResult(
    List<ScanResult> results,
    NetworkGraph network,
    List<FailedCompany> failedCompanies,
    boolean fromCache,
    boolean cancelled
) {
    public ScanBatchResult {
        results = results == null ? List.of() : List.copyOf(results);
        failedCompanies = failedCompanies == null ? List.of() : List.copyOf(failedCompanies);
    }

    public static ScanBatchResult of(List<ScanResult> results, NetworkGraph network, boolean fromCache, boolean cancelled) {
        List<FailedCompany> failed = new ArrayList<>();
        for (ScanResult result : results) {
            if (result.isError()) {
                failed.add(new FailedCompany(result.companyNumber(), result.error().code(), result.error().message()));
            }
        }
        return new ScanBatchResult(results, network, failed, fromCache, cancelled);
    }

    public ScanSummary summary() {
        int withMismatches = 0;
        int totalMismatches = 0;
        for (ScanResult result : results) {
            int count = result.mismatches().mismatches().size();
            totalMismatches += count;
            if (count > 0) {
                withMismatches++;
            }
        }
        return new ScanSummary(results.size(), withMismatches, totalMismatches, failedCompanies.size(), fromCache);
    }
}
