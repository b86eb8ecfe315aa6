package com.signalwatch.scan.model;

public record ScanSummary(
    int totalCompanies,
    int companiesWithMismatches,
    int totalMismatches,
    int failedCompanies,
    boolean fromCache
) {
}
