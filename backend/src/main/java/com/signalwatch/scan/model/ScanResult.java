package com.signalwatch.scan.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Outcome of scanning one company. Either {@code company} is populated or {@code error} is.
 */
public record ScanResult(
    String companyNumber,
    String companyName,
    CompanyStatus companyStatus,
    CompanyRecord company,
    MismatchReport mismatches,
    int documentsScanned,
    List<String> warnings,
    ScanError error,
    ScanProvenance provenance
) {
    public ScanResult {
        mismatches = mismatches == null ? MismatchReport.empty() : mismatches;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ScanResult completed(
        CompanyRecord company,
        MismatchReport mismatches,
        int documentsScanned,
        List<String> warnings,
        ScanProvenance provenance
    ) {
        return new ScanResult(
            company.companyNumber(),
            company.companyName(),
            company.status(),
            company,
            mismatches,
            documentsScanned,
            warnings,
            null,
            provenance
        );
    }

    public static ScanResult failed(String companyNumber, ScanError error, ScanProvenance provenance) {
        return new ScanResult(companyNumber, null, null, null, MismatchReport.empty(), 0, List.of(), error, provenance);
    }

    @JsonIgnore
    public boolean isError() {
        return error != null;
    }
}
