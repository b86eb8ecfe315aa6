package com.signalwatch.scan.api;

import com.signalwatch.scan.model.ScanSummary;

import java.util.List;

public record ScanResponse(
    boolean success,
    String resultId,
    ScanSummary summary,
    List<String> companyNumbers,
    boolean cancelled
) {
}
