package com.signalwatch.scan.api;

import com.signalwatch.scan.model.CompanySearchFilters;

import java.util.List;

/**
 * Body of {@code POST /api/scan}. {@code scanMode} is {@code specific} (the default) or {@code filtered}.
 */
public record ScanApiRequest(
    String scanMode,
    List<String> companyNumbers,
    CompanySearchFilters filters,
    Boolean scanNetwork,
    Integer networkDepth,
    Boolean activeDirectorsOnly,
    Boolean useAi,
    Boolean useCache,
    String chApiKey,
    String xaiApiKey,
    Integer timeoutSeconds
) {
}
