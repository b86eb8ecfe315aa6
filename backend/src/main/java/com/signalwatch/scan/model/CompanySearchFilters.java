package com.signalwatch.scan.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Filters for a search-driven scan. Everything except {@code query}, {@code alphaStart}/{@code alphaEnd}
 * and {@code status} is applied client-side to the search results.
 */
public record CompanySearchFilters(
    String query,
    String alphaStart,
    String alphaEnd,
    String status,
    Integer yearFrom,
    Integer yearTo,
    String location,
    List<String> sicCodes,
    List<String> companyTypes,
    LocalDate dissolvedFrom,
    LocalDate dissolvedTo,
    Integer limit
) {
    public CompanySearchFilters {
        sicCodes = sicCodes == null ? List.of() : List.copyOf(sicCodes);
        companyTypes = companyTypes == null ? List.of() : List.copyOf(companyTypes);
    }
}
