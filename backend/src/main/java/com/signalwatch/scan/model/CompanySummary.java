package com.signalwatch.scan.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Light company record as returned by registry search results and officer appointment listings.
 */
public record CompanySummary(
    String companyNumber,
    String companyName,
    CompanyStatus status,
    LocalDate incorporationDate,
    LocalDate dissolutionDate,
    String companyType,
    String address,
    List<String> sicCodes
) {
    public CompanySummary {
        status = status == null ? CompanyStatus.UNKNOWN : status;
        sicCodes = sicCodes == null ? List.of() : List.copyOf(sicCodes);
    }

    public static CompanySummary of(CompanyRecord record) {
        return new CompanySummary(
            record.companyNumber(),
            record.companyName(),
            record.status(),
            record.incorporationDate(),
            record.dissolutionDate(),
            record.companyType(),
            record.registeredAddress(),
            List.copyOf(record.sicCodes())
        );
    }
}
