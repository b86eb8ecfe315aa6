package com.signalwatch.scan.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Registry snapshot of one company as returned by the profile endpoint at scan time.
 */
public record CompanyRecord(
    String companyNumber,
    String companyName,
    CompanyStatus status,
    LocalDate incorporationDate,
    LocalDate dissolutionDate,
    String registeredAddress,
    Set<String> sicCodes,
    String companyType,
    List<PreviousCompanyName> previousNames
) {
    public CompanyRecord {
        status = status == null ? CompanyStatus.UNKNOWN : status;
        sicCodes = sicCodes == null ? Set.of() : Set.copyOf(new LinkedHashSet<>(sicCodes));
        previousNames = previousNames == null ? List.of() : List.copyOf(previousNames);
    }

    /**
     * Current name first, then previous names in registry order, without duplicates.
     */
    public List<String> nameVariants() {
        LinkedHashSet<String> variants = new LinkedHashSet<>();
        if (companyName != null && !companyName.isBlank()) {
            variants.add(companyName.trim());
        }
        for (PreviousCompanyName previous : previousNames) {
            if (previous.name() != null && !previous.name().isBlank()) {
                variants.add(previous.name().trim());
            }
        }
        return new ArrayList<>(variants);
    }

    /**
     * Dates a name took or lost effect according to the name history, in registry order.
     */
    public List<LocalDate> nameChangeDates() {
        LinkedHashSet<LocalDate> dates = new LinkedHashSet<>();
        for (PreviousCompanyName previous : previousNames) {
            if (previous.ceasedOn() != null) {
                dates.add(previous.ceasedOn());
            }
            if (previous.effectiveFrom() != null) {
                dates.add(previous.effectiveFrom());
            }
        }
        return new ArrayList<>(dates);
    }
}
