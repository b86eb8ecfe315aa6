package com.signalwatch.scan.model;

import java.time.LocalDate;
import java.util.Locale;

/**
 * One row of a company's officer list. {@code directorId} is the registry-assigned officer id.
 */
public record CompanyOfficer(
    String directorId,
    String name,
    String role,
    LocalDate appointedOn,
    LocalDate resignedOn
) {
    public boolean isActive() {
        return resignedOn == null;
    }

    public boolean isDirector() {
        return role != null && role.toLowerCase(Locale.ROOT).contains("director");
    }
}
