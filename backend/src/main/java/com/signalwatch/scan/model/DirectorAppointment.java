package com.signalwatch.scan.model;

import java.time.LocalDate;

public record DirectorAppointment(
    String companyNumber,
    String companyName,
    CompanyStatus companyStatus,
    String role,
    LocalDate appointedOn,
    LocalDate resignedOn
) {
    public boolean isActive() {
        return resignedOn == null;
    }
}
