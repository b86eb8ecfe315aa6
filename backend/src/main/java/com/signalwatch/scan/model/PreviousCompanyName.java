package com.signalwatch.scan.model;

import java.time.LocalDate;

public record PreviousCompanyName(
    String name,
    LocalDate effectiveFrom,
    LocalDate ceasedOn
) {
}
