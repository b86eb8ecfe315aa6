package com.signalwatch.scan.model;

import java.time.LocalDate;

public record DateRange(
    LocalDate start,
    LocalDate end,
    String text
) {
}
