package com.signalwatch.scan.model;

import java.time.LocalDate;

/**
 * {@code differenceDays} is signed: found minus expected.
 */
public record DateDiscrepancy(
    LocalDate expected,
    LocalDate found,
    long differenceDays
) {
}
