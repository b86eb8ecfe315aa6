package com.signalwatch.scan.model;

public record FailedCompany(
    String companyNumber,
    String code,
    String message
) {
}
