package com.signalwatch.scan.model;

public record NetworkCompany(
    String companyNumber,
    String companyName,
    CompanyStatus companyStatus,
    int depth
) {
}
