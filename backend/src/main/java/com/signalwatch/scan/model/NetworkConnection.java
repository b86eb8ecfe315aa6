package com.signalwatch.scan.model;

public record NetworkConnection(
    String companyNumber,
    String directorId,
    String role,
    boolean active
) {
}
