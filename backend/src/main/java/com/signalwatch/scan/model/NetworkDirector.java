package com.signalwatch.scan.model;

public record NetworkDirector(
    String directorId,
    String name,
    int companyCount
) {
}
