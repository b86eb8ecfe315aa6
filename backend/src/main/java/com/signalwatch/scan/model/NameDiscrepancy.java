package com.signalwatch.scan.model;

import java.util.List;

public record NameDiscrepancy(
    List<String> expectedNames,
    String foundName,
    int absentVariants
) {
    public NameDiscrepancy {
        expectedNames = expectedNames == null ? List.of() : List.copyOf(expectedNames);
    }
}
