package com.signalwatch.scan.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record MismatchReport(
    List<Mismatch> mismatches,
    int total,
    int high,
    int medium,
    int low
) {
    public MismatchReport {
        mismatches = mismatches == null ? List.of() : List.copyOf(mismatches);
    }

    public static MismatchReport of(List<Mismatch> mismatches) {
        int high = 0;
        int medium = 0;
        int low = 0;
        for (Mismatch mismatch : mismatches) {
            switch (mismatch.severity()) {
                case HIGH -> high++;
                case MEDIUM -> medium++;
                default -> low++;
            }
        }
        return new MismatchReport(mismatches, mismatches.size(), high, medium, low);
    }

    public static MismatchReport empty() {
        return new MismatchReport(List.of(), 0, 0, 0, 0);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return mismatches.isEmpty();
    }
}
