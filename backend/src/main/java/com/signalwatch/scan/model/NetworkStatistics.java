package com.signalwatch.scan.model;

import java.util.List;

/**
 * {@code depthReached} may be below {@code maxDepth} when the frontier empties early.
 */
public record NetworkStatistics(
    int totalCompanies,
    int totalDirectors,
    int totalConnections,
    int depthReached,
    int maxDepth,
    List<String> warnings
) {
    public NetworkStatistics {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
