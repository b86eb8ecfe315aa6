package com.signalwatch.scan.model;

import java.util.List;

/**
 * Companies and directors connected by directorships, built breadth-first from a seed set.
 */
public record NetworkGraph(
    List<NetworkCompany> companies,
    List<NetworkDirector> directors,
    List<NetworkConnection> connections,
    NetworkStatistics statistics
) {
    public NetworkGraph {
        companies = companies == null ? List.of() : List.copyOf(companies);
        directors = directors == null ? List.of() : List.copyOf(directors);
        connections = connections == null ? List.of() : List.copyOf(connections);
    }
}
