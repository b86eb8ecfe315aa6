package com.signalwatch.scan.network;

import com.signalwatch.config.ScannerProperties;
import com.signalwatch.scan.http.CompaniesHouseClient;
import com.signalwatch.scan.http.ScanBudget;
import com.signalwatch.scan.http.ScanBudgetContext;
import com.signalwatch.scan.http.ScanCancelledException;
import com.signalwatch.scan.model.CompanyOfficer;
import com.signalwatch.scan.model.CompanyStatus;
import com.signalwatch.scan.model.CompanySummary;
import com.signalwatch.scan.model.Director;
import com.signalwatch.scan.model.DirectorAppointment;
import com.signalwatch.scan.model.NetworkCompany;
import com.signalwatch.scan.model.NetworkConnection;
import com.signalwatch.scan.model.NetworkDirector;
import com.signalwatch.scan.model.NetworkGraph;
import com.signalwatch.scan.model.NetworkStatistics;
import com.signalwatch.scan.util.CompanyNumbers;
import com.signalwatch.scan.util.ScanErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Breadth-first expansion of a seed set across shared directors.
 * <p>
 * Each depth level fetches the officers of every company first discovered at that level, in
 * parallel, and merges the answers in frontier order so the graph does not depend on response
 * timing. Below the depth limit, the appointments of every newly seen director are fetched and the
 * companies they reach form the next level. Companies and directors are keyed by company number and
 * registry officer id; names never merge nodes.
 */
@Service
public class NetworkTraversalService {
    private static final Logger log = LoggerFactory.getLogger(NetworkTraversalService.class);

    private final ExecutorService networkExecutor;
    private final ScannerProperties properties;

    public NetworkTraversalService(
        @Qualifier("networkExecutor") ExecutorService networkExecutor,
        ScannerProperties properties
    ) {
        this.networkExecutor = networkExecutor;
        this.properties = properties;
    }

    public NetworkGraph traverse(
        CompaniesHouseClient client,
        List<CompanySummary> seeds,
        int maxDepth,
        boolean activeDirectorsOnly,
        ScanBudget budget
    ) {
        int depthLimit = Math.max(0, maxDepth);
        TraversalState state = new TraversalState();
        List<String> frontier = new ArrayList<>();
        for (CompanySummary seed : seeds) {
            if (seed == null || !CompanyNumbers.isValid(seed.companyNumber())) {
                continue;
            }
            String number = CompanyNumbers.normalize(seed.companyNumber());
            if (state.addCompany(number, seed.companyName(), seed.status(), 0)) {
                frontier.add(number);
            }
        }

        int depthReached = 0;
        int depth = 0;
        try {
            while (!frontier.isEmpty()) {
                if (budget != null) {
                    budget.checkpoint();
                }
                depthReached = depth;
                List<String> newDirectors = expandCompanies(client, frontier, activeDirectorsOnly, state, budget);
                if (depth >= depthLimit) {
                    break;
                }
                frontier = expandDirectors(client, newDirectors, depth + 1, activeDirectorsOnly, state, budget);
                depth++;
            }
        } catch (ScanCancelledException e) {
            log.info("Network traversal stopped at depth {}: {}", depth, e.getMessage());
            state.warn("traversal_cancelled:depth=" + depth + ":" + e.getMessage());
        }

        NetworkGraph graph = state.toGraph(depthReached, depthLimit);
        log.info(
            "Network traversal finished companies={} directors={} connections={} depth_reached={} warnings={}",
            graph.statistics().totalCompanies(),
            graph.statistics().totalDirectors(),
            graph.statistics().totalConnections(),
            depthReached,
            graph.statistics().warnings().size()
        );
        return graph;
    }

    /**
     * Records the officers of every frontier company and returns the directors seen for the first time.
     */
    private List<String> expandCompanies(
        CompaniesHouseClient client,
        List<String> frontier,
        boolean activeDirectorsOnly,
        TraversalState state,
        ScanBudget budget
    ) {
        List<Fetch<List<CompanyOfficer>>> fetches = fetchAll(frontier, client::getOfficers, budget);
        List<String> newDirectors = new ArrayList<>();
        for (Fetch<List<CompanyOfficer>> fetch : fetches) {
            if (fetch.error() != null) {
                state.warn("officers_unavailable:" + fetch.key() + ":" + fetch.error());
                continue;
            }
            for (CompanyOfficer officer : fetch.value()) {
                if (!accept(officer.role(), officer.isActive(), activeDirectorsOnly)) {
                    continue;
                }
                if (state.addDirector(officer.directorId(), officer.name())) {
                    newDirectors.add(officer.directorId());
                }
                state.addConnection(fetch.key(), officer.directorId(), officer.role(), officer.isActive());
            }
        }
        return newDirectors;
    }

    /**
     * Follows each director's appointments and returns the companies reached for the first time.
     */
    private List<String> expandDirectors(
        CompaniesHouseClient client,
        List<String> directorIds,
        int nextDepth,
        boolean activeDirectorsOnly,
        TraversalState state,
        ScanBudget budget
    ) {
        List<Fetch<Director>> fetches = fetchAll(directorIds, client::getOfficerAppointments, budget);
        List<String> next = new ArrayList<>();
        for (Fetch<Director> fetch : fetches) {
            if (fetch.error() != null) {
                state.warn("appointments_unavailable:" + fetch.key() + ":" + fetch.error());
                continue;
            }
            for (DirectorAppointment appointment : fetch.value().appointments()) {
                if (!accept(appointment.role(), appointment.isActive(), activeDirectorsOnly)) {
                    continue;
                }
                String number = appointment.companyNumber();
                if (state.addCompany(number, appointment.companyName(), appointment.companyStatus(), nextDepth)) {
                    next.add(number);
                }
                state.addConnection(number, fetch.key(), appointment.role(), appointment.isActive());
            }
        }
        return next;
    }

    private boolean accept(String role, boolean active, boolean activeDirectorsOnly) {
        if (activeDirectorsOnly && !active) {
            return false;
        }
        if (!properties.getNetwork().isDirectorsOnly()) {
            return true;
        }
        return role != null && role.toLowerCase(Locale.ROOT).contains("director");
    }

    private <T> List<Fetch<T>> fetchAll(List<String> keys, Function<String, T> call, ScanBudget budget) {
        List<CompletableFuture<T>> futures = new ArrayList<>();
        for (String key : keys) {
            futures.add(CompletableFuture.supplyAsync(
                () -> {
                    try (ScanBudgetContext.Scope scope = ScanBudgetContext.activate(budget)) {
                        return call.apply(key);
                    }
                },
                networkExecutor
            ));
        }
        List<Fetch<T>> fetches = new ArrayList<>();
        ScanCancelledException cancelled = null;
        for (int i = 0; i < futures.size(); i++) {
            String key = keys.get(i);
            try {
                fetches.add(new Fetch<>(key, futures.get(i).join(), null));
            } catch (CompletionException e) {
                Throwable cause = ScanErrorClassifier.unwrap(e);
                if (cause instanceof ScanCancelledException cancel) {
                    cancelled = cancel;
                    continue;
                }
                log.warn("Network fetch failed for {}: {}", key, cause.getMessage());
                fetches.add(new Fetch<>(key, null, ScanErrorClassifier.fromException(cause)));
            }
        }
        if (cancelled != null) {
            throw cancelled;
        }
        return fetches;
    }

    private record Fetch<T>(String key, T value, String error) {
    }

    /**
     * Visited sets and collected nodes for one traversal. Mutations are serialized on this object.
     */
    static final class TraversalState {
        private final Map<String, NetworkCompany> companies = new LinkedHashMap<>();
        private final Map<String, String> directorNames = new LinkedHashMap<>();
        private final Map<String, Set<String>> directorCompanies = new LinkedHashMap<>();
        private final Map<String, NetworkConnection> connections = new LinkedHashMap<>();
        private final List<String> warnings = new ArrayList<>();

        synchronized boolean addCompany(String companyNumber, String name, CompanyStatus status, int depth) {
            if (companies.containsKey(companyNumber)) {
                return false;
            }
            companies.put(companyNumber, new NetworkCompany(companyNumber, name, status == null ? CompanyStatus.UNKNOWN : status, depth));
            return true;
        }

        synchronized boolean addDirector(String directorId, String name) {
            if (directorNames.containsKey(directorId)) {
                return false;
            }
            directorNames.put(directorId, name);
            directorCompanies.put(directorId, new LinkedHashSet<>());
            return true;
        }

        synchronized void addConnection(String companyNumber, String directorId, String role, boolean active) {
            if (!companies.containsKey(companyNumber) || !directorNames.containsKey(directorId)) {
                return;
            }
            String key = companyNumber + "|" + directorId + "|" + (role == null ? "" : role);
            if (connections.putIfAbsent(key, new NetworkConnection(companyNumber, directorId, role, active)) == null) {
                directorCompanies.get(directorId).add(companyNumber);
            }
        }

        synchronized void warn(String warning) {
            warnings.add(warning);
        }

        synchronized NetworkGraph toGraph(int depthReached, int maxDepth) {
            List<NetworkDirector> directors = new ArrayList<>();
            for (Map.Entry<String, String> entry : directorNames.entrySet()) {
                directors.add(new NetworkDirector(entry.getKey(), entry.getValue(), directorCompanies.get(entry.getKey()).size()));
            }
            NetworkStatistics statistics = new NetworkStatistics(
                companies.size(),
                directors.size(),
                connections.size(),
                depthReached,
                maxDepth,
                warnings
            );
            return new NetworkGraph(new ArrayList<>(companies.values()), directors, new ArrayList<>(connections.values()), statistics);
        }
    }
}
