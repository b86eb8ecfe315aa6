package com.signalwatch.scan.service;

import com.signalwatch.config.ScannerProperties;
import com.signalwatch.scan.cache.CacheStore;
import com.signalwatch.scan.extract.FactExtractor;
import com.signalwatch.scan.extract.LlmFactExtractorFactory;
import com.signalwatch.scan.extract.RegexFactExtractor;
import com.signalwatch.scan.http.CompaniesHouseClient;
import com.signalwatch.scan.http.ScanBudget;
import com.signalwatch.scan.http.ScanBudgetContext;
import com.signalwatch.scan.model.CompanySearchFilters;
import com.signalwatch.scan.model.CompanySummary;
import com.signalwatch.scan.model.NetworkGraph;
import com.signalwatch.scan.model.ScanBatchResult;
import com.signalwatch.scan.model.ScanError;
import com.signalwatch.scan.model.ScanProvenance;
import com.signalwatch.scan.model.ScanRequest;
import com.signalwatch.scan.model.ScanResult;
import com.signalwatch.scan.model.ScanSummary;
import com.signalwatch.scan.network.NetworkTraversalService;
import com.signalwatch.scan.util.CompanyNumbers;
import com.signalwatch.scan.util.ScanErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Top-level scan coordinator.
 * <p>
 * Companies are scanned concurrently on the scan pool and collected in request order; a failure in
 * one company becomes an error slot for that company only. The remote result cache is consulted only
 * for single-company requests and written through after every fresh success. The director network
 * is built afterwards from the companies that scanned successfully.
 */
@Service
public class ScanOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ScanOrchestratorService.class);

    private final CompaniesHouseClient companiesHouseClient;
    private final CompanyScanService companyScanService;
    private final CompanySearchService companySearchService;
    private final NetworkTraversalService networkTraversalService;
    private final CacheStore cacheStore;
    private final RegexFactExtractor regexFactExtractor;
    private final LlmFactExtractorFactory llmFactExtractorFactory;
    private final ExecutorService scanExecutor;
    private final ScannerProperties properties;

    public ScanOrchestratorService(
        CompaniesHouseClient companiesHouseClient,
        CompanyScanService companyScanService,
        CompanySearchService companySearchService,
        NetworkTraversalService networkTraversalService,
        CacheStore cacheStore,
        RegexFactExtractor regexFactExtractor,
        LlmFactExtractorFactory llmFactExtractorFactory,
        @Qualifier("scanExecutor") ExecutorService scanExecutor,
        ScannerProperties properties
    ) {
        this.companiesHouseClient = companiesHouseClient;
        this.companyScanService = companyScanService;
        this.companySearchService = companySearchService;
        this.networkTraversalService = networkTraversalService;
        this.cacheStore = cacheStore;
        this.regexFactExtractor = regexFactExtractor;
        this.llmFactExtractorFactory = llmFactExtractorFactory;
        this.scanExecutor = scanExecutor;
        this.properties = properties;
    }

    /**
     * Scans the companies matched by a registry search.
     */
    public ScanBatchResult processFiltered(CompanySearchFilters filters, ScanRequest request) {
        CompaniesHouseClient client = clientFor(request);
        List<CompanySummary> matches = companySearchService.findCompanies(client, filters);
        List<String> numbers = new ArrayList<>();
        for (CompanySummary match : matches) {
            numbers.add(match.companyNumber());
        }
        return processCompanies(request.withCompanyNumbers(numbers));
    }

    /**
     * Scans every requested company and, when asked, the director network around them.
     *
     * @throws InvalidScanRequestException when no company is given or a required API key is missing
     */
    public ScanBatchResult processCompanies(ScanRequest request) {
        CompaniesHouseClient client = clientFor(request);
        FactExtractor extractor = extractorFor(request);
        List<String> requested = request.rawCompanyNumbers();
        if (requested.isEmpty()) {
            throw new InvalidScanRequestException("No company numbers provided");
        }

        Optional<ScanResult> cached = cachedResult(request, requested);
        if (cached.isPresent()) {
            log.info("Serving {} from the result cache ({})", cached.get().companyNumber(), request.fingerprint().folder());
            return ScanBatchResult.of(List.of(cached.get()), null, true, false);
        }

        ScanBudget budget = new ScanBudget(request.deadline());
        log.info(
            "Scanning {} companies (network={}, depth={}, activeDirectorsOnly={}, extractor={})",
            requested.size(),
            request.scanNetwork(),
            request.networkDepth(),
            request.activeDirectorsOnly(),
            extractor.name()
        );

        List<CompletableFuture<ScanResult>> futures = new ArrayList<>();
        for (String companyNumber : requested) {
            futures.add(CompletableFuture.supplyAsync(
                () -> {
                    try (ScanBudgetContext.Scope scope = ScanBudgetContext.activate(budget)) {
                        budget.checkpoint();
                        return companyScanService.scanCompany(
                            client,
                            companyNumber,
                            extractor,
                            request.activeDirectorsOnly(),
                            request.useAi()
                        );
                    }
                },
                scanExecutor
            ));
        }

        List<ScanResult> results = new ArrayList<>();
        boolean cancelled = false;
        for (int i = 0; i < futures.size(); i++) {
            String companyNumber = requested.get(i);
            ScanResult result;
            try {
                result = futures.get(i).join();
                writeThrough(result);
            } catch (CompletionException e) {
                ScanError error = ScanErrorClassifier.toScanError(e);
                if (ScanErrorClassifier.CANCELLED.equals(error.code())) {
                    cancelled = true;
                    log.info("Scan of {} cancelled: {}", companyNumber, error.message());
                } else {
                    log.warn("Scan failed for {} [{}]: {}", companyNumber, error.code(), error.message());
                }
                result = ScanResult.failed(displayNumber(companyNumber), error, provenance(request, extractor));
            }
            results.add(result);
        }

        NetworkGraph network = null;
        if (request.scanNetwork()) {
            network = traverse(client, request, results, budget);
            cancelled = cancelled || budget.isCancelled();
        }

        ScanBatchResult batch = ScanBatchResult.of(results, network, false, cancelled);
        ScanSummary summary = batch.summary();
        log.info(
            "Scan finished: companies={}, withMismatches={}, mismatches={}, failed={}, cancelled={}",
            summary.totalCompanies(),
            summary.companiesWithMismatches(),
            summary.totalMismatches(),
            summary.failedCompanies(),
            cancelled
        );
        return batch;
    }

    private NetworkGraph traverse(CompaniesHouseClient client, ScanRequest request, List<ScanResult> results, ScanBudget budget) {
        List<CompanySummary> seeds = new ArrayList<>();
        for (ScanResult result : results) {
            if (!result.isError() && result.company() != null) {
                seeds.add(CompanySummary.of(result.company()));
            }
        }
        int depth = Math.min(Math.max(0, request.networkDepth()), properties.getNetwork().getMaxDepth());
        return networkTraversalService.traverse(client, seeds, depth, request.activeDirectorsOnly(), budget);
    }

    private Optional<ScanResult> cachedResult(ScanRequest request, List<String> requested) {
        // the remote cache is only worth a lookup for single-company scans
        if (!request.useCache() || !properties.getCache().isEnabled() || requested.size() != 1) {
            return Optional.empty();
        }
        String raw = requested.get(0);
        if (!CompanyNumbers.isValid(raw)) {
            return Optional.empty();
        }
        return cacheStore.get(CompanyNumbers.normalize(raw), request.fingerprint());
    }

    private void writeThrough(ScanResult result) {
        if (!properties.getCache().isEnabled() || result.isError()) {
            return;
        }
        cacheStore.put(result.companyNumber(), result);
    }

    private CompaniesHouseClient clientFor(ScanRequest request) {
        CompaniesHouseClient client = companiesHouseClient.withApiKey(request.registryApiKey());
        if (!client.hasApiKey()) {
            throw new InvalidScanRequestException("Companies House API key is required. Please provide your own API key.");
        }
        return client;
    }

    private FactExtractor extractorFor(ScanRequest request) {
        if (!request.useAi()) {
            return regexFactExtractor;
        }
        String aiKey = notBlank(request.aiApiKey()) ? request.aiApiKey().trim() : properties.getAi().getApiKey();
        if (!notBlank(aiKey)) {
            throw new InvalidScanRequestException("XAI API key is required when AI extraction is enabled.");
        }
        return llmFactExtractorFactory.create(aiKey);
    }

    private static ScanProvenance provenance(ScanRequest request, FactExtractor extractor) {
        return new ScanProvenance(Instant.now(), request.activeDirectorsOnly(), request.useAi(), extractor.name());
    }

    private static String displayNumber(String raw) {
        return CompanyNumbers.isValid(raw) ? CompanyNumbers.normalize(raw) : raw;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
