package com.signalwatch.scan.api;

import com.signalwatch.config.ScannerProperties;
import com.signalwatch.scan.cache.ScanResultStore;
import com.signalwatch.scan.http.CompaniesHouseClient;
import com.signalwatch.scan.model.CompanySummary;
import com.signalwatch.scan.model.RateLimitStatus;
import com.signalwatch.scan.model.ScanBatchResult;
import com.signalwatch.scan.model.ScanRequest;
import com.signalwatch.scan.model.ScanResult;
import com.signalwatch.scan.service.CompanySearchService;
import com.signalwatch.scan.service.InvalidScanRequestException;
import com.signalwatch.scan.service.ScanOrchestratorService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class ScanController {
    private final ScanOrchestratorService scanOrchestratorService;
    private final CompanySearchService companySearchService;
    private final CompaniesHouseClient companiesHouseClient;
    private final ScanResultStore scanResultStore;
    private final ScannerProperties properties;

    public ScanController(
        ScanOrchestratorService scanOrchestratorService,
        CompanySearchService companySearchService,
        CompaniesHouseClient companiesHouseClient,
        ScanResultStore scanResultStore,
        ScannerProperties properties
    ) {
        this.scanOrchestratorService = scanOrchestratorService;
        this.companySearchService = companySearchService;
        this.companiesHouseClient = companiesHouseClient;
        this.scanResultStore = scanResultStore;
        this.properties = properties;
    }

    @PostMapping("/scan")
    public ScanResponse scan(@RequestBody ScanApiRequest request) {
        if (request == null) {
            throw new InvalidScanRequestException("Request body is required");
        }
        ScanRequest scanRequest = toScanRequest(request);
        String mode = request.scanMode() == null ? "specific" : request.scanMode().trim().toLowerCase(Locale.ROOT);
        ScanBatchResult batch;
        if ("filtered".equals(mode)) {
            if (request.filters() == null) {
                throw new InvalidScanRequestException("Filters are required for a filtered scan");
            }
            batch = scanOrchestratorService.processFiltered(request.filters(), scanRequest);
        } else if ("specific".equals(mode)) {
            batch = scanOrchestratorService.processCompanies(scanRequest);
        } else {
            throw new InvalidScanRequestException("Unknown scan mode: " + request.scanMode());
        }
        String resultId = scanResultStore.save(batch);
        List<String> scanned = new ArrayList<>();
        for (ScanResult result : batch.results()) {
            scanned.add(result.companyNumber());
        }
        return new ScanResponse(true, resultId, batch.summary(), scanned, batch.cancelled());
    }

    @GetMapping("/results/{resultId}")
    public ScanBatchResult result(@PathVariable("resultId") String resultId) {
        return scanResultStore.find(resultId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "No scan result " + resultId));
    }

    @GetMapping("/rate-limit")
    public RateLimitStatus rateLimit() {
        return companiesHouseClient.getRateLimitStatus();
    }

    @GetMapping("/search-company")
    public Map<String, List<CompanySummary>> searchCompany(
        @RequestParam(name = "q") String query,
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestHeader(name = "X-CH-Api-Key", required = false) String apiKey
    ) {
        if (query == null || query.isBlank()) {
            throw new InvalidScanRequestException("Query parameter q is required");
        }
        CompaniesHouseClient client = companiesHouseClient.withApiKey(apiKey);
        if (!client.hasApiKey()) {
            throw new InvalidScanRequestException("Companies House API key is required. Please provide your own API key.");
        }
        return Map.of("results", companySearchService.search(client, query, status, limit == null ? 20 : limit));
    }

    private ScanRequest toScanRequest(ScanApiRequest request) {
        int depth = request.networkDepth() == null ? properties.getNetwork().getDefaultDepth() : request.networkDepth();
        if (depth < 0) {
            throw new InvalidScanRequestException("network_depth must not be negative");
        }
        Instant deadline = request.timeoutSeconds() == null || request.timeoutSeconds() <= 0
            ? null
            : Instant.now().plusSeconds(request.timeoutSeconds());
        return new ScanRequest(
            request.companyNumbers(),
            Boolean.TRUE.equals(request.scanNetwork()),
            depth,
            request.activeDirectorsOnly() == null || request.activeDirectorsOnly(),
            Boolean.TRUE.equals(request.useAi()),
            request.useCache() == null || request.useCache(),
            request.chApiKey(),
            request.xaiApiKey(),
            deadline
        );
    }
}
