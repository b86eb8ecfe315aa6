package com.signalwatch.scan.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalwatch.config.ScannerProperties;
import com.signalwatch.scan.model.CompanyOfficer;
import com.signalwatch.scan.model.CompanyRecord;
import com.signalwatch.scan.model.CompanySummary;
import com.signalwatch.scan.model.Director;
import com.signalwatch.scan.model.DirectorAppointment;
import com.signalwatch.scan.model.DocumentContent;
import com.signalwatch.scan.model.FilingDocument;
import com.signalwatch.scan.model.HttpFetchResult;
import com.signalwatch.scan.model.RateLimitStatus;
import com.signalwatch.scan.service.InvalidScanRequestException;
import com.signalwatch.scan.util.CompanyNumbers;
import com.signalwatch.scan.util.ScanErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Companies House public data API client. Every authenticated call goes through the shared
 * {@link RegistryRateLimiter}; document downloads that redirect to the storage host follow the
 * redirect without credentials and without spending rate-limit budget.
 */
@Service
public class CompaniesHouseClient {
    private static final Logger log = LoggerFactory.getLogger(CompaniesHouseClient.class);
    private static final String JSON = "application/json";
    private static final String DOCUMENT_ACCEPT = "application/pdf, application/xhtml+xml;q=0.9, */*;q=0.5";

    private final ScannerProperties properties;
    private final HttpClient client;
    private final RegistryRateLimiter rateLimiter;
    private final RegistryResponseParser parser;
    private final String apiKey;

    @Autowired
    public CompaniesHouseClient(
        ScannerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        RegistryRateLimiter rateLimiter,
        ObjectMapper objectMapper
    ) {
        this(
            properties,
            HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .version(HttpClient.Version.HTTP_1_1)
                .executor(httpExecutor)
                .build(),
            rateLimiter,
            new RegistryResponseParser(objectMapper),
            properties.getRegistry().getApiKey()
        );
    }

    CompaniesHouseClient(
        ScannerProperties properties,
        HttpClient client,
        RegistryRateLimiter rateLimiter,
        RegistryResponseParser parser,
        String apiKey
    ) {
        this.properties = properties;
        this.client = client;
        this.rateLimiter = rateLimiter;
        this.parser = parser;
        this.apiKey = apiKey;
    }

    /**
     * Same HTTP client and rate limiter, different credentials.
     */
    public CompaniesHouseClient withApiKey(String key) {
        if (key == null || key.isBlank() || key.equals(apiKey)) {
            return this;
        }
        return new CompaniesHouseClient(properties, client, rateLimiter, parser, key.trim());
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public RateLimitStatus getRateLimitStatus() {
        return rateLimiter.status();
    }

    public CompanyRecord getProfile(String companyNumber) {
        String number = CompanyNumbers.normalize(companyNumber);
        JsonNode root = getJson(apiUrl("/company/" + number), "company " + number);
        return parser.parseProfile(root);
    }

    public List<FilingDocument> getFilingHistory(String companyNumber) {
        String number = CompanyNumbers.normalize(companyNumber);
        int pageSize = properties.getRegistry().getPageSize();
        int max = properties.getRegistry().getMaxFilingsPerCompany();
        Instant retrievedAt = Instant.now();
        List<FilingDocument> filings = new ArrayList<>();
        int startIndex = 0;
        while (filings.size() < max) {
            String url = apiUrl("/company/" + number + "/filing-history?items_per_page=" + pageSize
                + "&start_index=" + startIndex);
            JsonNode page = getJson(url, "filing history of " + number);
            JsonNode items = page.path("items");
            if (!items.isArray() || items.size() == 0) {
                break;
            }
            for (JsonNode item : items) {
                if (filings.size() >= max) {
                    break;
                }
                filings.add(parser.parseFiling(item, number, retrievedAt));
            }
            startIndex += items.size();
            if (startIndex >= page.path("total_count").asInt(0)) {
                break;
            }
        }
        return filings;
    }

    public List<CompanyOfficer> getOfficers(String companyNumber) {
        String number = CompanyNumbers.normalize(companyNumber);
        int pageSize = properties.getRegistry().getPageSize();
        int max = properties.getRegistry().getMaxOfficersPerCompany();
        List<CompanyOfficer> officers = new ArrayList<>();
        int startIndex = 0;
        while (officers.size() < max) {
            String url = apiUrl("/company/" + number + "/officers?items_per_page=" + pageSize
                + "&start_index=" + startIndex);
            JsonNode page = getJson(url, "officers of " + number);
            JsonNode items = page.path("items");
            if (!items.isArray() || items.size() == 0) {
                break;
            }
            for (JsonNode item : items) {
                CompanyOfficer officer = parser.parseOfficer(item);
                if (officer != null && officers.size() < max) {
                    officers.add(officer);
                }
            }
            startIndex += items.size();
            if (startIndex >= page.path("total_results").asInt(0)) {
                break;
            }
        }
        return officers;
    }

    public Director getOfficerAppointments(String directorId) {
        if (directorId == null || directorId.isBlank()) {
            throw new InvalidScanRequestException("Director id is required");
        }
        String id = directorId.trim();
        int pageSize = properties.getRegistry().getPageSize();
        int max = properties.getRegistry().getMaxAppointmentsPerOfficer();
        List<DirectorAppointment> appointments = new ArrayList<>();
        String name = null;
        int startIndex = 0;
        while (appointments.size() < max) {
            String url = apiUrl("/officers/" + encode(id) + "/appointments?items_per_page=" + pageSize
                + "&start_index=" + startIndex);
            JsonNode page = getJson(url, "appointments of officer " + id);
            if (name == null && page.hasNonNull("name")) {
                name = page.get("name").asText();
            }
            JsonNode items = page.path("items");
            if (!items.isArray() || items.size() == 0) {
                break;
            }
            for (JsonNode item : items) {
                DirectorAppointment appointment = parser.parseAppointment(item);
                if (appointment != null && appointments.size() < max) {
                    appointments.add(appointment);
                }
            }
            startIndex += items.size();
            if (startIndex >= page.path("total_results").asInt(0)) {
                break;
            }
        }
        return new Director(id, name, appointments);
    }

    /**
     * Advanced company search by name fragment, paged until {@code limit} results or the end of the hits.
     * An empty search (404 from the registry) yields an empty list.
     */
    public List<CompanySummary> search(String query, String statusFilter, int limit) {
        int max = Math.max(1, limit);
        int pageSize = properties.getRegistry().getPageSize();
        List<CompanySummary> results = new ArrayList<>();
        int startIndex = 0;
        while (results.size() < max) {
            StringBuilder url = new StringBuilder(apiUrl("/advanced-search/companies?size="))
                .append(Math.min(pageSize, max - results.size()))
                .append("&start_index=").append(startIndex);
            if (query != null && !query.isBlank()) {
                url.append("&company_name_includes=").append(encode(query.trim()));
            }
            if (statusFilter != null && !statusFilter.isBlank()) {
                url.append("&company_status=").append(encode(statusFilter.trim()));
            }
            JsonNode page;
            try {
                page = getJson(url.toString(), "search '" + query + "'");
            } catch (CompanyNotFoundException e) {
                break;
            }
            JsonNode items = page.path("items");
            if (!items.isArray() || items.size() == 0) {
                break;
            }
            for (JsonNode item : items) {
                CompanySummary summary = parser.parseSearchItem(item);
                if (summary != null && results.size() < max) {
                    results.add(summary);
                }
            }
            startIndex += items.size();
            if (startIndex >= page.path("hits").asInt(0)) {
                break;
            }
        }
        return results;
    }

    public DocumentContent downloadDocument(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            throw new InvalidScanRequestException("Document id is required");
        }
        String id = documentId.trim();
        String subject = "document " + id;
        HttpFetchResult result = send(documentUrl("/document/" + encode(id) + "/content"), DOCUMENT_ACCEPT, true);
        if (result.isRedirect()) {
            log.debug("Following document redirect for {}", id);
            result = send(result.location(), DOCUMENT_ACCEPT, false);
        }
        raiseForStatus(result, subject);
        return new DocumentContent(id, result.contentType(), result.bodyBytes());
    }

    private JsonNode getJson(String url, String subject) {
        HttpFetchResult result = send(url, JSON, true);
        raiseForStatus(result, subject);
        return parser.readTree(result.body(), subject);
    }

    private HttpFetchResult send(String url, String acceptHeader, boolean metered) {
        if (metered && !hasApiKey()) {
            throw new InvalidScanRequestException("A Companies House API key is required");
        }
        int maxAttempts = Math.max(1, 1 + properties.getRequestMaxRetries());
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ScanBudgetContext.checkpoint();
            if (metered) {
                ScanBudget budget = ScanBudgetContext.current();
                rateLimiter.acquire(budget == null ? null : budget.deadline());
            }
            lastResult = executeOnce(url, acceptHeader, metered);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.debug("Retrying {} after attempt {} ({})", url, attempt, describe(lastResult));
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpFetchResult executeOnce(String url, String acceptHeader, boolean authenticated) {
        Instant startedAt = Instant.now();
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, "invalid_url", e.getMessage());
        }
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", acceptHeader);
            if (authenticated) {
                builder.header("Authorization", basicAuth(apiKey));
            }
            HttpResponse<byte[]> response = client.send(builder.GET().build(), HttpResponse.BodyHandlers.ofByteArray());
            return new HttpFetchResult(
                url,
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                response.headers().firstValue("Location").map(location -> uri.resolve(location).toString()).orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, "invalid_url", e.getMessage());
        }
    }

    private void raiseForStatus(HttpFetchResult result, String subject) {
        String errorCode = result.errorCode();
        if ("interrupted".equals(errorCode)) {
            throw new ScanCancelledException("interrupted_during_registry_call");
        }
        if (errorCode != null) {
            throw new UpstreamUnavailableException("Registry request for " + subject + " failed: " + describe(result));
        }
        int status = result.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }
        switch (ScanErrorClassifier.fromHttpStatus(status)) {
            case ScanErrorClassifier.INVALID_INPUT:
                throw new InvalidScanRequestException("Companies House rejected the API key (HTTP " + status + ")");
            case ScanErrorClassifier.RATE_LIMIT_EXCEEDED:
                throw new RateLimitExceededException("Registry throttled the request for " + subject);
            case ScanErrorClassifier.NOT_FOUND:
                throw new CompanyNotFoundException("Registry has no " + subject + " (HTTP " + status + ")");
            default:
                throw new UpstreamUnavailableException("Registry request for " + subject + " failed with HTTP " + status);
        }
    }

    private boolean shouldRetry(HttpFetchResult result) {
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals("invalid_url") && !errorCode.equals("interrupted");
        }
        int status = result.statusCode();
        return status == 408 || status == 429 || status >= 500;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String apiUrl(String path) {
        return properties.getRegistry().getBaseUrl() + path;
    }

    private String documentUrl(String path) {
        return properties.getRegistry().getDocumentBaseUrl() + path;
    }

    private static String basicAuth(String key) {
        String token = key + ":";
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String describe(HttpFetchResult result) {
        if (result.errorCode() != null) {
            return result.errorCode() + (result.errorMessage() == null ? "" : ": " + result.errorMessage());
        }
        return "HTTP " + result.statusCode();
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            0,
            null,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }
}
