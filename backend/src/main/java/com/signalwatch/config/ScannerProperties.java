package com.signalwatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scanner")
public class ScannerProperties {
    private static final String DEFAULT_USER_AGENT = "signal-watch/0.1 (+contact)";

    private String userAgent;
    private int workerConcurrency = 4;
    private int documentConcurrency = 3;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 8000;
    private Registry registry = new Registry();
    private Cache cache = new Cache();
    private Results results = new Results();
    private Ai ai = new Ai();
    private Network network = new Network();
    private Search search = new Search();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getWorkerConcurrency() {
        return Math.max(1, workerConcurrency);
    }

    public void setWorkerConcurrency(int workerConcurrency) {
        this.workerConcurrency = Math.max(1, workerConcurrency);
    }

    public int getDocumentConcurrency() {
        return Math.max(1, documentConcurrency);
    }

    public void setDocumentConcurrency(int documentConcurrency) {
        this.documentConcurrency = Math.max(1, documentConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Results getResults() {
        return results;
    }

    public void setResults(Results results) {
        this.results = results;
    }

    public Ai getAi() {
        return ai;
    }

    public void setAi(Ai ai) {
        this.ai = ai;
    }

    public Network getNetwork() {
        return network;
    }

    public void setNetwork(Network network) {
        this.network = network;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Registry {
        private String baseUrl = "https://api.company-information.service.gov.uk";
        private String documentBaseUrl = "https://document-api.company-information.service.gov.uk";
        private String apiKey;
        private int rateLimitRequests = 600;
        private int rateLimitWindowSeconds = 300;
        private int maxRateLimitWaitSeconds = 330;
        private int pageSize = 100;
        private int maxFilingsPerCompany = 100;
        private int maxDocumentsPerCompany = 25;
        private int maxOfficersPerCompany = 500;
        private int maxAppointmentsPerOfficer = 500;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = stripTrailingSlash(baseUrl);
        }

        public String getDocumentBaseUrl() {
            return documentBaseUrl;
        }

        public void setDocumentBaseUrl(String documentBaseUrl) {
            this.documentBaseUrl = stripTrailingSlash(documentBaseUrl);
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getRateLimitRequests() {
            return Math.max(1, rateLimitRequests);
        }

        public void setRateLimitRequests(int rateLimitRequests) {
            this.rateLimitRequests = Math.max(1, rateLimitRequests);
        }

        public int getRateLimitWindowSeconds() {
            return Math.max(1, rateLimitWindowSeconds);
        }

        public void setRateLimitWindowSeconds(int rateLimitWindowSeconds) {
            this.rateLimitWindowSeconds = Math.max(1, rateLimitWindowSeconds);
        }

        public int getMaxRateLimitWaitSeconds() {
            return Math.max(0, maxRateLimitWaitSeconds);
        }

        public void setMaxRateLimitWaitSeconds(int maxRateLimitWaitSeconds) {
            this.maxRateLimitWaitSeconds = Math.max(0, maxRateLimitWaitSeconds);
        }

        public int getPageSize() {
            return Math.max(1, Math.min(100, pageSize));
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public int getMaxFilingsPerCompany() {
            return Math.max(1, maxFilingsPerCompany);
        }

        public void setMaxFilingsPerCompany(int maxFilingsPerCompany) {
            this.maxFilingsPerCompany = Math.max(1, maxFilingsPerCompany);
        }

        public int getMaxDocumentsPerCompany() {
            return Math.max(1, maxDocumentsPerCompany);
        }

        public void setMaxDocumentsPerCompany(int maxDocumentsPerCompany) {
            this.maxDocumentsPerCompany = Math.max(1, maxDocumentsPerCompany);
        }

        public int getMaxOfficersPerCompany() {
            return Math.max(1, maxOfficersPerCompany);
        }

        public void setMaxOfficersPerCompany(int maxOfficersPerCompany) {
            this.maxOfficersPerCompany = Math.max(1, maxOfficersPerCompany);
        }

        public int getMaxAppointmentsPerOfficer() {
            return Math.max(1, maxAppointmentsPerOfficer);
        }

        public void setMaxAppointmentsPerOfficer(int maxAppointmentsPerOfficer) {
            this.maxAppointmentsPerOfficer = Math.max(1, maxAppointmentsPerOfficer);
        }
    }

    public static class Cache {
        private boolean enabled = true;
        private Github github = new Github();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Github getGithub() {
            return github;
        }

        public void setGithub(Github github) {
            this.github = github;
        }
    }

    public static class Github {
        private String apiBaseUrl = "https://api.github.com";
        private String owner;
        private String repository;
        private String branch = "main";
        private String basePath = "results";
        private String token;

        public String getApiBaseUrl() {
            return apiBaseUrl;
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = stripTrailingSlash(apiBaseUrl);
        }

        public String getOwner() {
            return owner;
        }

        public void setOwner(String owner) {
            this.owner = owner;
        }

        public String getRepository() {
            return repository;
        }

        public void setRepository(String repository) {
            this.repository = repository;
        }

        public String getBranch() {
            return branch;
        }

        public void setBranch(String branch) {
            this.branch = branch;
        }

        public String getBasePath() {
            return basePath;
        }

        public void setBasePath(String basePath) {
            this.basePath = basePath;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public boolean isConfigured() {
            return notBlank(owner) && notBlank(repository) && notBlank(token);
        }
    }

    public static class Results {
        private int maxEntries = 100;
        private int ttlMinutes = 60;

        public int getMaxEntries() {
            return Math.max(1, maxEntries);
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = Math.max(1, maxEntries);
        }

        public int getTtlMinutes() {
            return Math.max(1, ttlMinutes);
        }

        public void setTtlMinutes(int ttlMinutes) {
            this.ttlMinutes = Math.max(1, ttlMinutes);
        }
    }

    public static class Ai {
        private String baseUrl = "https://api.x.ai/v1";
        private String apiKey;
        private String modelName = "grok-3-mini";
        private int timeoutSeconds = 60;
        private int maxDocumentChars = 20000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getMaxDocumentChars() {
            return Math.max(1000, maxDocumentChars);
        }

        public void setMaxDocumentChars(int maxDocumentChars) {
            this.maxDocumentChars = maxDocumentChars;
        }
    }

    public static class Network {
        private int defaultDepth = 1;
        private int maxDepth = 3;
        private boolean directorsOnly = true;

        public int getDefaultDepth() {
            return Math.max(0, defaultDepth);
        }

        public void setDefaultDepth(int defaultDepth) {
            this.defaultDepth = Math.max(0, defaultDepth);
        }

        public int getMaxDepth() {
            return Math.max(0, maxDepth);
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = Math.max(0, maxDepth);
        }

        public boolean isDirectorsOnly() {
            return directorsOnly;
        }

        public void setDirectorsOnly(boolean directorsOnly) {
            this.directorsOnly = directorsOnly;
        }
    }

    public static class Search {
        private int defaultLimit = 100;
        private int maxLetters = 5;

        public int getDefaultLimit() {
            return Math.max(1, defaultLimit);
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = Math.max(1, defaultLimit);
        }

        public int getMaxLetters() {
            return Math.max(1, maxLetters);
        }

        public void setMaxLetters(int maxLetters) {
            this.maxLetters = Math.max(1, maxLetters);
        }
    }

    public static class Cli {
        private boolean run;
        private String companyNumbers = "";
        private boolean scanNetwork;
        private int networkDepth = 1;
        private boolean activeDirectorsOnly = true;
        private boolean useAi;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getCompanyNumbers() {
            return companyNumbers;
        }

        public void setCompanyNumbers(String companyNumbers) {
            this.companyNumbers = companyNumbers;
        }

        public boolean isScanNetwork() {
            return scanNetwork;
        }

        public void setScanNetwork(boolean scanNetwork) {
            this.scanNetwork = scanNetwork;
        }

        public int getNetworkDepth() {
            return networkDepth;
        }

        public void setNetworkDepth(int networkDepth) {
            this.networkDepth = networkDepth;
        }

        public boolean isActiveDirectorsOnly() {
            return activeDirectorsOnly;
        }

        public void setActiveDirectorsOnly(boolean activeDirectorsOnly) {
            this.activeDirectorsOnly = activeDirectorsOnly;
        }

        public boolean isUseAi() {
            return useAi;
        }

        public void setUseAi(boolean useAi) {
            this.useAi = useAi;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
