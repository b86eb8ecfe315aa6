package com.signalwatch.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScannerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        ScannerProperties properties = new ScannerProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("signal-watch/0.1"));
    }

    @Test
    void concurrencyAndLimitsAreClamped() {
        ScannerProperties properties = new ScannerProperties();
        properties.setWorkerConcurrency(0);
        properties.setRequestMaxRetries(-3);
        properties.getRegistry().setPageSize(1000);
        properties.getRegistry().setRateLimitRequests(0);
        assertEquals(1, properties.getWorkerConcurrency());
        assertEquals(0, properties.getRequestMaxRetries());
        assertEquals(100, properties.getRegistry().getPageSize());
        assertEquals(1, properties.getRegistry().getRateLimitRequests());
    }

    @Test
    void registryDefaultsMatchPublishedRateLimit() {
        ScannerProperties properties = new ScannerProperties();
        assertEquals(600, properties.getRegistry().getRateLimitRequests());
        assertEquals(300, properties.getRegistry().getRateLimitWindowSeconds());
    }

    @Test
    void githubCacheNeedsOwnerRepositoryAndToken() {
        ScannerProperties properties = new ScannerProperties();
        ScannerProperties.Github github = properties.getCache().getGithub();
        assertFalse(github.isConfigured());
        github.setOwner("acme");
        github.setRepository("scan-results");
        github.setToken("token");
        assertTrue(github.isConfigured());
        github.setApiBaseUrl("https://api.github.com/");
        assertEquals("https://api.github.com", github.getApiBaseUrl());
    }
}
