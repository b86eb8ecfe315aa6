package com.signalwatch.scan.model;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    int statusCode,
    byte[] bodyBytes,
    String contentType,
    String location,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isRedirect() {
        return errorCode == null && statusCode >= 300 && statusCode < 400 && location != null;
    }

    public String body() {
        return bodyBytes == null ? null : new String(bodyBytes, StandardCharsets.UTF_8);
    }
}
