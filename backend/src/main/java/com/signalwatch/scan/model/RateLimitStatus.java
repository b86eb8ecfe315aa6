package com.signalwatch.scan.model;

import java.time.Instant;

public record RateLimitStatus(
    int maxRequests,
    int remainingRequests,
    long windowSeconds,
    Instant resetAt
) {
}
