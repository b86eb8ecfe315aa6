package com.signalwatch.scan.http;

public class RateLimitExceededException extends RegistryException {
    public RateLimitExceededException(String message) {
        super(message);
    }
}
