package com.signalwatch.scan.http;

/**
 * Base type for failures talking to the company registry.
 */
public class RegistryException extends RuntimeException {
    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
