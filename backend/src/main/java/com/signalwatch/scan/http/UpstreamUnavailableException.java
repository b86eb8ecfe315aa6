package com.signalwatch.scan.http;

public class UpstreamUnavailableException extends RegistryException {
    public UpstreamUnavailableException(String message) {
        super(message);
    }
}
