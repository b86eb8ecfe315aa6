package com.signalwatch.scan.http;

public class ResponseParseException extends RegistryException {
    public ResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
