package com.signalwatch.scan.http;

public class ScanCancelledException extends RuntimeException {
    public ScanCancelledException(String message) {
        super(message);
    }
}
