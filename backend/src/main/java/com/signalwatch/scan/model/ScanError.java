package com.signalwatch.scan.model;

public record ScanError(
    String code,
    String message
) {
}
