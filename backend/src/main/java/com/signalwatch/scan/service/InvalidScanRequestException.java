package com.signalwatch.scan.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Malformed input or a missing credential. Raised before any registry work starts.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidScanRequestException extends RuntimeException {
    public InvalidScanRequestException(String message) {
        super(message);
    }
}
