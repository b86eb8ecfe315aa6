package com.signalwatch.scan.cache;

/**
 * The remote result store could not be reached or returned something unusable.
 */
public class CacheUnavailableException extends RuntimeException {
    public CacheUnavailableException(String message) {
        super(message);
    }

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
