package com.signalwatch.scan.util;

import com.signalwatch.scan.cache.CacheUnavailableException;
import com.signalwatch.scan.http.CompanyNotFoundException;
import com.signalwatch.scan.http.RateLimitExceededException;
import com.signalwatch.scan.http.ResponseParseException;
import com.signalwatch.scan.http.ScanCancelledException;
import com.signalwatch.scan.http.UpstreamUnavailableException;
import com.signalwatch.scan.model.ScanError;
import com.signalwatch.scan.service.InvalidScanRequestException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class ScanErrorClassifier {
  public static final String INVALID_INPUT = "INVALID_INPUT";
  public static final String NOT_FOUND = "NOT_FOUND";
  public static final String RATE_LIMIT_EXCEEDED = "RATE_LIMIT_EXCEEDED";
  public static final String UPSTREAM_UNAVAILABLE = "UPSTREAM_UNAVAILABLE";
  public static final String PARSE_ERROR = "PARSE_ERROR";
  public static final String CACHE_UNAVAILABLE = "CACHE_UNAVAILABLE";
  public static final String CANCELLED = "CANCELLED";
  public static final String UNEXPECTED = "UNEXPECTED";

  private ScanErrorClassifier() {}

  public static String fromException(Throwable error) {
    Throwable cause = unwrap(error);
    if (cause instanceof InvalidScanRequestException) {
      return INVALID_INPUT;
    }
    if (cause instanceof CompanyNotFoundException) {
      return NOT_FOUND;
    }
    if (cause instanceof RateLimitExceededException) {
      return RATE_LIMIT_EXCEEDED;
    }
    if (cause instanceof UpstreamUnavailableException) {
      return UPSTREAM_UNAVAILABLE;
    }
    if (cause instanceof ResponseParseException) {
      return PARSE_ERROR;
    }
    if (cause instanceof CacheUnavailableException) {
      return CACHE_UNAVAILABLE;
    }
    if (cause instanceof ScanCancelledException) {
      return CANCELLED;
    }
    return UNEXPECTED;
  }

  public static String fromHttpStatus(int status) {
    if (status == 401 || status == 403) {
      return INVALID_INPUT;
    }
    if (status == 429) {
      return RATE_LIMIT_EXCEEDED;
    }
    if (status >= 500 && status < 600) {
      return UPSTREAM_UNAVAILABLE;
    }
    if (status >= 400 && status < 500) {
      return NOT_FOUND;
    }
    return UNEXPECTED;
  }

  public static ScanError toScanError(Throwable error) {
    Throwable cause = unwrap(error);
    String message = cause.getMessage();
    if (message == null || message.isBlank()) {
      message = cause.getClass().getSimpleName();
    }
    return new ScanError(fromException(cause), message);
  }

  public static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
