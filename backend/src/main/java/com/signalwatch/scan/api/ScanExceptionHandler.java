package com.signalwatch.scan.api;

import com.signalwatch.scan.http.CompanyNotFoundException;
import com.signalwatch.scan.http.RateLimitExceededException;
import com.signalwatch.scan.http.RegistryException;
import com.signalwatch.scan.service.InvalidScanRequestException;
import com.signalwatch.scan.util.ScanErrorClassifier;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScanExceptionHandler {

  @ExceptionHandler(InvalidScanRequestException.class)
  public ResponseEntity<Map<String, String>> handleInvalidRequest(InvalidScanRequestException ex) {
    return error(HttpStatus.BAD_REQUEST, ScanErrorClassifier.INVALID_INPUT, ex);
  }

  @ExceptionHandler(CompanyNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(CompanyNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ScanErrorClassifier.NOT_FOUND, ex);
  }

  @ExceptionHandler(RateLimitExceededException.class)
  public ResponseEntity<Map<String, String>> handleRateLimit(RateLimitExceededException ex) {
    return error(HttpStatus.TOO_MANY_REQUESTS, ScanErrorClassifier.RATE_LIMIT_EXCEEDED, ex);
  }

  @ExceptionHandler(RegistryException.class)
  public ResponseEntity<Map<String, String>> handleRegistry(RegistryException ex) {
    return error(HttpStatus.BAD_GATEWAY, ScanErrorClassifier.fromException(ex), ex);
  }

  private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, Exception ex) {
    String message = ex.getMessage() == null ? code : ex.getMessage();
    return ResponseEntity.status(status).body(Map.of("error", code, "message", message));
  }
}
