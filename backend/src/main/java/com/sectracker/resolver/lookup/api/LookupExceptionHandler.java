package com.sectracker.resolver.lookup.api;

import com.sectracker.resolver.lookup.ProviderUnavailableException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class LookupExceptionHandler {

  @ExceptionHandler(ProviderUnavailableException.class)
  public ResponseEntity<Map<String, String>> handleProviderUnavailable(ProviderUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of(
            "error", "provider_unavailable",
            "provider", ex.getProvider(),
            "message", String.valueOf(ex.getMessage())
        ));
  }
}
