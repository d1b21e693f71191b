package com.delta.cnpjresolver.resolve.api;

import com.delta.cnpjresolver.resolve.service.InvalidCompanyNameException;
import com.delta.cnpjresolver.resolve.service.ResolutionException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ResolverExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ResolverExceptionHandler.class);

  @ExceptionHandler(InvalidCompanyNameException.class)
  public ResponseEntity<Map<String, String>> handleInvalidName(InvalidCompanyNameException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_input", "message", ex.getMessage()));
  }

  @ExceptionHandler(ResolutionException.class)
  public ResponseEntity<Map<String, String>> handleFatal(ResolutionException ex) {
    log.error("Resolution failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "resolution_failed", "message", ex.getMessage()));
  }
}
