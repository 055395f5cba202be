package com.example.endpoints.web.rest.errors;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global Error Handler
 *
 * Provides consistent error responses for failures inside controllers, without exposing tokens or
 * internals. Authentication failures never get here: the entry point answers those.
 */
@Slf4j
@RestControllerAdvice
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public class GlobalErrorHandler {

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.METHOD_NOT_ALLOWED,
        "method_not_allowed",
        String.format("Method %s not supported", ex.getMethod()),
        request
    );

    return new ResponseEntity<>(body, HttpStatus.METHOD_NOT_ALLOWED);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(
      Exception ex, WebRequest request) {
    log.error("Unexpected error", ex);

    Map<String, Object> body = createErrorBody(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "internal_error",
        "An error occurred processing your request",
        request
    );

    return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
  }

  private Map<String, Object> createErrorBody(
      HttpStatus status, String error, String message, WebRequest request) {

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", Instant.now());
    body.put("status", status.value());
    body.put("error", error);
    body.put("message", message);
    body.put("path", extractPath(request));

    return body;
  }

  private String extractPath(WebRequest request) {
    String description = request.getDescription(false);
    return description.replace("uri=", "");
  }
}
