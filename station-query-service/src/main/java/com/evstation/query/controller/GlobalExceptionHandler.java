package com.evstation.query.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.evstation.query.exception.StationNotFoundException;

import lombok.extern.slf4j.Slf4j;

/** Maps failures to {@code {"error": ..., "message": ...}} bodies. */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

  private static final String ERROR = "error";
  private static final String MESSAGE = "message";
  static final String INTERNAL_ERROR_MESSAGE = "An unexpected error occurred";

  @ExceptionHandler(StationNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleStationNotFound(StationNotFoundException ex) {
    log.info("Station {} not found", ex.getStationId());
    return body(HttpStatus.NOT_FOUND, "Not found", ex.getMessage());
  }

  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<Map<String, Object>> handleUnknownPath(Exception ex) {
    log.debug("Unknown path: {}", ex.getMessage());
    return body(HttpStatus.NOT_FOUND, "Not found", "Resource not found");
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotAllowed(
      HttpRequestMethodNotSupportedException ex) {
    log.debug("Method {} not allowed", ex.getMethod());
    return body(
        HttpStatus.METHOD_NOT_ALLOWED,
        "Method not allowed",
        "Method " + ex.getMethod() + " is not supported");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
    // Detail is logged only
    log.error("Unexpected error", ex);
    return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", INTERNAL_ERROR_MESSAGE);
  }

  private static ResponseEntity<Map<String, Object>> body(
      HttpStatus status, String error, String message) {
    Map<String, Object> errorResponse = new LinkedHashMap<>();
    errorResponse.put(ERROR, error);
    errorResponse.put(MESSAGE, message);
    return ResponseEntity.status(status).body(errorResponse);
  }
}
