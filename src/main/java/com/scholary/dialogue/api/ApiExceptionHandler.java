package com.scholary.dialogue.api;

import com.scholary.dialogue.align.MalformedSegmentException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps input errors raised by the pipeline to 400 responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({IllegalArgumentException.class, MalformedSegmentException.class})
  public ResponseEntity<Map<String, String>> handleInvalidInput(RuntimeException e) {
    LOGGER.warn("Rejected request: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "INVALID_INPUT", "message", e.getMessage()));
  }
}
