package com.jobsearchops.pipeline.api;

import com.jobsearchops.pipeline.exception.ConsistencyViolationException;
import com.jobsearchops.pipeline.exception.NotFoundException;
import com.jobsearchops.pipeline.exception.TransientIoException;
import com.jobsearchops.pipeline.exception.ValidationException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class PipelineExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(PipelineExceptionHandler.class);

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<Map<String, String>> handleValidation(ValidationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "validation_error", "message", ex.getMessage()));
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(NotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(TransientIoException.class)
  public ResponseEntity<Map<String, String>> handleTransient(TransientIoException ex) {
    log.warn("Transient failure code={}: {}", ex.getErrorCode(), ex.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", ex.getErrorCode(), "message", ex.getMessage()));
  }

  @ExceptionHandler(ConsistencyViolationException.class)
  public ResponseEntity<Map<String, String>> handleConsistency(ConsistencyViolationException ex) {
    log.error("Consistency violation", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "consistency_violation", "message", ex.getMessage()));
  }
}
