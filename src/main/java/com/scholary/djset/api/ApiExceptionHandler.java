package com.scholary.djset.api;

import com.scholary.djset.job.InvalidRequestException;
import com.scholary.djset.job.JobNotFoundException;
import com.scholary.djset.service.ArtifactNotFoundException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions thrown from controllers to error responses.
 *
 * <p>Only synchronous request errors end up here. Failures inside a running job are recorded on
 * the job as its terminal error instead.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException ex) {
    LOGGER.warn("Invalid request: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(ErrorResponse.of(ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    String details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    LOGGER.warn("Validation failed: {}", details);
    return ResponseEntity.badRequest().body(new ErrorResponse("Invalid request", details));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    LOGGER.warn("Unreadable request body: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(ErrorResponse.of("Malformed request body"));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    String details =
        String.format("invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName());
    LOGGER.warn("Type mismatch: {}", details);
    return ResponseEntity.badRequest().body(new ErrorResponse("Invalid parameter", details));
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(JobNotFoundException ex) {
    LOGGER.warn("Job not found: {}", ex.getJobId());
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(ex.getMessage()));
  }

  @ExceptionHandler(ArtifactNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleArtifactNotFound(ArtifactNotFoundException ex) {
    LOGGER.warn("Artifact not found: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(ex.getMessage()));
  }
}
