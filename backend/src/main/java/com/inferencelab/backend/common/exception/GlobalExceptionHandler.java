package com.inferencelab.backend.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final String INVALID_PAYLOAD = "Invalid request payload";

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Unexpected error");
    problem.setDetail("An unexpected error occurred. Please retry the request later.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
  public ResponseEntity<ProblemDetail> handleValidationErrors(Exception ex) {
    return badRequest(resolveValidationMessage(ex));
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ProblemDetail> handleMethodValidation(HandlerMethodValidationException ex) {
    return badRequest(
        ex.getAllErrors().stream()
            .findFirst()
            .map(error -> messageOrDefault(error.getDefaultMessage()))
            .orElse(INVALID_PAYLOAD));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException ex) {
    log.debug("Rejected unreadable request body: {}", ex.getMessage());
    return badRequest("Malformed JSON request body");
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
    if (ex.getStatusCode().is5xxServerError()) {
      log.warn("Request failed with status {}: {}", ex.getStatusCode().value(), ex.getReason());
    }
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  private ResponseEntity<ProblemDetail> badRequest(String detail) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail(detail);
    return ResponseEntity.badRequest().body(problem);
  }

  private String resolveValidationMessage(Exception ex) {
    if (ex instanceof MethodArgumentNotValidException methodArgumentNotValidException) {
      return methodArgumentNotValidException
          .getBindingResult()
          .getFieldErrors()
          .stream()
          .findFirst()
          .map(
              error ->
                  error.getField()
                      + ": "
                      + (error.getDefaultMessage() != null
                          ? error.getDefaultMessage()
                          : "invalid value"))
          .orElse(INVALID_PAYLOAD);
    }
    if (ex instanceof BindException bindException) {
      return bindException
          .getBindingResult()
          .getAllErrors()
          .stream()
          .findFirst()
          .map(error -> messageOrDefault(error.getDefaultMessage()))
          .orElse(INVALID_PAYLOAD);
    }
    return INVALID_PAYLOAD;
  }

  private static String messageOrDefault(String message) {
    return message != null ? message : INVALID_PAYLOAD;
  }
}
