package com.github.spud.sample.ai.tutor.interfaces.rest;

import com.github.spud.sample.ai.tutor.domain.capability.CapabilityUnavailableException;
import com.github.spud.sample.ai.tutor.domain.error.ModuleNotFoundException;
import com.github.spud.sample.ai.tutor.domain.error.NoGoalsException;
import com.github.spud.sample.ai.tutor.domain.error.PreconditionFailedException;
import com.github.spud.sample.ai.tutor.domain.error.SessionNotFoundException;
import com.github.spud.sample.ai.tutor.domain.error.VersionConflictException;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @Data
  @Builder
  public static class ErrorResponse {

    private String code;
    private String message;
    private OffsetDateTime timestamp;
    private Map<String, Object> details;
  }

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException e) {
    return error(HttpStatus.NOT_FOUND, "SESSION_NOT_FOUND", e.getMessage(), null);
  }

  @ExceptionHandler(ModuleNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleModuleNotFound(ModuleNotFoundException e) {
    return error(HttpStatus.NOT_FOUND, "MODULE_NOT_FOUND", e.getMessage(), null);
  }

  @ExceptionHandler(NoGoalsException.class)
  public ResponseEntity<ErrorResponse> handleNoGoals(NoGoalsException e) {
    return error(HttpStatus.UNPROCESSABLE_ENTITY, "NO_GOALS", e.getMessage(), null);
  }

  @ExceptionHandler(PreconditionFailedException.class)
  public ResponseEntity<ErrorResponse> handlePreconditionFailed(PreconditionFailedException e) {
    return error(HttpStatus.PRECONDITION_FAILED, "PRECONDITION_FAILED", e.getMessage(), null);
  }

  @ExceptionHandler(VersionConflictException.class)
  public ResponseEntity<ErrorResponse> handleVersionConflict(VersionConflictException e) {
    log.warn("Version conflict: {}", e.getMessage());
    return error(HttpStatus.CONFLICT, "VERSION_CONFLICT", e.getMessage(),
      Map.of("retryable", true));
  }

  @ExceptionHandler(CapabilityUnavailableException.class)
  public ResponseEntity<ErrorResponse> handleCapabilityUnavailable(
    CapabilityUnavailableException e) {
    log.error("Capability unavailable: {}", e.getMessage());
    return error(HttpStatus.SERVICE_UNAVAILABLE, "CAPABILITY_UNAVAILABLE", e.getMessage(),
      Map.of("retryable", true));
  }

  @ExceptionHandler(WebExchangeBindException.class)
  public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e) {
    Map<String, String> fieldErrors = new HashMap<>();
    for (FieldError error : e.getBindingResult().getFieldErrors()) {
      fieldErrors.put(error.getField(), error.getDefaultMessage());
    }
    return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed",
      Map.of("fieldErrors", fieldErrors));
  }

  @ExceptionHandler(ServerWebInputException.class)
  public ResponseEntity<ErrorResponse> handleServerWebInput(ServerWebInputException e) {
    return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", e.getReason(), null);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
    log.error("Unhandled exception", e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
      "An unexpected error occurred", createDetailsMap(e));
  }

  private ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message,
    Map<String, Object> details) {
    ErrorResponse error = ErrorResponse.builder()
      .code(code)
      .message(message)
      .timestamp(OffsetDateTime.now())
      .details(details)
      .build();
    return ResponseEntity.status(status).body(error);
  }

  private Map<String, Object> createDetailsMap(Exception e) {
    Map<String, Object> details = new HashMap<>();
    details.put("exception", e.getClass().getSimpleName());
    details.put("message", e.getMessage());
    if (e.getCause() != null) {
      details.put("cause", e.getCause().getMessage());
    }
    return details;
  }
}
