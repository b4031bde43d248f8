package com.scholary.video.assistant.api;

import com.scholary.video.assistant.error.AssistantException;
import com.scholary.video.assistant.error.ErrorKind;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Translates failures into a stable error body.
 *
 * <p>Each {@link ErrorKind} maps to its own status and code, so a caller can distinguish a
 * missing transcript, an expired quiz and a failing collaborator.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(AssistantException.class)
  public ResponseEntity<ApiError> handleAssistantException(AssistantException ex) {
    HttpStatus status = statusOf(ex.kind());
    if (ex.kind() == ErrorKind.DEPENDENCY_FAILURE) {
      LOGGER.error("Dependency failure: {}", ex.getMessage(), ex);
    } else {
      LOGGER.info("Request rejected: kind={}, message={}", ex.kind(), ex.getMessage());
    }
    return buildErrorResponse(status, ex.getMessage(), ex.kind().code());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .findFirst()
            .orElse("Invalid request");
    return buildErrorResponse(HttpStatus.BAD_REQUEST, message, ErrorKind.INVALID_INPUT.code());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
    return buildErrorResponse(
        HttpStatus.BAD_REQUEST, "Malformed request body", ErrorKind.INVALID_INPUT.code());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
    if (ex instanceof ErrorResponse frameworkError) {
      HttpStatus status = HttpStatus.valueOf(frameworkError.getStatusCode().value());
      return buildErrorResponse(status, ex.getMessage(), status.name());
    }
    LOGGER.error("Unexpected error: {}", ex.getMessage(), ex);
    return buildErrorResponse(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "An unexpected error occurred. Please try again later.",
        "INTERNAL_ERROR");
  }

  static HttpStatus statusOf(ErrorKind kind) {
    switch (kind) {
      case INVALID_INPUT:
        return HttpStatus.BAD_REQUEST;
      case NOT_AVAILABLE:
      case NOT_FOUND:
        return HttpStatus.NOT_FOUND;
      case DEPENDENCY_FAILURE:
        return HttpStatus.BAD_GATEWAY;
      default:
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
  }

  private ResponseEntity<ApiError> buildErrorResponse(
      HttpStatus status, String message, String errorCode) {
    return ResponseEntity.status(status)
        .body(new ApiError(message, errorCode, status.value(), Instant.now().toString()));
  }
}
