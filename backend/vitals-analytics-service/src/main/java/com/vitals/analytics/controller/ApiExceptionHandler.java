package com.vitals.analytics.controller;

import com.vitals.analytics.client.PatientNotFoundException;
import com.vitals.analytics.client.UpstreamServiceException;
import com.vitals.analytics.client.UpstreamUnavailableException;
import com.vitals.analytics.service.InvalidThresholdException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.BAD_GATEWAY, "upstream-error",
      HttpStatus.SERVICE_UNAVAILABLE, "upstream-unavailable",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler({InvalidThresholdException.class, ConstraintViolationException.class,
      MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class,
      IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex.getMessage(), ex, request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ProblemDetail> handleInvalidBody(MethodArgumentNotValidException ex,
      HttpServletRequest request) {
    String detail = ex.getBindingResult().getFieldErrors().stream()
        .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
        .reduce((a, b) -> a + "; " + b)
        .orElse("Invalid request body");
    return buildProblem(HttpStatus.BAD_REQUEST, detail, ex, request);
  }

  // Unknown metric names and malformed UUIDs in the body end up here.
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleUnreadable(HttpMessageNotReadableException ex,
      HttpServletRequest request) {
    Throwable root = ex.getMostSpecificCause();
    return buildProblem(HttpStatus.BAD_REQUEST, "Malformed request body: " + root.getMessage(), ex, request);
  }

  @ExceptionHandler({PatientNotFoundException.class, ThresholdNotFoundException.class})
  public ResponseEntity<ProblemDetail> handleNotFound(RuntimeException ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, ex.getMessage(), ex, request);
  }

  @ExceptionHandler(UpstreamServiceException.class)
  public ResponseEntity<ProblemDetail> handleUpstreamError(UpstreamServiceException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_GATEWAY, ex.getMessage(), ex, request);
  }

  @ExceptionHandler(UpstreamUnavailableException.class)
  public ResponseEntity<ProblemDetail> handleUpstreamUnavailable(UpstreamUnavailableException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    // framework errors (405, 415, unknown path) keep their own status
    if (ex instanceof ErrorResponse errorResponse) {
      HttpStatus status = HttpStatus.resolve(errorResponse.getStatusCode().value());
      if (status != null && !status.is5xxServerError()) {
        return buildProblem(status, ex.getMessage(), ex, request);
      }
    }
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", ex, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, String message, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, message);
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create("urn:vitals:problem:" + TYPE_SLUGS.getOrDefault(status, "internal-error")));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status).body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }
    if (status.is5xxServerError()) {
      log.error("Request {} {} failed with status {}: {}",
          request.getMethod(), request.getRequestURI(), status.value(), errorMessage, ex);
    } else {
      log.warn("Request {} {} returned status {}: {}",
          request.getMethod(), request.getRequestURI(), status.value(), errorMessage);
    }
  }
}
