package com.ospicorp.sensorapi.config;

import com.ospicorp.sensorapi.readings.service.ReadingOperationException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Client errors become {@link ProblemDetail} bodies. Backend failures become a fixed
 * {@code text/plain} message per operation and are logged here, never echoed to the caller.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final String GENERIC_FAILURE = "Internal server error";

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed",
      HttpStatus.NOT_ACCEPTABLE, "not-acceptable",
      HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported-media-type"
  );

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ProblemDetail> handleInvalidBody(MethodArgumentNotValidException ex,
      HttpServletRequest request) {
    String detail = ex.getBindingResult().getFieldErrors().stream()
        .map(error -> error.getField() + ": " + error.getDefaultMessage())
        .sorted()
        .collect(Collectors.joining("; "));
    return buildProblem(HttpStatus.BAD_REQUEST, detail, ex, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, "Malformed request body", ex, request);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ProblemDetail> handleMissingParameter(
      MissingServletRequestParameterException ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST,
        "Required parameter '" + ex.getParameterName() + "' is missing", ex, request);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST,
        "Invalid value for parameter '" + ex.getName() + "'", ex, request);
  }

  @ExceptionHandler({ConstraintViolationException.class, IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex.getMessage(), ex, request);
  }

  @ExceptionHandler(NoSuchElementException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(NoSuchElementException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, ex.getMessage(), ex, request);
  }

  @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class,
      HttpMediaTypeNotSupportedException.class, HttpMediaTypeNotAcceptableException.class,
      ServletRequestBindingException.class, ErrorResponseException.class})
  public ResponseEntity<ProblemDetail> handleFrameworkError(Exception ex,
      HttpServletRequest request) {
    ErrorResponse errorResponse = (ErrorResponse) ex;
    HttpStatus status = HttpStatus.resolve(errorResponse.getStatusCode().value());
    if (status == null) {
      status = HttpStatus.BAD_REQUEST;
    }
    return buildProblem(status, errorResponse.getBody().getDetail(), ex, request);
  }

  @ExceptionHandler(ReadingOperationException.class)
  public ResponseEntity<String> handleBackendFailure(ReadingOperationException ex,
      HttpServletRequest request) {
    Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
    log.error("Error during {} for {} {} from {}: {}",
        ex.operation().label(),
        request.getMethod(),
        RequestLoggingFilter.requestUriWithQuery(request),
        RequestLoggingFilter.clientIp(request),
        cause.getMessage(),
        ex);
    return plainText(HttpStatus.INTERNAL_SERVER_ERROR, ex.operation().failureMessage());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<String> handleServerError(Exception ex, HttpServletRequest request) {
    log.error("Request {} {} from {} failed with status 500: {}",
        request.getMethod(),
        RequestLoggingFilter.requestUriWithQuery(request),
        RequestLoggingFilter.clientIp(request),
        describe(ex),
        ex);
    return plainText(HttpStatus.INTERNAL_SERVER_ERROR, GENERIC_FAILURE);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, String message,
      Exception ex, HttpServletRequest request) {
    log.warn("Request {} {} from {} returned status {}: {}",
        request.getMethod(),
        RequestLoggingFilter.requestUriWithQuery(request),
        RequestLoggingFilter.clientIp(request),
        status.value(),
        describe(ex));
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, message);
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create("urn:sensor-api:problem:"
        + TYPE_SLUGS.getOrDefault(status, "client-error")));
    return ResponseEntity.status(status).body(detail);
  }

  private static ResponseEntity<String> plainText(HttpStatus status, String body) {
    return ResponseEntity.status(status)
        .contentType(MediaType.TEXT_PLAIN)
        .body(body);
  }

  private static String describe(Exception ex) {
    String message = ex.getMessage();
    return (message == null || message.isBlank()) ? ex.getClass().getName() : message;
  }
}
