/*
 * Where: Flock API
 * What: Maps service exceptions to the {error, error_msg} envelope with HTTP 400
 * Why: Every failure an agent can act on looks the same on the wire
 */
package com.flock.server.api;

import com.flock.server.service.BatchValidationException;
import com.flock.server.service.DuplicateRegistrationException;
import com.flock.server.service.InvalidRegistrationException;
import com.flock.server.service.UnknownNotificationTypeException;
import com.flock.server.service.UpstreamUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import java.security.Principal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class FlockApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(FlockApiExceptionHandler.class);
  static final String SUBMISSION_FAILED = "Submission failed";

  @ExceptionHandler(BatchValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleBatchValidation(
      BatchValidationException ex, HttpServletRequest request) {
    return badRequest(request, ex.getMessage());
  }

  @ExceptionHandler({InvalidRegistrationException.class, DuplicateRegistrationException.class})
  public ResponseEntity<ApiErrorResponse> handleRegistration(
      RuntimeException ex, HttpServletRequest request) {
    return badRequest(request, ex.getMessage());
  }

  @ExceptionHandler(UnknownNotificationTypeException.class)
  public ResponseEntity<ApiErrorResponse> handleUnknownNotificationType(
      UnknownNotificationTypeException ex, HttpServletRequest request) {
    return badRequest(request, ex.getMessage());
  }

  @ExceptionHandler(UpstreamUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleUpstreamUnavailable(
      UpstreamUnavailableException ex, HttpServletRequest request) {
    // store details stay in the server log
    logger.warn("submission failed path={}", request.getRequestURI(), ex);
    return badRequest(request, SUBMISSION_FAILED);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(
      HttpMessageNotReadableException ex, HttpServletRequest request) {
    return badRequest(request, ApiErrorResponse.INVALID_JSON);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(value -> value != null && !value.isBlank())
            .findFirst()
            .orElse(ApiErrorResponse.INVALID_JSON);
    return badRequest(request, message);
  }

  private ResponseEntity<ApiErrorResponse> badRequest(HttpServletRequest request, String message) {
    // the Authorization header is never logged
    final Principal principal = request.getUserPrincipal();
    logger.debug(
        "api error method={} path={} username={} error_msg={}",
        request.getMethod(),
        request.getRequestURI(),
        principal == null ? null : principal.getName(),
        message);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiErrorResponse.of(message));
  }
}
