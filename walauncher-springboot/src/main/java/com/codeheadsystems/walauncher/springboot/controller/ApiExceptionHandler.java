package com.codeheadsystems.walauncher.springboot.controller;

import com.codeheadsystems.walauncher.model.ErrorResponse;
import com.codeheadsystems.walauncher.server.exceptions.TokenExchangeException;
import com.codeheadsystems.walauncher.server.store.PersistenceException;
import com.codeheadsystems.walauncher.server.store.UnknownTenantException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the core's exception contract onto HTTP responses. Security failures all get the same
 * body; the specific reason is only logged.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(SecurityException.class)
  public ResponseEntity<ErrorResponse> handleSecurity(SecurityException e) {
    log.warn("Request rejected: {}", e.getClass().getSimpleName());
    return respond(HttpStatus.UNAUTHORIZED, "unauthorized", "Authentication failed");
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
    log.debug("Bad request: {}", e.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
    return respond(HttpStatus.BAD_REQUEST, "bad_request", "Malformed request body");
  }

  @ExceptionHandler(UnknownTenantException.class)
  public ResponseEntity<ErrorResponse> handleUnknownTenant(UnknownTenantException e) {
    return respond(HttpStatus.NOT_FOUND, "not_installed", "Shop is not installed");
  }

  @ExceptionHandler(TokenExchangeException.class)
  public ResponseEntity<ErrorResponse> handleTokenExchange(TokenExchangeException e) {
    return respond(HttpStatus.BAD_GATEWAY, "token_exchange_failed", "Token exchange failed");
  }

  @ExceptionHandler(PersistenceException.class)
  public ResponseEntity<ErrorResponse> handlePersistence(PersistenceException e) {
    log.error("Persistence failure", e);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleOther(Exception e) {
    if (e instanceof org.springframework.web.ErrorResponse framework) {
      HttpStatusCode status = framework.getStatusCode();
      return respond(status, status.is4xxClientError() ? "bad_request" : "internal_error",
          status.is4xxClientError() ? "Request could not be processed" : "Internal server error");
    }
    log.error("Unhandled exception", e);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error");
  }

  private static ResponseEntity<ErrorResponse> respond(HttpStatusCode status, String error, String message) {
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(new ErrorResponse(error, message));
  }
}
