package org.neurobagel.api.server.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import org.neurobagel.api.core.exception.CriteriaValidationException;
import org.neurobagel.api.core.exception.QueryException;
import org.neurobagel.api.core.exception.ServerException;
import org.neurobagel.api.core.exception.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps service exceptions to HTTP statuses: rejected criteria are the caller's fault (422), rejected
 * store credentials are reported as 401, store failures as 500.
 */
@Slf4j
@RestControllerAdvice
public class RestExceptionHandler {

  @ExceptionHandler(CriteriaValidationException.class)
  public ResponseEntity<ErrorResponse> handleInvalidCriteria(CriteriaValidationException ex) {
    log.debug("handleInvalidCriteria; field: {}, message: {}", ex.getField(), ex.getMessage());
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(new ErrorResponse("invalid_criteria", ex.getMessage()));
  }

  @ExceptionHandler(UnauthorizedException.class)
  public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedException ex) {
    log.warn("handleUnauthorized; {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(new ErrorResponse("unauthorized", ex.getMessage()));
  }

  @ExceptionHandler(QueryException.class)
  public ResponseEntity<ErrorResponse> handleQueryFailure(QueryException ex) {
    log.error("handleQueryFailure; {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorResponse("query_failed", ex.getMessage()));
  }

  @ExceptionHandler(ServerException.class)
  public ResponseEntity<ErrorResponse> handleServerError(ServerException ex) {
    log.error("handleServerError; {}", ex.getMessage(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorResponse("server_error", ex.getMessage()));
  }
}
