package io.intellixity.relata.examples.web;

import io.intellixity.relata.persistence.error.*;
import io.intellixity.relata.persistence.query.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the engine's error taxonomy to HTTP.
 * <p>
 * Aborted writes are mapped by their cause: a unique violation is 409, a missing connect target 404,
 * a cardinality breach 422; anything else is a backend failure (500).
 */
@RestControllerAdvice
public final class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({DirectiveValidationException.class, QueryValidationException.class, IllegalArgumentException.class})
  public ResponseEntity<Map<String, Object>> invalid(RuntimeException e) {
    return body(HttpStatus.BAD_REQUEST, e);
  }

  @ExceptionHandler({CardinalityViolationException.class, ChainCardinalityException.class, ConstraintCycleException.class})
  public ResponseEntity<Map<String, Object>> unprocessable(RelationException e) {
    return body(HttpStatus.UNPROCESSABLE_ENTITY, e);
  }

  @ExceptionHandler(UniqueTargetNotFoundException.class)
  public ResponseEntity<Map<String, Object>> notFound(UniqueTargetNotFoundException e) {
    return body(HttpStatus.NOT_FOUND, e);
  }

  @ExceptionHandler(UniqueConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> conflict(UniqueConstraintViolationException e) {
    return body(HttpStatus.CONFLICT, e);
  }

  @ExceptionHandler(TransactionAbortedException.class)
  public ResponseEntity<Map<String, Object>> aborted(TransactionAbortedException e) {
    Throwable cause = e.getCause();
    if (cause instanceof UniqueConstraintViolationException c) return conflict(c);
    if (cause instanceof UniqueTargetNotFoundException nf) return notFound(nf);
    if (cause instanceof CardinalityViolationException cv) return unprocessable(cv);
    log.error("relata.api aborted path={}", e.path(), e);
    return body(HttpStatus.INTERNAL_SERVER_ERROR, e);
  }

  private static ResponseEntity<Map<String, Object>> body(HttpStatus status, RuntimeException e) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("status", status.value());
    m.put("error", e.getClass().getSimpleName());
    m.put("message", e.getMessage());
    if (e instanceof RelationException re && re.path() != null) m.put("path", re.path().toString());
    if (status.is4xxClientError()) log.debug("relata.api rejected status={} error={} message={}", status.value(), m.get("error"), e.getMessage());
    return ResponseEntity.status(status).body(m);
  }
}
