package com.hold.api.common;

import com.hold.application.ports.InvoiceStoreException;
import com.hold.application.service.HoldInvoiceException;
import com.hold.application.service.InvalidInvoiceException;
import com.hold.application.service.InvoiceNotFoundException;
import com.hold.domain.invoice.InvalidInvoiceTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(HoldInvoiceException.class)
  public ResponseEntity<Map<String, Object>> refused(HoldInvoiceException ex) {
    return error(statusOf(ex), ex.reason(), ex.getMessage());
  }

  @ExceptionHandler(InvalidInvoiceTransitionException.class)
  public ResponseEntity<Map<String, Object>> conflict(InvalidInvoiceTransitionException ex) {
    return error(HttpStatus.CONFLICT, "invalid_transition", ex.getMessage());
  }

  @ExceptionHandler(InvoiceStoreException.class)
  public ResponseEntity<Map<String, Object>> store(InvoiceStoreException ex) {
    log.error("Invoice store failure", ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "store_error", "invoice store unavailable");
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
  }

  @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
  public ResponseEntity<Map<String, Object>> malformed(Exception ex) {
    return error(HttpStatus.BAD_REQUEST, "malformed_request", "request could not be read");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
    Map<String, String> fields = new HashMap<>();
    for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
      fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
    }
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
        "status", "error",
        "reason", "validation_error",
        "message", "invalid_request",
        "fields", fields,
        "ts", Instant.now().toString()
    ));
  }

  // duplicates and state conflicts are 409
  private static HttpStatus statusOf(HoldInvoiceException ex) {
    if (ex instanceof InvoiceNotFoundException) return HttpStatus.NOT_FOUND;
    if (ex instanceof InvalidInvoiceException) return HttpStatus.BAD_REQUEST;
    return HttpStatus.CONFLICT;
  }

  private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String reason, String message) {
    return ResponseEntity.status(status).body(Map.of(
        "status", "error",
        "reason", reason,
        "message", message == null ? "invalid_request" : message,
        "ts", Instant.now().toString()
    ));
  }
}
