package com.presales.outreach.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.*;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  ResponseEntity<?> validation(MethodArgumentNotValidException ex){
    String message = ex.getBindingResult().getFieldError() == null
        ? "Validation error"
        : ex.getBindingResult().getFieldError().getField() + ": "
            + Objects.toString(ex.getBindingResult().getFieldError().getDefaultMessage(), "invalid value");
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", false);
    body.put("code", "VALIDATION_ERROR");
    body.put("message", message);
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  ResponseEntity<?> unreadable(HttpMessageNotReadableException ex) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", false);
    body.put("code", "MALFORMED_REQUEST");
    body.put("message", "Request body could not be parsed");
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler(OutreachException.class)
  ResponseEntity<?> outreach(OutreachException ex) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", false);
    body.put("code", ex.code());
    body.put("message", Objects.toString(ex.getMessage(), "Outreach error"));
    ex.hint().ifPresent(hint -> body.put("hint", hint));
    ex.details().ifPresent(details -> body.put("details", details));
    return ResponseEntity.status(ex.status()).body(body);
  }

  @ExceptionHandler(IllegalStateException.class)
  ResponseEntity<?> illegalState(IllegalStateException ex){
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", false);
    body.put("code", "BUSINESS_ERROR");
    body.put("message", Objects.toString(ex.getMessage(), "Business rule violation"));
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler(Exception.class)
  ResponseEntity<?> generic(Exception ex){
    log.error("Unhandled API error", ex);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", false);
    body.put("code", "INTERNAL_ERROR");
    body.put("message", Objects.toString(ex.getMessage(), ex.getClass().getSimpleName()));
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
  }
}
