package com.dnmm.pool.service.web;

import com.dnmm.pool.error.PoolEngineException;
import com.dnmm.pool.error.PoolErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class PoolExceptionHandler {

  @ExceptionHandler(PoolEngineException.class)
  public ResponseEntity<ErrorResponse> handle(PoolEngineException e) {
    HttpStatus status = statusFor(e.code());
    log.debug("pool error: status={} code={} details={}", status.value(), e.code(), e.details());
    return ResponseEntity.status(status).body(new ErrorResponse(e.code().name(), e.getMessage(), e.details()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    Map<String, Object> details = new LinkedHashMap<>();
    e.getBindingResult().getFieldErrors().forEach(fe -> details.put(fe.getField(), fe.getDefaultMessage()));
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(new ErrorResponse(PoolErrorCode.INVALID_AMOUNT.name(), "request validation failed", details));
  }

  static HttpStatus statusFor(PoolErrorCode code) {
    return switch (code.category()) {
      case PRICE_DATA -> HttpStatus.SERVICE_UNAVAILABLE;
      case POLICY -> HttpStatus.CONFLICT;
      case INPUT -> HttpStatus.UNPROCESSABLE_ENTITY;
    };
  }

  public record ErrorResponse(String code, String message, Map<String, Object> details) {
  }
}
