package com.vendinghive.controller;

import com.vendinghive.exception.DuplicateExclusionException;
import com.vendinghive.exception.InvalidRequestException;
import com.vendinghive.exception.ResourceNotFoundException;
import com.vendinghive.exception.SearchCancelledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * 도메인 예외 -> {success:false, message[, field]} 응답
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(InvalidRequestException e) {
        log.info("[GlobalExceptionHandler] invalid request - field: {}, message: {}", e.getField(), e.getMessage());
        Map<String, Object> body = errorBody(e.getMessage());
        body.put("field", e.getField());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingHeader(MissingRequestHeaderException e) {
        Map<String, Object> body = errorBody("Missing required header: " + e.getHeaderName());
        body.put("field", e.getHeaderName());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception e) {
        return ResponseEntity.badRequest().body(errorBody("Malformed request"));
    }

    @ExceptionHandler(DuplicateExclusionException.class)
    public ResponseEntity<Map<String, Object>> handleDuplicate(DuplicateExclusionException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorBody(e.getMessage()));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorBody(e.getMessage()));
    }

    @ExceptionHandler(SearchCancelledException.class)
    public ResponseEntity<Map<String, Object>> handleCancelled(SearchCancelledException e) {
        log.warn("[GlobalExceptionHandler] search cancelled: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(errorBody("Search was cancelled"));
    }

    private Map<String, Object> errorBody(String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", false);
        body.put("message", message);
        return body;
    }
}
