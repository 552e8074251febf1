package com.irondust.catalog.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Error bodies for the description endpoints.
 *
 * <ul>
 *   <li>{@code invalid_product} (400): the product JSON parsed but failed validation,
 *       one violation per offending field</li>
 *   <li>{@code unreadable_request} (400): the body could not be decoded at all</li>
 *   <li>{@code server_error} (500): anything else; section failures never get here
 *       because the assembler turns them into diagnostics</li>
 * </ul>
 */
@RestControllerAdvice
public class GlobalErrorHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidProduct(WebExchangeBindException ex) {
        List<Map<String, Object>> violations = ex.getFieldErrors().stream()
                .map(GlobalErrorHandler::violation)
                .collect(Collectors.toList());
        log.warn("Rejected product with {} invalid field(s): {}", violations.size(), violations);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "invalid_product");
        body.put("violations", violations);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(ServerWebInputException ex) {
        log.warn("Unreadable description request: {}", ex.getReason());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "unreadable_request");
        body.put("reason", ex.getReason());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleOther(Exception ex) {
        log.error("Description request failed: {}", ex.toString(), ex);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "server_error");
        body.put("exception", ex.getClass().getSimpleName());
        body.put("message", ex.getMessage());
        return ResponseEntity.status(500).body(body);
    }

    private static Map<String, Object> violation(FieldError err) {
        Map<String, Object> v = new LinkedHashMap<>();
        v.put("field", err.getField());
        v.put("rejected", String.valueOf(err.getRejectedValue()));
        v.put("message", err.getDefaultMessage());
        return v;
    }
}
