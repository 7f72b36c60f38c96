package com.kgbio.lookup.controller;

import com.kgbio.lookup.exception.ResultParseException;
import com.kgbio.lookup.exception.UpstreamException;
import com.kgbio.lookup.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the lookup error taxonomy to HTTP: bad input is 400, a failing or misbehaving upstream
 * service is 502, anything else 500.
 */
@RestControllerAdvice
public class GlobalErrorHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBind(WebExchangeBindException ex) {
        List<Map<String, Object>> errors = ex.getAllErrors().stream().map(err -> {
            Map<String, Object> e = new HashMap<>();
            e.put("object", err.getObjectName());
            e.put("code", err.getCode());
            e.put("message", err.getDefaultMessage());
            return e;
        }).collect(Collectors.toList());
        log.warn("Request binding failed: {}", errors);
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("details", errors);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex) {
        log.warn("Input error: {}", ex.getReason());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("reason", ex.getReason());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("reason", ex.getMessage());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<Map<String, Object>> handleUpstream(UpstreamException ex) {
        log.warn("Upstream error: {}", ex.getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "upstream_error");
        body.put("message", ex.getMessage());
        if (ex.getStatus() > 0) body.put("upstream_status", ex.getStatus());
        return ResponseEntity.status(502).body(body);
    }

    @ExceptionHandler(ResultParseException.class)
    public ResponseEntity<Map<String, Object>> handleParse(ResultParseException ex) {
        log.warn("Upstream parse error: {}", ex.getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "upstream_parse_error");
        body.put("message", ex.getMessage());
        return ResponseEntity.status(502).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleOther(Exception ex) {
        log.warn("Unhandled error: {}", ex.toString());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "server_error");
        body.put("exception", ex.getClass().getSimpleName());
        body.put("message", ex.getMessage());
        return ResponseEntity.status(500).body(body);
    }
}
