package com.monitoring.platform.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps operator API failures to {@code {"error": CODE, "message": ...}} bodies. Codes:
 * INVALID_ALERT_REQUEST (bean validation, with per-field {@code fields}), UNREADABLE_REQUEST,
 * INVALID_PARAMETER and MONITORING_FAILURE.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidAlert(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new TreeMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(error.getField(),
                    error.getDefaultMessage() != null ? error.getDefaultMessage() : "rejected value");
        }
        Map<String, Object> body = body("INVALID_ALERT_REQUEST",
                "Alert request rejected: " + fields.size() + " invalid field(s)");
        body.put("fields", fields);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable operator request: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(body("UNREADABLE_REQUEST", "Request body is not valid JSON or contains unknown values"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidParameter(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(body("INVALID_PARAMETER", firstMessage(ex)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleFailure(Exception ex) {
        log.error("Operator request failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("MONITORING_FAILURE", firstMessage(ex)));
    }

    private static Map<String, Object> body(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return body;
    }

    /** First non-blank message along the cause chain, else the exception's simple name. */
    private static String firstMessage(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return t.getMessage();
            }
        }
        return ex.getClass().getSimpleName();
    }
}
