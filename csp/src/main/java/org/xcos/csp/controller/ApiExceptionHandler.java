package org.xcos.csp.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.xcos.csp.exceptions.CspException;
import org.xcos.csp.exceptions.InvalidModelException;
import org.xcos.csp.exceptions.ModelNotFoundException;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps failures that escape the controllers onto HTTP statuses. Solve failures never get
 * here; they are part of the solve result.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ModelNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ModelNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("detail", e.getMessage()));
    }

    @ExceptionHandler(InvalidModelException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidModel(InvalidModelException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("message", e.getMessage());
        body.put("errors", e.getErrors());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(Map.of("status", "error", "message", "Malformed request body: " + e.getMostSpecificCause().getMessage()));
    }

    // Compilation failures and unsupported requests are client input errors
    @ExceptionHandler(CspException.class)
    public ResponseEntity<Map<String, Object>> handleCspException(CspException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("status", "error", "message", e.getMessage()));
    }
}
