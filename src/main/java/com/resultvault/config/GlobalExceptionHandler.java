package com.resultvault.config;

import com.resultvault.storage.ResultNotFoundException;
import com.resultvault.storage.ResultStorageException;
import com.resultvault.util.CorrelationIdFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ResultNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleResultNotFound(ResultNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "ResultNotFound", ex.getMessage());
    }

    @ExceptionHandler(ResultStorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorageException(ResultStorageException ex) {
        logger.error("Storage operation failed", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "StorageError", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "IllegalArgument", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        logger.error("Unhandled exception", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getClass().getSimpleName(),
                ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred");
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String error, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("error", error);
        response.put("message", message);
        response.put("timestamp", Instant.now().toString());
        response.put("traceId", MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY));
        return ResponseEntity.status(status).body(response);
    }
}
