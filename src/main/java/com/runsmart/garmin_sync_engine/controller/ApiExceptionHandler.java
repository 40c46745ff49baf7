package com.runsmart.garmin_sync_engine.controller;

import com.runsmart.garmin_sync_engine.exception.GarminAuthException;
import com.runsmart.garmin_sync_engine.exception.GarminStorageException;
import com.runsmart.garmin_sync_engine.exception.GarminValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(GarminAuthException.class)
    public ResponseEntity<Map<String, String>> handleAuth(GarminAuthException e) {
        return error(HttpStatus.UNAUTHORIZED, "GARMIN_AUTH", e.getMessage());
    }

    @ExceptionHandler({GarminValidationException.class, MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(GarminStorageException.class)
    public ResponseEntity<Map<String, String>> handleStorage(GarminStorageException e) {
        logger.error("Storage failure: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR", "Storage failure");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception e) {
        logger.error("Unhandled error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error");
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of("code", code, "message", String.valueOf(message)));
    }
}
