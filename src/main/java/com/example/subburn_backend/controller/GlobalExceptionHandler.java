package com.example.subburn_backend.controller;

import com.example.subburn_backend.dto.web.ApiError;
import com.example.subburn_backend.exception.IngressValidationException;
import com.example.subburn_backend.exception.PipelineBusyException;
import com.example.subburn_backend.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps ingress failures to HTTP responses. Pipeline failures never get here; they travel on the event stream.
 */
@RestControllerAdvice
class GlobalExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IngressValidationException.class)
    ResponseEntity<ApiError> handleIngressValidation(IngressValidationException ex) {
        LOGGER.warn("Upload rejected code={} msg={}", ex.getCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiError(ex.getMessage(), ex.getCode(), Instant.now()));
    }

    @ExceptionHandler(PipelineBusyException.class)
    ResponseEntity<ApiError> handleBusy(PipelineBusyException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiError(ex.getMessage(), "PIPELINE_BUSY", Instant.now()));
    }

    @ExceptionHandler(StorageException.class)
    ResponseEntity<ApiError> handleStorage(StorageException ex) {
        LOGGER.error("Storage failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("Could not store the upload", "STORAGE_FAILED", Instant.now()));
    }
}
