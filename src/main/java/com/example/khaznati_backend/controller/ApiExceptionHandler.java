package com.example.khaznati_backend.controller;

import com.example.khaznati_backend.dto.web.ErrorResponse;
import com.example.khaznati_backend.exception.BackendUnavailableException;
import com.example.khaznati_backend.exception.ConflictException;
import com.example.khaznati_backend.exception.IncompleteException;
import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.exception.QuotaExceededException;
import com.example.khaznati_backend.exception.StorageException;
import com.example.khaznati_backend.exception.ThrottledException;
import com.example.khaznati_backend.exception.TransferCancelledException;
import com.example.khaznati_backend.exception.TransferTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the storage error taxonomy to HTTP statuses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(NotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "NOT_FOUND", e);
    }

    @ExceptionHandler({ConflictException.class, TransferCancelledException.class})
    public ResponseEntity<ErrorResponse> conflict(StorageException e) {
        return body(HttpStatus.CONFLICT, "CONFLICT", e);
    }

    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<ErrorResponse> quota(QuotaExceededException e) {
        return body(HttpStatus.PAYLOAD_TOO_LARGE, "QUOTA_EXCEEDED", e);
    }

    @ExceptionHandler(ThrottledException.class)
    public ResponseEntity<ErrorResponse> throttled(ThrottledException e) {
        long seconds = Math.max(1, e.getRetryAfter().toSeconds());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds))
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("THROTTLED", e.getMessage()));
    }

    @ExceptionHandler(BackendUnavailableException.class)
    public ResponseEntity<ErrorResponse> unavailable(BackendUnavailableException e) {
        LOGGER.warn("Backend unavailable: {}", e.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "BACKEND_UNAVAILABLE", e);
    }

    @ExceptionHandler(TransferTimeoutException.class)
    public ResponseEntity<ErrorResponse> timeout(TransferTimeoutException e) {
        return body(HttpStatus.GATEWAY_TIMEOUT, "TIMEOUT", e);
    }

    @ExceptionHandler(IncompleteException.class)
    public ResponseEntity<ErrorResponse> incomplete(IncompleteException e) {
        LOGGER.error("Incomplete content: {}", e.getMessage());
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INCOMPLETE", e);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> storage(StorageException e) {
        LOGGER.error("Storage failure", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR", e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .findFirst()
                .orElse("invalid request");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("BAD_REQUEST", message));
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String code, Exception e) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse(code, e.getMessage()));
    }
}
