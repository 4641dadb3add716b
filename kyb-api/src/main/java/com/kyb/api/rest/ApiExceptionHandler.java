package com.kyb.api.rest;

import com.kyb.core.exception.KybException;
import com.kyb.core.exception.ResultNotFoundException;
import com.kyb.core.exception.StorageException;
import com.kyb.core.exception.UnknownCustomerException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps dashboard exceptions to consistent error bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public static final String INVALID_REQUEST = "INVALID_REQUEST";

    @ExceptionHandler(ResultNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResultNotFound(
            ResultNotFoundException ex, HttpServletRequest request) {
        log.warn("Result not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(UnknownCustomerException.class)
    public ResponseEntity<ErrorResponse> handleUnknownCustomer(
            UnknownCustomerException ex, HttpServletRequest request) {
        log.warn("Unknown customer: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(
            StorageException ex, HttpServletRequest request) {
        log.error("Storage failure: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(KybException.class)
    public ResponseEntity<ErrorResponse> handleKyb(
            KybException ex, HttpServletRequest request) {
        log.error("Request failed: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleInvalidRequest(
            Exception ex, HttpServletRequest request) {
        log.warn("Invalid request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, INVALID_REQUEST, ex.getMessage(), request);
    }

    private static ResponseEntity<ErrorResponse> error(
            HttpStatus status, String errorCode, String message, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(
            errorCode,
            message,
            status.value(),
            Instant.now(),
            request.getRequestURI()
        );
        return ResponseEntity.status(status).body(body);
    }

    public record ErrorResponse(
        String errorCode,
        String message,
        int status,
        Instant timestamp,
        String path
    ) {}
}
