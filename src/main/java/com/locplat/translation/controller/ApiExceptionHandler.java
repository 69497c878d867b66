package com.locplat.translation.controller;

import com.locplat.translation.dto.ApiError;
import com.locplat.translation.service.InvalidTranslationRequestException;
import com.locplat.translation.service.ThrottledException;
import com.locplat.translation.service.TranslationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidTranslationRequestException.class)
    public ResponseEntity<ApiError> handleInvalidRequest(InvalidTranslationRequestException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), List.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException e) {
        List<String> details = e.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .toList();
        return error(HttpStatus.BAD_REQUEST, "Request validation failed", details);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), List.of());
    }

    @ExceptionHandler(ThrottledException.class)
    public ResponseEntity<ApiError> handleThrottled(ThrottledException e) {
        logger.warn("Request throttled by provider {}: {}", e.getProvider(), e.getMessage());
        return error(HttpStatus.TOO_MANY_REQUESTS, e.getMessage(), List.of());
    }

    @ExceptionHandler(TranslationException.class)
    public ResponseEntity<ApiError> handleTranslation(TranslationException e) {
        logger.error("Translation provider {} failed: {}", e.getProvider(), e.getMessage(), e);
        return error(HttpStatus.BAD_GATEWAY, e.getMessage(), List.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception e) {
        logger.error("Unexpected error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected server error", List.of());
    }

    private ResponseEntity<ApiError> error(HttpStatus status, String message, List<String> details) {
        return ResponseEntity.status(status)
                .body(ApiError.of(status.value(), status.getReasonPhrase(), message, details));
    }
}
