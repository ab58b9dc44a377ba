package com.precojusto.cronbatch.controller;

import com.precojusto.cronbatch.controller.dto.ApiErrorResponse;
import com.precojusto.cronbatch.exception.BatchEngineException;
import com.precojusto.cronbatch.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(error -> fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage()));
        return build(ErrorCode.VALIDATION_ERROR, ErrorCode.VALIDATION_ERROR.getDefaultMessage(), fieldErrors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return build(ErrorCode.BAD_REQUEST, "Malformed request body", null);
    }

    @ExceptionHandler(BatchEngineException.class)
    public ResponseEntity<ApiErrorResponse> handleEngine(BatchEngineException ex) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.getHttpStatus() >= 500) {
            log.error("Server error: {}", ex.getMessage(), ex);
        } else {
            log.warn("Client error: {}", ex.getMessage());
        }
        return build(errorCode, ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex) {
        log.error("Unexpected error", ex);
        String message = ex.getMessage() != null ? ex.getMessage() : ErrorCode.INTERNAL_ERROR.getDefaultMessage();
        return build(ErrorCode.INTERNAL_ERROR, message, null);
    }

    private ResponseEntity<ApiErrorResponse> build(ErrorCode errorCode, String message,
            Map<String, String> fieldErrors) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .error(message)
                .code(errorCode.name())
                .timestamp(clock.instant())
                .fieldErrors(fieldErrors)
                .build();
        return ResponseEntity.status(errorCode.getHttpStatus()).body(body);
    }
}
