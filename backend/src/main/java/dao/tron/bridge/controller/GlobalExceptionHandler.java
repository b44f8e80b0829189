package dao.tron.bridge.controller;

import dao.tron.bridge.exception.BridgeErrorCode;
import dao.tron.bridge.exception.BridgeException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps bridge errors to HTTP responses carrying the error code and the state values behind it.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BridgeException.class)
    public ResponseEntity<ErrorResponse> handleBridgeException(BridgeException ex) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError() || ex.getCode() == BridgeErrorCode.TRANSFER_FAILED) {
            log.error("{} [{}]: {} {}", ex.getCode(), ex.getCategory(), ex.getMessage(), ex.getDetails());
        } else {
            log.warn("{} [{}]: {} {}", ex.getCode(), ex.getCategory(), ex.getMessage(), ex.getDetails());
        }
        ErrorResponse error = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(ex.getCode().name())
                .category(ex.getCategory().name())
                .message(ex.getMessage())
                .details(ex.getDetails())
                .build();
        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, Object> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(field, error.getDefaultMessage());
        });
        log.warn("Validation failed: {}", errors);
        return badRequest("Invalid input parameters", errors);
    }

    /**
     * A request without a caller identity is unauthorized, like a blank one.
     */
    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
        if (!BridgeController.CALLER_HEADER.equalsIgnoreCase(ex.getHeaderName())) {
            return handleMalformedRequest(ex);
        }
        log.warn("{} [{}]: request without {} header", BridgeErrorCode.UNAUTHORIZED,
                BridgeErrorCode.UNAUTHORIZED.getCategory(), BridgeController.CALLER_HEADER);
        ErrorResponse error = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(HttpStatus.FORBIDDEN.value())
                .error(BridgeErrorCode.UNAUTHORIZED.name())
                .category(BridgeErrorCode.UNAUTHORIZED.getCategory().name())
                .message("Caller identity is required")
                .details(Map.of("header", BridgeController.CALLER_HEADER))
                .build();
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return badRequest(ex.getMessage(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error: ", ex);
        ErrorResponse error = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error("INTERNAL_ERROR")
                .message("An unexpected error occurred")
                .details(Map.of())
                .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ErrorResponse> badRequest(String message, Map<String, Object> details) {
        ErrorResponse error = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error("VALIDATION_FAILED")
                .category("VALIDATION")
                .message(message)
                .details(details)
                .build();
        return ResponseEntity.badRequest().body(error);
    }

    static HttpStatus statusOf(BridgeException ex) {
        if (ex.getCode() == BridgeErrorCode.UNKNOWN_PROPOSAL || ex.getCode() == BridgeErrorCode.UNKNOWN_TRANSACTION) {
            return HttpStatus.NOT_FOUND;
        }
        switch (ex.getCategory()) {
            case AUTHORIZATION:
                return HttpStatus.FORBIDDEN;
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case STATE_CONFLICT:
                return HttpStatus.CONFLICT;
            case LIMIT_EXCEEDED:
                return HttpStatus.TOO_MANY_REQUESTS;
            case RESOURCE:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorResponse {
        private Instant timestamp;
        private int status;
        private String error;
        private String category;
        private String message;
        private Map<String, Object> details;
    }
}
