package com.flagship.impact_ledger.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the ledger error taxonomy onto HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ApiError> handleLedgerException(LedgerException e) {
        HttpStatus status = statusFor(e.getKind());
        if (e.getKind().isConflict()) {
            log.info("Ledger conflict [{}]: {}", e.getKind(), e.getMessage());
        } else {
            log.warn("Ledger request rejected [{}]: {}", e.getKind(), e.getMessage());
        }

        return ResponseEntity.status(status).body(ApiError.builder()
            .error(status.getReasonPhrase())
            .kind(e.getKind())
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
            .error("Missing Required Header")
            .kind(ErrorKind.VALIDATION_ERROR)
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
            .error("Validation Failed")
            .kind(ErrorKind.VALIDATION_ERROR)
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleBadParameter(Exception e) {
        log.warn("Bad request parameter: {}", e.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
            .error("Invalid Request")
            .kind(ErrorKind.VALIDATION_ERROR)
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
            .error("Invalid Request")
            .kind(ErrorKind.VALIDATION_ERROR)
            .message("Request body could not be parsed")
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handleDataIntegrity(DataIntegrityViolationException e) {
        log.warn("Constraint violation: {}", e.getMostSpecificCause().getMessage());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiError.builder()
            .error("Conflict")
            .kind(ErrorKind.CONSTRAINT_VIOLATION)
            .message("The request conflicts with existing ledger data")
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build());
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_VALUE, VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case ALREADY_REDEEMED, INVALID_TRANSITION, CONSTRAINT_VIOLATION -> HttpStatus.CONFLICT;
        };
    }
}
