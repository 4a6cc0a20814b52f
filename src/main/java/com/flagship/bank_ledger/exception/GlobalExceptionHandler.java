package com.flagship.bank_ledger.exception;

import com.flagship.bank_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps typed ledger failures and request errors to HTTP responses.
 *
 * Status mapping:
 * - INVALID_AMOUNT, SAME_ACCOUNT: 400
 * - ACCOUNT_NOT_FOUND, USER_NOT_FOUND: 404
 * - DUPLICATE_USERNAME: 409
 * - INSUFFICIENT_FUNDS: 422
 * - STORAGE_UNAVAILABLE: 503
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ApiError> handleLedgerException(LedgerException e) {
        HttpStatus status = statusFor(e.getErrorCode());
        if (e.isRetryable()) {
            log.error("Ledger operation aborted: code={}, message={}", e.getErrorCode(), e.getMessage(), e);
        } else {
            log.warn("Ledger operation rejected: code={}, message={}", e.getErrorCode(), e.getMessage());
        }

        ApiError error = ApiError.builder()
            .error(status.getReasonPhrase())
            .code(e.getErrorCode())
            .message(e.getMessage())
            .retryable(e.isRetryable())
            .correlationId(currentCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(error);
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

        ApiError error = ApiError.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .correlationId(currentCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadableRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());

        ApiError error = ApiError.builder()
            .error("Invalid Request")
            .message("Malformed request body or parameter")
            .correlationId(currentCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiError> handleDataAccess(DataAccessException e) {
        log.error("Storage failure outside an atomic scope", e);

        ApiError error = ApiError.builder()
            .error(HttpStatus.SERVICE_UNAVAILABLE.getReasonPhrase())
            .code(ErrorCode.STORAGE_UNAVAILABLE)
            .message("Storage is temporarily unavailable")
            .retryable(true)
            .correlationId(currentCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .correlationId(currentCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(ErrorCode code) {
        switch (code) {
            case INVALID_AMOUNT:
            case SAME_ACCOUNT:
                return HttpStatus.BAD_REQUEST;
            case ACCOUNT_NOT_FOUND:
            case USER_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case DUPLICATE_USERNAME:
                return HttpStatus.CONFLICT;
            case INSUFFICIENT_FUNDS:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case STORAGE_UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private String currentCorrelationId() {
        return MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY);
    }
}
