package com.tokenledger.exception;

import com.tokenledger.dto.ApiResponses;
import com.tokenledger.service.RejectionReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Centralized exception mapper for all REST endpoints.
 *
 * EXCEPTION → HTTP STATUS MAPPING:
 *
 * Exception Type                        | HTTP Status | When
 * --------------------------------------|-------------|------------------------------------------
 * TransactionRejectedException          | 400 / 409   | INVALID_AMOUNT → 400, other rejections → 409
 * IllegalArgumentException              | 400         | Unknown type, blank source, bad limit
 * HttpMessageNotReadableException       | 400         | Malformed JSON or unknown enum value
 * MethodArgumentNotValidException       | 400         | Bean Validation failure on DTO fields
 * NoSuchElementException                | 404         | Account / transaction not found
 * IllegalStateException                 | 409         | Accounting invariant violation
 * DataIntegrityViolationException       | 409         | DB unique constraint (concurrent dupe ref)
 * StorageUnavailableException           | 503         | Database unreachable or lock timeout
 * Exception (fallback)                  | 500         | Unexpected system errors
 *
 * RULES:
 * - Rejection responses carry the stable reason code as {@code error}
 * - No stack traces in responses
 * - All responses use ErrorResponse shape, except the validation field map
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // ─────────────────────────────────────────────────────────────────────────
    // REJECTIONS - typed outcomes from the processor
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(TransactionRejectedException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleRejected(TransactionRejectedException ex) {
        HttpStatus status = ex.getReason() == RejectionReason.INVALID_AMOUNT
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.CONFLICT;
        return ResponseEntity
                .status(status)
                .body(new ApiResponses.ErrorResponse(ex.getReason().code(), ex.getMessage()));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 400 BAD REQUEST - Invalid input
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse("BAD_REQUEST", ex.getMessage()));
    }

    /**
     * Unparseable bodies, including an unknown transaction type string.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getMostSpecificCause();
        String message = cause instanceof IllegalArgumentException
                ? cause.getMessage()
                : "Malformed request body";
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse("BAD_REQUEST", message));
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ApiResponses.ErrorResponse> handleBadParameter(Exception ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse("BAD_REQUEST", ex.getMessage()));
    }

    /**
     * Handles @Valid/@NotNull/@Size annotation failures on request DTOs.
     * Returns a field → message map instead of generic error for clearer API feedback.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = ((FieldError) error).getField();
            errors.put(field, error.getDefaultMessage());
        });
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 404 / 405
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleNotFound(NoSuchElementException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ApiResponses.ErrorResponse("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ApiResponses.ErrorResponse("NOT_FOUND", "No endpoint " + ex.getResourcePath()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return ResponseEntity
                .status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(new ApiResponses.ErrorResponse("METHOD_NOT_ALLOWED", ex.getMessage()));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 409 CONFLICT - State violation
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Invariant violations from TokenAccount / AccountService / TransactionProcessor.
     * The unit of work has already been rolled back.
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleIllegalState(IllegalStateException ex) {
        log.error("Invariant violation: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ApiResponses.ErrorResponse("CONFLICT", ex.getMessage()));
    }

    /**
     * Unique constraint hit on (account_id, reference_id). The processor checks
     * the key under the account lock, so this only surfaces if that check was bypassed.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex) {
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ApiResponses.ErrorResponse(
                        "CONFLICT",
                        "Duplicate transaction detected. " +
                        "Retry with the same referenceId to retrieve the existing entry."
                ));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 503 / 500
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleStorageUnavailable(StorageUnavailableException ex) {
        log.error("Storage unavailable: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiResponses.ErrorResponse(
                        "STORAGE_UNAVAILABLE",
                        "The ledger store is temporarily unavailable. Please retry."
                ));
    }

    /**
     * Safety net for any unhandled exception.
     * Message is deliberately generic; internal detail must not leak to clients.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiResponses.ErrorResponse(
                        "INTERNAL_SERVER_ERROR",
                        "An unexpected error occurred. Please contact support."
                ));
    }
}
