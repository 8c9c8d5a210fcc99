package com.slipsafe.claims.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Centralized error handling for the claims API. Issuance and input errors become JSON
 * {@code {error, message}} bodies; verification failures never reach here because they are
 * returned as structured outcomes.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(FieldError::getField,
                        e -> e.getDefaultMessage() != null ? e.getDefaultMessage() : "invalid",
                        (first, second) -> first));
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "VALIDATION_FAILED", "details", errors));
    }

    @ExceptionHandler(PurchaseNotFoundException.class)
    public ResponseEntity<Map<String, String>> handlePurchaseNotFound(PurchaseNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "PURCHASE_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(FraudEventNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleFraudEventNotFound(FraudEventNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "FRAUD_EVENT_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(NotOwnerException.class)
    public ResponseEntity<Map<String, String>> handleNotOwner(NotOwnerException ex) {
        return error(HttpStatus.FORBIDDEN, "NOT_OWNER", ex.getMessage());
    }

    @ExceptionHandler(MerchantAccessDeniedException.class)
    public ResponseEntity<Map<String, String>> handleMerchantAccessDenied(MerchantAccessDeniedException ex) {
        return error(HttpStatus.FORBIDDEN, "MERCHANT_ACCESS_DENIED", ex.getMessage());
    }

    @ExceptionHandler(InvalidClaimTypeException.class)
    public ResponseEntity<Map<String, String>> handleInvalidClaimType(InvalidClaimTypeException ex) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_CLAIM_TYPE", ex.getMessage());
    }

    @ExceptionHandler(InvalidAmountException.class)
    public ResponseEntity<Map<String, String>> handleInvalidAmount(InvalidAmountException ex) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", "INVALID_AMOUNT");
        body.put("message", ex.getMessage());
        if (ex.getVerificationId() != null) {
            body.put("verificationId", ex.getVerificationId());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(IssuanceInProgressException.class)
    public ResponseEntity<Map<String, String>> handleIssuanceInProgress(IssuanceInProgressException ex) {
        return error(HttpStatus.CONFLICT, "ISSUANCE_IN_PROGRESS", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", getMessageOrCause(ex));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", getMessageOrCause(ex));
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
        return ResponseEntity
                .status(status)
                .body(Map.of("error", code, "message", message != null ? message : code));
    }

    private static String getMessageOrCause(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return t.getMessage();
            }
            t = t.getCause();
        }
        return ex.getClass().getSimpleName();
    }
}
