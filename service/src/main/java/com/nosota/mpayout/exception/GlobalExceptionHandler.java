package com.nosota.mpayout.exception;

import com.nosota.mpayout.dto.ErrorResponse;
import com.nosota.mpayout.error.AccountVerificationFailedException;
import com.nosota.mpayout.error.DuplicatePayoutException;
import com.nosota.mpayout.error.InsufficientFundsException;
import com.nosota.mpayout.error.PayoutTransactionNotFoundException;
import com.nosota.mpayout.error.PayoutValidationException;
import com.nosota.mpayout.error.ProviderRejectedException;
import com.nosota.mpayout.error.ProviderUnavailableException;
import com.nosota.mpayout.error.WalletNotFoundException;
import jakarta.persistence.EntityNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
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

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(PayoutValidationException.class)
    public ResponseEntity<ErrorResponse> handlePayoutValidation(
            PayoutValidationException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Payout validation failed [correlationId={}]: field={}, {}", correlationId, ex.getField(), ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Error",
                ex.getMessage(),
                request.getRequestURI(),
                Map.of("field", ex.getField())
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        FieldError fieldError = ex.getBindingResult().getFieldError();
        String field = fieldError != null ? fieldError.getField() : "request";
        String message = fieldError != null ? field + " " + fieldError.getDefaultMessage() : "Invalid request";
        log.warn("Request validation failed [correlationId={}]: {}", correlationId, message);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Error",
                message,
                request.getRequestURI(),
                Map.of("field", field)
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Malformed request [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Error",
                ex instanceof HttpMessageNotReadableException
                        ? "Malformed request body. Transfer mode must be IMPS or NEFT and amounts must be numeric"
                        : ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(DuplicatePayoutException.class)
    public ResponseEntity<ErrorResponse> handleDuplicatePayout(
            DuplicatePayoutException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Duplicate payout rejected [correlationId={}]: prior={}, waitSeconds={}",
                correlationId, ex.getPriorTransactionId(), ex.getWaitSeconds());

        Map<String, Object> recentTransaction = new LinkedHashMap<>();
        recentTransaction.put("id", ex.getPriorTransactionId());
        recentTransaction.put("status", ex.getPriorStatus());
        recentTransaction.put("amount", ex.getPriorAmount());
        recentTransaction.put("createdAt", ex.getPriorCreatedAt());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("waitSeconds", ex.getWaitSeconds());
        details.put("recentTransaction", recentTransaction);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.TOO_MANY_REQUESTS.value(),
                "Duplicate Request",
                ex.getMessage(),
                request.getRequestURI(),
                details
        );
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(error);
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientFunds(
            InsufficientFundsException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Insufficient funds [correlationId={}]: {}", correlationId, ex.getMessage());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("walletBalance", ex.getWalletBalance());
        if (ex.getAmount() != null) {
            details.put("amount", ex.getAmount());
            details.put("charge", ex.getCharge());
        }
        details.put("totalRequired", ex.getTotalRequired());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Insufficient Funds",
                ex.getMessage(),
                request.getRequestURI(),
                details
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(ProviderRejectedException.class)
    public ResponseEntity<ErrorResponse> handleProviderRejected(
            ProviderRejectedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Provider rejected payout [correlationId={}]: transactionId={}, {}",
                correlationId, ex.getTransactionId(), ex.getMessage());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("transactionId", ex.getTransactionId());
        details.put("clientRefId", ex.getClientRefId());
        details.put("refunded", true);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Transfer Failed",
                ex.getMessage() + ". Amount has been refunded to your wallet.",
                request.getRequestURI(),
                details
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(AccountVerificationFailedException.class)
    public ResponseEntity<ErrorResponse> handleAccountVerificationFailed(
            AccountVerificationFailedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Account verification failed [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Verification Failed",
                ex.getMessage(),
                request.getRequestURI(),
                Map.of("valid", false)
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleProviderUnavailable(
            ProviderUnavailableException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Payout provider unavailable [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.SERVICE_UNAVAILABLE.value(),
                "Service Unavailable",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    @ExceptionHandler(WalletNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleWalletNotFound(
            WalletNotFoundException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Wallet not found [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.NOT_FOUND.value(),
                "Wallet Not Found",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler({PayoutTransactionNotFoundException.class, EntityNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleTransactionNotFound(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Transaction not found [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.NOT_FOUND.value(),
                "Transaction Not Found",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Illegal argument [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Invalid Argument",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(
            IllegalStateException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Illegal state [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT.value(),
                "Invalid State",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrityViolation(
            DataIntegrityViolationException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Data integrity violation [correlationId={}]: {}", correlationId, ex.getMostSpecificCause().getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT.value(),
                "Conflict",
                "The request conflicts with an existing transfer (client reference id already used?)",
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Unexpected error [correlationId={}]", correlationId, ex);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "An unexpected error occurred. Please contact support with correlation ID: " + correlationId,
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
