package com.guardianintel.claims.exception;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.guardianintel.claims.config.RequestIdFilter;

import lombok.extern.slf4j.Slf4j;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(CarrierException.class)
    public ResponseEntity<Map<String, Object>> handleCarrierError(CarrierException ex) {
        log.error("Carrier failure [{}] {}: {}", ex.getCarrierCode(), ex.getCarrierErrorCode(), ex.getMessage());
        Map<String, Object> body = body(HttpStatus.BAD_GATEWAY, ex.getErrorCode(), ex.getMessage());
        body.put("carrier", ex.getCarrierCode());
        body.put("carrier_error_code", ex.getCarrierErrorCode());
        body.put("retryable", ex.isRetryable());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(ClaimsException.class)
    public ResponseEntity<Map<String, Object>> handleClaimsError(ClaimsException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("Claims error {}: {}", ex.getErrorCode(), ex.getMessage());
        } else {
            log.warn("Claims error {}: {}", ex.getErrorCode(), ex.getMessage());
        }
        Map<String, Object> body = body(status, ex.getErrorCode(), ex.getMessage());
        body.put("retryable", ex.isRetryable());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAuthError(AccessDeniedException ex) {
        log.warn("Security Alert: Unauthorized access attempt.");
        return buildResponse(HttpStatus.FORBIDDEN, "ACCESS_DENIED", "You do not have permission to perform this action.");
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadInput(Exception ex) {
        log.warn("Validation Error: {}", ex.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getMostSpecificCause();
        log.warn("Unreadable request body: {}", cause.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Malformed request body: " + cause.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handle404(NoResourceFoundException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, "NOT_FOUND", "Endpoint does not exist.");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        log.error("Unhandled System Exception", ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected system error occurred.");
    }

    static HttpStatus statusFor(ClaimsException ex) {
        if (ex instanceof ValidationException) return HttpStatus.BAD_REQUEST;
        if (ex instanceof NotFoundException) return HttpStatus.NOT_FOUND;
        if (ex instanceof InvalidTransitionException) return HttpStatus.CONFLICT;
        if (ex instanceof ConcurrencyConflictException) return HttpStatus.CONFLICT;
        if (ex instanceof InvariantViolationException) return HttpStatus.UNPROCESSABLE_ENTITY;
        if (ex instanceof UnsupportedCarrierOperationException) return HttpStatus.UNPROCESSABLE_ENTITY;
        if (ex instanceof CarrierTimeoutException) return HttpStatus.GATEWAY_TIMEOUT;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private ResponseEntity<Map<String, Object>> buildResponse(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(body(status, code, message));
    }

    private Map<String, Object> body(HttpStatus status, String code, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error_code", code);
        body.put("message", message);
        body.put("trace_id", MDC.get(RequestIdFilter.TRACE_ID)); // Include the ID for support tickets
        return body;
    }
}
