package com.orderly.orderservice.exception;

import com.orderly.common.dto.ErrorResponse;
import com.orderly.common.dto.ValidationErrorResponse;
import com.orderly.common.exception.ResourceNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String message, String errorCode,
                                                String correlationId, HttpServletRequest request) {
        ErrorResponse errorResponse = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .errorCode(errorCode)
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, status);
    }

    private ResponseEntity<ValidationErrorResponse> validationError(String message, Map<String, String> errors,
                                                                    String correlationId, HttpServletRequest request) {
        ValidationErrorResponse errorResponse = ValidationErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .message(message)
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .validationErrors(errors)
                .errorCode("VALIDATION_FAILED")
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request) {

        return error(HttpStatus.NOT_FOUND, ex.getMessage(), "RESOURCE_NOT_FOUND", generateCorrelationId(), request);
    }

    @ExceptionHandler(OrderValidationException.class)
    public ResponseEntity<ValidationErrorResponse> handleOrderValidationException(
            OrderValidationException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.debug("[{}] Request rejected - Path: {} - Reason: {}", correlationId, request.getRequestURI(), ex.getMessage());

        return validationError(ex.getMessage(), ex.getErrors(), correlationId, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        Map<String, String> validationErrors = new LinkedHashMap<>();

        ex.getBindingResult().getAllErrors().forEach(error -> {
            if (error instanceof FieldError fieldError) {
                validationErrors.putIfAbsent(fieldError.getField(), error.getDefaultMessage());
            } else {
                validationErrors.putIfAbsent(error.getObjectName(), error.getDefaultMessage());
            }
        });

        String correlationId = generateCorrelationId();
        log.debug("[{}] Validation failed - Path: {} - Errors: {}", correlationId, request.getRequestURI(), validationErrors);

        return validationError("Validation failed", validationErrors, correlationId, request);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            Exception ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.debug("[{}] Malformed request - Path: {} - {}", correlationId, request.getRequestURI(), ex.getMessage());

        String message = ex instanceof MethodArgumentTypeMismatchException mismatch
                ? "Invalid value for parameter '" + mismatch.getName() + "'"
                : "Malformed request body or parameters";

        return error(HttpStatus.BAD_REQUEST, message, "MALFORMED_REQUEST", correlationId, request);
    }

    @ExceptionHandler(ExternalServiceException.class)
    public ResponseEntity<ErrorResponse> handleExternalServiceException(
            ExternalServiceException ex,
            HttpServletRequest request) {

        return error(HttpStatus.BAD_GATEWAY, ex.getMessage(), "EXTERNAL_SERVICE_ERROR", generateCorrelationId(), request);
    }

    /**
     * Two writers raced on the same order row. The caller should re-read and retry.
     */
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLockingFailureException(
            OptimisticLockingFailureException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.warn("[{}] Optimistic locking conflict detected - Path: {} - Caller should retry",
                correlationId, request.getRequestURI());

        return error(HttpStatus.CONFLICT, "The resource was modified concurrently. Please refresh and try again.",
                "CONCURRENT_MODIFICATION", correlationId, request);
    }

    @ExceptionHandler(OrderCodeGenerationException.class)
    public ResponseEntity<ErrorResponse> handleOrderCodeGenerationException(
            OrderCodeGenerationException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.error("[{}] {} - Path: {}", correlationId, ex.getMessage(), request.getRequestURI());

        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Could not allocate an order code. Please try again.",
                "ORDER_CODE_EXHAUSTED", correlationId, request);
    }

    @ExceptionHandler(ProductIdGenerationException.class)
    public ResponseEntity<ErrorResponse> handleProductIdGenerationException(
            ProductIdGenerationException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.error("[{}] {} - Path: {}", correlationId, ex.getMessage(), request.getRequestURI());

        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Could not allocate a product ID. Please try again.",
                "PRODUCT_ID_EXHAUSTED", correlationId, request);
    }

    @ExceptionHandler(OrderPersistenceException.class)
    public ResponseEntity<ErrorResponse> handleOrderPersistenceException(
            OrderPersistenceException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.error("[{}] Order could not be stored - Path: {} - shippingOrderCode={}",
                correlationId, request.getRequestURI(), ex.getShippingOrderCode(), ex);

        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), "PERSISTENCE_FAILED", correlationId, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(
            Exception ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.error("[{}] Unexpected error occurred - Path: {} - Exception: {}",
                correlationId,
                request.getRequestURI(),
                ex.getMessage(),
                ex);

        return error(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please contact support if the problem persists.",
                "INTERNAL_SERVER_ERROR", correlationId, request);
    }
}
