package com.orderly.common.exception;

/**
 * Exception thrown when an order or product identifier does not resolve
 * HTTP Status: 404 Not Found (set in GlobalExceptionHandler)
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
