package com.orderly.orderservice.exception;

/**
 * No unused order code could be allocated within the configured number of attempts.
 * HTTP Status: 500 Internal Server Error
 */
public class OrderCodeGenerationException extends RuntimeException {

    public OrderCodeGenerationException(String message) {
        super(message);
    }
}
