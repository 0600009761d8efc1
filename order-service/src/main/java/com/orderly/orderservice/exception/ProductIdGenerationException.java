package com.orderly.orderservice.exception;

/**
 * No unused product ID could be allocated within the configured number of attempts.
 * HTTP Status: 500 Internal Server Error
 */
public class ProductIdGenerationException extends RuntimeException {

    public ProductIdGenerationException(String message) {
        super(message);
    }
}
