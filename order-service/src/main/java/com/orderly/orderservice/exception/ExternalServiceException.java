package com.orderly.orderservice.exception;

/**
 * The shipment provider refused, timed out or could not be reached,
 * and the local change was not made.
 * HTTP Status: 502 Bad Gateway
 */
public class ExternalServiceException extends RuntimeException {

    public ExternalServiceException(String message) {
        super(message);
    }
}
