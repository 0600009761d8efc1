package com.orderly.orderservice.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Business-rule rejection of a request that passed bean validation,
 * e.g. an inactive product or paging arguments out of range.
 * HTTP Status: 400 Bad Request
 */
@Getter
public class OrderValidationException extends RuntimeException {

    // field path -> message, empty when the problem is not tied to a field
    private final Map<String, String> errors;

    public OrderValidationException(String message) {
        this(message, Collections.emptyMap());
    }

    public OrderValidationException(String message, Map<String, String> errors) {
        super(message);
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public static OrderValidationException forField(String field, String message) {
        return new OrderValidationException(message, Map.of(field, message));
    }
}
