package com.orderly.orderservice.model;

public enum OrderStatus {
    DRAFT,
    PENDING,    // Cancelling from here must go through the shipment provider first
    CONFIRMED,  // Default after a successful creation
    CANCELLED,
    COMPLETED
}
