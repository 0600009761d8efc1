package com.orderly.orderservice.model;

public enum ProductStatus {
    ACTIVE,   // Can be referenced by new order items
    INACTIVE
}
