package com.orderly.orderservice.exception;

/**
 * Writing an order failed after the shipment provider had already accepted it.
 * HTTP Status: 500 Internal Server Error
 */
public class OrderPersistenceException extends RuntimeException {

    private final String shippingOrderCode;

    public OrderPersistenceException(String message, String shippingOrderCode, Throwable cause) {
        super(message, cause);
        this.shippingOrderCode = shippingOrderCode;
    }

    public String getShippingOrderCode() {
        return shippingOrderCode;
    }
}
