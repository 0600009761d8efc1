package com.orderly.orderservice.model;

public enum PaymentStatus {
    PENDING,
    SENDER_PAY,
    RECEIVER_PAY,
    PREPAID,
    COD
}
