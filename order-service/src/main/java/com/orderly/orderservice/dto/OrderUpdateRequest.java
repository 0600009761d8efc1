package com.orderly.orderservice.dto;

import com.orderly.orderservice.model.OrderStatus;
import com.orderly.orderservice.model.PaymentStatus;
import com.orderly.orderservice.model.ShippingStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.Instant;

/**
 * Sparse update of an existing order. Only non-null fields are applied.
 */
@Data
public class OrderUpdateRequest {

    private OrderStatus orderStatus;

    private PaymentStatus paymentStatus;

    private ShippingStatus shippingStatus;

    @Size(max = 100, message = "Shipping order code must be at most 100 characters")
    private String shippingOrderCode;

    @Valid
    private ShipperDto shipper;

    private Instant estimatedDeliveryTime;

    private Instant deliveredAt;

    @Size(max = 500, message = "Failed reason must be at most 500 characters")
    private String failedReason;
}
