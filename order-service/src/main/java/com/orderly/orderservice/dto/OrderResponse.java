// order-service/src/main/java/com/orderly/orderservice/dto/OrderResponse.java
package com.orderly.orderservice.dto;

import com.orderly.orderservice.model.OrderStatus;
import com.orderly.orderservice.model.PaymentMethod;
import com.orderly.orderservice.model.PaymentStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class OrderResponse {
    private UUID id;
    private String orderCode;
    private CustomerDto customer;
    private List<OrderItemResponse> items;
    private PricingResponse pricing;
    private ShippingResponse shipping;
    private OrderStatus orderStatus;
    private PaymentMethod paymentMethod;
    private PaymentStatus paymentStatus;
    private Instant createdAt;
    private Instant updatedAt;
}
