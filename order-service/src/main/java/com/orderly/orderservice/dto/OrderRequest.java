// order-service/src/main/java/com/orderly/orderservice/dto/OrderRequest.java
package com.orderly.orderservice.dto;

import com.orderly.orderservice.model.PaymentMethod;
import com.orderly.orderservice.model.PaymentStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

// Clients may post the whole order document; orderCode, item prices and
// subtotal/totalAmount are not bound here and are always computed server-side.
@Data
public class OrderRequest {

    @NotNull(message = "Customer cannot be null")
    @Valid
    private CustomerDto customer;

    @NotEmpty(message = "Order must contain at least one item")
    @Valid // Triggers validation for each OrderItemRequest in the list
    private List<@NotNull(message = "Order item cannot be null") OrderItemRequest> items;

    @Valid
    private PricingRequest pricing;

    @Valid
    private ShippingRequest shipping;

    private PaymentMethod paymentMethod;

    private PaymentStatus paymentStatus;
}
