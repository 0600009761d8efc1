// order-service/src/main/java/com/orderly/orderservice/dto/OrderItemResponse.java
package com.orderly.orderservice.dto;

import lombok.Builder;
import lombok.Data;
import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
public class OrderItemResponse {
    private UUID id;
    private String productId;
    private String productName;
    private Integer quantity;
    private BigDecimal unitPrice; // price at order time
    private BigDecimal totalPrice;
}
