package com.orderly.orderservice.dto;

import com.orderly.orderservice.model.ProductStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
public class ProductResponse {
    private String id;
    private String name;
    private String description;
    private BigDecimal price;
    private String currency;
    private Integer stock;
    private ProductStatus status;
    private Instant createdAt;
    private Instant updatedAt;
}
