package com.orderly.orderservice.dto;

import com.orderly.orderservice.model.ProductStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductRequest {

    @NotBlank(message = "Product name is required")
    private String name;

    private String description;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0.0", message = "Price must be zero or positive")
    private BigDecimal price;

    @Size(max = 10, message = "Currency must be at most 10 characters")
    private String currency;

    @PositiveOrZero(message = "Stock must be zero or positive")
    private Integer stock;

    private ProductStatus status;
}
