package com.orderly.orderservice.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

// Only the inputs the server does not derive itself
@Data
public class PricingRequest {

    @PositiveOrZero(message = "Shipping fee must be zero or positive")
    @Digits(integer = 17, fraction = 2, message = "Shipping fee must have at most 2 decimal places")
    private BigDecimal shippingFee;

    @PositiveOrZero(message = "Discount must be zero or positive")
    @Digits(integer = 17, fraction = 2, message = "Discount must have at most 2 decimal places")
    private BigDecimal discount;

    @Size(max = 10, message = "Currency must be at most 10 characters")
    private String currency;
}
