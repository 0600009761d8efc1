package com.orderly.orderservice.dto;

import jakarta.validation.Valid;
import lombok.Data;

@Data
public class ShippingRequest {

    @Valid
    private ShippingAddressDto address;
}
