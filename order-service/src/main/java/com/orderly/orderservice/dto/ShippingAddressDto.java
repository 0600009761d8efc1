package com.orderly.orderservice.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ShippingAddressDto {

    private String receiverName;

    @Size(max = 30, message = "Receiver phone must be at most 30 characters")
    private String receiverPhone;

    @Size(max = 500, message = "Address must be at most 500 characters")
    private String fullAddress;
}
