package com.orderly.orderservice.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ShipperDto {
    private String shipperId;
    private String name;
    private String phone;
    private String vehicleType; // motorbike | car | truck
}
