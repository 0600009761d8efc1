package com.orderly.orderservice.shipment;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

// Body of PUT {shipment.base-url}/api/shipments/{orderCode}/status
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ShipmentStatusRequest {
    private String status;
}
