package com.orderly.orderservice.shipment;

import com.orderly.orderservice.dto.ShipperDto;
import lombok.Data;

// What we read back from a successful shipment creation. All fields optional.
@Data
public class ShipmentResponse {
    private String shippingOrderCode;
    private String status;
    private ShipperDto shipper;
    // Kept as text, an unparseable value must not fail an accepted shipment
    private String estimatedDeliveryTime;
    private String orderStatus;
}
