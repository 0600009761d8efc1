package com.orderly.orderservice.dto;

import com.orderly.orderservice.model.ShippingStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class ShippingResponse {
    private String shippingOrderCode;
    private ShippingStatus status;
    private ShippingAddressDto address;
    private ShipperDto shipper;
    private Instant estimatedDeliveryTime;
    private Instant deliveredAt;
    private String failedReason;
}
