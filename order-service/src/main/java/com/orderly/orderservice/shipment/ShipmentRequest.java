package com.orderly.orderservice.shipment;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

// Body of POST {shipment.base-url}/api/shipments
@Data
@Builder
public class ShipmentRequest {

    private String orderCode;

    // The customer ships to themselves, so sender and receiver mostly coincide
    private String senderName;
    private String senderPhone;
    private String senderAddress;
    private String senderCity;
    private String senderDistrict;
    private String senderWard;

    private String receiverName;
    private String receiverPhone;
    private String receiverAddress;
    private String receiverCity;
    private String receiverDistrict;
    private String receiverWard;

    private BigDecimal packageWeight;
    private BigDecimal packageLength;
    private BigDecimal packageWidth;
    private BigDecimal packageHeight;
    private BigDecimal packageValue;
    private String packageDescription;

    private BigDecimal shippingFee;
    private BigDecimal codAmount;

    private Instant estimatedPickupTime;
    private Instant estimatedDeliveryTime;
    private Instant actualPickupTime;
    private Instant actualDeliveryTime;

    private String carrierCode;
    private String serviceType;
    private String createdBy;

    private List<ShipmentItemPayload> items;
}
