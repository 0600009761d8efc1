package com.orderly.orderservice.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.UUID;

/**
 * Status push from the shipment provider or an operator tool.
 * orderId / orderCode are optional; when sent they must match the order
 * addressed by the path.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ExternalStatusUpdateRequest extends OrderUpdateRequest {

    private UUID orderId;

    private String orderCode;
}
