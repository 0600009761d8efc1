package com.orderly.orderservice.shipment;

import com.orderly.orderservice.model.Order;

/**
 * Synchronous client for the external shipment provider.
 * Implementations never throw: every failure mode is reported through
 * {@link ShipmentResult}.
 */
public interface ShipmentGatewayClient {

    /**
     * Registers a shipment for an order that is built but not yet persisted.
     */
    ShipmentResult createShipment(Order order);

    /**
     * Asks the provider to cancel the shipment registered under the order code.
     */
    ShipmentResult cancelShipment(String orderCode);
}
