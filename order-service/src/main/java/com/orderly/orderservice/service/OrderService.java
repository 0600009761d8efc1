package com.orderly.orderservice.service;

import com.orderly.orderservice.dto.ExternalStatusUpdateRequest;
import com.orderly.orderservice.dto.OrderRequest;
import com.orderly.orderservice.dto.OrderResponse;
import com.orderly.orderservice.dto.OrderUpdateRequest;
import com.orderly.orderservice.dto.PaymentMethodResponse;

import java.util.List;
import java.util.UUID;

public interface OrderService {

    /**
     * Prices the cart, registers a shipment with the provider and stores the order.
     * Nothing is stored unless the provider accepted the shipment.
     */
    OrderResponse createOrder(OrderRequest request);

    List<OrderResponse> getOrders(Integer skip, Integer limit);

    OrderResponse getOrderById(UUID id);

    OrderResponse getOrderByCode(String orderCode);

    /**
     * Applies a sparse update. Cancelling a PENDING order cancels its shipment
     * at the provider first and leaves the order untouched if that fails.
     */
    OrderResponse updateOrder(String orderCode, OrderUpdateRequest request);

    OrderResponse cancelOrder(String orderCode);

    // Provider/operator push; never calls the provider back
    OrderResponse applyExternalStatusUpdate(String orderCode, ExternalStatusUpdateRequest request);

    List<PaymentMethodResponse> getPaymentMethods();
}
