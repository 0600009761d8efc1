package com.orderly.orderservice.service;

import com.orderly.orderservice.dto.OrderUpdateRequest;
import com.orderly.orderservice.mapper.OrderMapper;
import com.orderly.orderservice.model.Order;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Copies the non-null fields of a sparse update onto an order.
 * Plain assignment only, so applying the same update again changes nothing.
 */
@Component
@RequiredArgsConstructor
public class OrderStatusProjector {

    private final OrderMapper orderMapper;

    /**
     * @return names of the fields that were present in the update
     */
    public List<String> apply(Order order, OrderUpdateRequest update) {
        List<String> applied = new ArrayList<>();

        if (update.getOrderStatus() != null) {
            order.setOrderStatus(update.getOrderStatus());
            applied.add("orderStatus");
        }
        if (update.getPaymentStatus() != null) {
            order.setPaymentStatus(update.getPaymentStatus());
            applied.add("paymentStatus");
        }
        if (update.getShippingStatus() != null) {
            order.setShippingStatus(update.getShippingStatus());
            applied.add("shippingStatus");
        }
        if (update.getShippingOrderCode() != null) {
            order.setShippingOrderCode(update.getShippingOrderCode());
            applied.add("shippingOrderCode");
        }
        if (update.getShipper() != null) {
            // replaced as a whole, not merged field by field
            order.setShipper(orderMapper.toShipper(update.getShipper()));
            applied.add("shipper");
        }
        if (update.getEstimatedDeliveryTime() != null) {
            order.setEstimatedDeliveryTime(update.getEstimatedDeliveryTime());
            applied.add("estimatedDeliveryTime");
        }
        if (update.getDeliveredAt() != null) {
            order.setDeliveredAt(update.getDeliveredAt());
            applied.add("deliveredAt");
        }
        if (update.getFailedReason() != null) {
            order.setFailedReason(update.getFailedReason());
            applied.add("failedReason");
        }
        return applied;
    }
}
